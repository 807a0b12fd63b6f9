package com.labelaudit.compliance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed catalogue of mandatory and optional disclosure fields a packaging label
 * can carry. Candidate values naming anything outside this set never reach the
 * merge stage.
 */
public enum FieldName {
    NET_QUANTITY("net_quantity"),
    MRP("mrp"),
    MANUFACTURER_NAME("manufacturer_name"),
    COUNTRY_OF_ORIGIN("country_of_origin"),
    CONSUMER_CARE("consumer_care"),
    MANUFACTURE_DATE("manufacture_date"),
    BEST_BEFORE("best_before"),
    BATCH_NUMBER("batch_number"),
    LICENSE_NUMBER("license_number"),
    BARCODE("barcode");

    private final String key;

    FieldName(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    /**
     * Resolves a wire key ("net_quantity", "NET_QUANTITY", " Net_Quantity ") to a field.
     */
    public static Optional<FieldName> fromKey(String key) {
        if (key == null || key.isBlank()) return Optional.empty();
        String k = key.trim().toLowerCase(Locale.ROOT);
        for (FieldName f : values()) {
            if (f.key.equals(k)) return Optional.of(f);
        }
        return Optional.empty();
    }

    @JsonCreator
    public static FieldName fromJson(String key) {
        return fromKey(key).orElseThrow(() -> new IllegalArgumentException("Unknown field: " + key));
    }

    @Override
    public String toString() {
        return key;
    }
}
