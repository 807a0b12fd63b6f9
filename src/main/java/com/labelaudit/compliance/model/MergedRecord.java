package com.labelaudit.compliance.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One compliance-evaluable snapshot of a single product. Immutable once built;
 * a field that no source could supply a valid value for is simply absent.
 */
public final class MergedRecord {
    private final String productIdentifier;
    private final Map<FieldName, MergedField> fields;
    private final Instant timestamp;

    public MergedRecord(String productIdentifier, Map<FieldName, MergedField> fields, Instant timestamp) {
        this.productIdentifier = Objects.requireNonNull(productIdentifier, "productIdentifier");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        EnumMap<FieldName, MergedField> copy = new EnumMap<>(FieldName.class);
        copy.putAll(fields);
        this.fields = Collections.unmodifiableMap(copy);
    }

    public String getProductIdentifier() { return productIdentifier; }
    public Map<FieldName, MergedField> getFields() { return fields; }
    public Instant getTimestamp() { return timestamp; }

    public Optional<MergedField> field(FieldName name) {
        return Optional.ofNullable(fields.get(name));
    }

    public Optional<String> value(FieldName name) {
        return field(name).map(MergedField::getValue);
    }

    public boolean has(FieldName name) {
        return fields.containsKey(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MergedRecord)) return false;
        MergedRecord that = (MergedRecord) o;
        return productIdentifier.equals(that.productIdentifier)
                && fields.equals(that.fields)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(productIdentifier, fields, timestamp);
    }

    @Override
    public String toString() {
        return "MergedRecord{" + productIdentifier + ", fields=" + fields.values() + ", at=" + timestamp + "}";
    }
}
