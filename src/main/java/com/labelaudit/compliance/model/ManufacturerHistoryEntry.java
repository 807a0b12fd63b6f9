package com.labelaudit.compliance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One longitudinal compliance event for a manufacturer. Append-only: written once,
 * never updated or removed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ManufacturerHistoryEntry {
    private final String manufacturerKey;
    /** Name as it appeared on the label, before normalization */
    private final String manufacturerName;
    private final String productIdentifier;
    private final double score;
    private final int requiredPresent;
    private final int requiredTotal;
    private final String catalogueVersion;
    private final List<FieldName> missingRequired;
    private final ProductCategory category;
    private final String productTitle;
    private final Instant timestamp;

    @JsonCreator
    public ManufacturerHistoryEntry(@JsonProperty("manufacturerKey") String manufacturerKey,
                                    @JsonProperty("manufacturerName") String manufacturerName,
                                    @JsonProperty("productIdentifier") String productIdentifier,
                                    @JsonProperty("score") double score,
                                    @JsonProperty("requiredPresent") int requiredPresent,
                                    @JsonProperty("requiredTotal") int requiredTotal,
                                    @JsonProperty("catalogueVersion") String catalogueVersion,
                                    @JsonProperty("missingRequired") List<FieldName> missingRequired,
                                    @JsonProperty("category") ProductCategory category,
                                    @JsonProperty("productTitle") String productTitle,
                                    @JsonProperty("timestamp") Instant timestamp) {
        this.manufacturerKey = Objects.requireNonNull(manufacturerKey, "manufacturerKey");
        this.manufacturerName = manufacturerName;
        this.productIdentifier = Objects.requireNonNull(productIdentifier, "productIdentifier");
        this.score = score;
        this.requiredPresent = requiredPresent;
        this.requiredTotal = requiredTotal;
        this.catalogueVersion = catalogueVersion;
        this.missingRequired = missingRequired == null ? List.of() : List.copyOf(missingRequired);
        this.category = category == null ? ProductCategory.GENERAL : category;
        this.productTitle = productTitle;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    /**
     * Builds the entry for a finalized evaluation.
     */
    public static ManufacturerHistoryEntry from(String manufacturerKey, String manufacturerName,
                                                ComplianceResult result, String productTitle, Instant timestamp) {
        return new ManufacturerHistoryEntry(manufacturerKey, manufacturerName, result.getProductIdentifier(),
                result.getScore(), result.getRequiredPresent(), result.getRequiredTotal(),
                result.getCatalogueVersion(), List.copyOf(result.getMissingRequired()),
                ProductCategory.classify(productTitle), productTitle, timestamp);
    }

    public String getManufacturerKey() { return manufacturerKey; }
    public String getManufacturerName() { return manufacturerName; }
    public String getProductIdentifier() { return productIdentifier; }
    public double getScore() { return score; }
    public int getRequiredPresent() { return requiredPresent; }
    public int getRequiredTotal() { return requiredTotal; }
    public String getCatalogueVersion() { return catalogueVersion; }
    public List<FieldName> getMissingRequired() { return missingRequired; }
    public ProductCategory getCategory() { return category; }
    public String getProductTitle() { return productTitle; }
    public Instant getTimestamp() { return timestamp; }

    /** Deduplication key: the same product scanned at the same instant is one event. */
    @JsonIgnore
    public String getCompositeKey() {
        return productIdentifier + "@" + timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ManufacturerHistoryEntry)) return false;
        ManufacturerHistoryEntry e = (ManufacturerHistoryEntry) o;
        return manufacturerKey.equals(e.manufacturerKey) && getCompositeKey().equals(e.getCompositeKey());
    }

    @Override
    public int hashCode() {
        return Objects.hash(manufacturerKey, productIdentifier, timestamp);
    }

    @Override
    public String toString() {
        return "ManufacturerHistoryEntry{" + manufacturerKey + " " + getCompositeKey() + " score=" + score + "}";
    }
}
