package com.labelaudit.compliance.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of evaluating one merged record against one rule catalogue version.
 *
 * <p>{@code score} counts required fields only; its denominator is the number of
 * required fields in the catalogue the result names in {@link #getCatalogueVersion()}.
 * Ordered collections follow catalogue order.
 */
public final class ComplianceResult {
    private final String productIdentifier;
    private final String catalogueVersion;
    private final int requiredPresent;
    private final int requiredTotal;
    private final Set<FieldName> missingRequired;
    private final Set<FieldName> missingOptional;
    private final Map<FieldName, FieldStatus> perFieldStatus;
    private final Instant evaluatedAt;

    public ComplianceResult(String productIdentifier, String catalogueVersion, int requiredPresent, int requiredTotal,
                            Set<FieldName> missingRequired, Set<FieldName> missingOptional,
                            Map<FieldName, FieldStatus> perFieldStatus, Instant evaluatedAt) {
        this.productIdentifier = productIdentifier;
        this.catalogueVersion = catalogueVersion;
        this.requiredPresent = requiredPresent;
        this.requiredTotal = requiredTotal;
        this.missingRequired = Collections.unmodifiableSet(new LinkedHashSet<>(missingRequired));
        this.missingOptional = Collections.unmodifiableSet(new LinkedHashSet<>(missingOptional));
        this.perFieldStatus = Collections.unmodifiableMap(new LinkedHashMap<>(perFieldStatus));
        this.evaluatedAt = evaluatedAt;
    }

    public String getProductIdentifier() { return productIdentifier; }
    public String getCatalogueVersion() { return catalogueVersion; }
    public int getRequiredPresent() { return requiredPresent; }
    public int getRequiredTotal() { return requiredTotal; }
    public Set<FieldName> getMissingRequired() { return missingRequired; }
    public Set<FieldName> getMissingOptional() { return missingOptional; }
    public Map<FieldName, FieldStatus> getPerFieldStatus() { return perFieldStatus; }
    public Instant getEvaluatedAt() { return evaluatedAt; }

    /** Fraction of required fields present, in [0,1]. */
    public double getScore() {
        return requiredTotal == 0 ? 0.0 : (double) requiredPresent / requiredTotal;
    }

    /** Score as "X/Y". */
    public String getScoreLabel() {
        return requiredPresent + "/" + requiredTotal;
    }

    public ComplianceLevel getLevel() {
        return ComplianceLevel.of(getScore());
    }

    /** Fields found in the merged record but rejected by their validator. */
    public Set<FieldName> getInvalidFields() {
        Set<FieldName> out = new LinkedHashSet<>();
        perFieldStatus.forEach((f, s) -> {
            if (s == FieldStatus.INVALID) out.add(f);
        });
        return out;
    }

    public FieldStatus statusOf(FieldName field) {
        return perFieldStatus.getOrDefault(field, FieldStatus.MISSING);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComplianceResult)) return false;
        ComplianceResult that = (ComplianceResult) o;
        return requiredPresent == that.requiredPresent
                && requiredTotal == that.requiredTotal
                && Objects.equals(productIdentifier, that.productIdentifier)
                && Objects.equals(catalogueVersion, that.catalogueVersion)
                && missingRequired.equals(that.missingRequired)
                && missingOptional.equals(that.missingOptional)
                && perFieldStatus.equals(that.perFieldStatus)
                && Objects.equals(evaluatedAt, that.evaluatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(productIdentifier, catalogueVersion, requiredPresent, requiredTotal, perFieldStatus);
    }

    @Override
    public String toString() {
        return "ComplianceResult{" + productIdentifier + " " + getScoreLabel() + " v" + catalogueVersion
                + ", missingRequired=" + missingRequired + "}";
    }
}
