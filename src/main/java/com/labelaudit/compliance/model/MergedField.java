package com.labelaudit.compliance.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * The single winning value for a field after conflict resolution, with every
 * contending value kept for audit.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class MergedField {
    private final FieldName field;
    private final String value;
    /** Parsed form of {@link #value} for net_quantity, null otherwise */
    private final Quantity quantity;
    private final SourceType source;
    private final double confidence;
    private final List<Contender> contenders;

    public MergedField(FieldName field, String value, Quantity quantity, SourceType source,
                       double confidence, List<Contender> contenders) {
        this.field = field;
        this.value = value;
        this.quantity = quantity;
        this.source = source;
        this.confidence = confidence;
        this.contenders = List.copyOf(contenders);
    }

    public FieldName getField() { return field; }
    public String getValue() { return value; }
    public Quantity getQuantity() { return quantity; }
    public SourceType getSource() { return source; }
    public double getConfidence() { return confidence; }
    public List<Contender> getContenders() { return contenders; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MergedField)) return false;
        MergedField that = (MergedField) o;
        return Double.compare(that.confidence, confidence) == 0
                && field == that.field
                && Objects.equals(value, that.value)
                && Objects.equals(quantity, that.quantity)
                && source == that.source
                && contenders.equals(that.contenders);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, value, quantity, source, confidence);
    }

    @Override
    public String toString() {
        return field + "=" + value + " [" + source + "]";
    }
}
