package com.labelaudit.compliance.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One source's proposed value for one disclosure field, before merging.
 *
 * <p>The field is kept as the raw key the adapter emitted; the merge engine resolves
 * it against {@link FieldName} and drops anything outside the catalogue.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CandidateField {
    /** Field key as emitted by the adapter, e.g. "mrp" */
    private String field;
    /** Raw value text */
    private String value;
    /** Structured quantity when the source already parsed one */
    private Quantity quantity;
    private SourceType source;
    /** Optional confidence in [0,1]; null means the source default */
    private Double confidence;

    public CandidateField() {}

    public CandidateField(String field, String value, SourceType source, Double confidence) {
        this.field = field;
        this.value = value;
        this.source = source;
        this.confidence = confidence;
    }

    public static CandidateField of(FieldName field, String value, SourceType source) {
        return new CandidateField(field.getKey(), value, source, null);
    }

    public static CandidateField of(FieldName field, String value, SourceType source, double confidence) {
        return new CandidateField(field.getKey(), value, source, confidence);
    }

    public String getField() { return field; }
    public void setField(String field) { this.field = field; }
    public String getValue() { return value; }
    public void setValue(String value) { this.value = value; }
    public Quantity getQuantity() { return quantity; }
    public void setQuantity(Quantity quantity) { this.quantity = quantity; }
    public SourceType getSource() { return source; }
    public void setSource(SourceType source) { this.source = source; }
    public Double getConfidence() { return confidence; }
    public void setConfidence(Double confidence) { this.confidence = confidence; }

    /** Declared confidence, or the source's fixed weight when none was supplied. */
    public double effectiveConfidence() {
        if (confidence != null) return confidence;
        return source != null ? source.getDefaultConfidence() : 0.0;
    }

    @Override
    public String toString() {
        return "CandidateField{" + field + "=" + value + ", source=" + source + ", confidence=" + confidence + "}";
    }
}
