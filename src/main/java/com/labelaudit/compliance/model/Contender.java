package com.labelaudit.compliance.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Audit trail entry: one value that competed for a merged field and whether the
 * merge format check accepted it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Contender {
    private final SourceType source;
    private final String value;
    private final double confidence;
    private final boolean accepted;
    /** Why the value was not usable; null when accepted */
    private final String rejection;

    public Contender(SourceType source, String value, double confidence, boolean accepted, String rejection) {
        this.source = source;
        this.value = value;
        this.confidence = confidence;
        this.accepted = accepted;
        this.rejection = rejection;
    }

    public SourceType getSource() { return source; }
    public String getValue() { return value; }
    public double getConfidence() { return confidence; }
    public boolean isAccepted() { return accepted; }
    public String getRejection() { return rejection; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Contender)) return false;
        Contender c = (Contender) o;
        return Double.compare(c.confidence, confidence) == 0 && accepted == c.accepted
                && source == c.source && Objects.equals(value, c.value) && Objects.equals(rejection, c.rejection);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, value, confidence, accepted, rejection);
    }

    @Override
    public String toString() {
        return source + ":" + value + (accepted ? "" : " (" + rejection + ")");
    }
}
