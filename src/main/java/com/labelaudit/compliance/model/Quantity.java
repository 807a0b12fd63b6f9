package com.labelaudit.compliance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Net quantity declared on a label: a positive magnitude and a canonical unit
 * (g, kg, mg, ml, l, pcs).
 */
public final class Quantity {
    private final double magnitude;
    private final String unit;

    @JsonCreator
    public Quantity(@JsonProperty("magnitude") double magnitude, @JsonProperty("unit") String unit) {
        this.magnitude = magnitude;
        this.unit = unit;
    }

    public double getMagnitude() { return magnitude; }
    public String getUnit() { return unit; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Quantity)) return false;
        Quantity q = (Quantity) o;
        return Double.compare(q.magnitude, magnitude) == 0 && Objects.equals(unit, q.unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(magnitude, unit);
    }

    @Override
    public String toString() {
        String m = magnitude == Math.rint(magnitude) ? String.valueOf((long) magnitude) : String.valueOf(magnitude);
        return m + " " + unit;
    }
}
