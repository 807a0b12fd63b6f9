package com.labelaudit.compliance.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Banding of a compliance score used for reporting and manufacturer distributions.
 */
public enum ComplianceLevel {
    EXCELLENT(0.9),
    GOOD(0.75),
    FAIR(0.5),
    POOR(0.0);

    private final double floor;

    ComplianceLevel(double floor) {
        this.floor = floor;
    }

    public double getFloor() { return floor; }

    public static ComplianceLevel of(double score) {
        for (ComplianceLevel level : values()) {
            if (score >= level.floor) return level;
        }
        return POOR;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
