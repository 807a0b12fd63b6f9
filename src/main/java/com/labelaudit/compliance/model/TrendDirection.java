package com.labelaudit.compliance.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TrendDirection {
    IMPROVING,
    DECLINING,
    STABLE,
    /** Fewer than two full trend windows recorded */
    INSUFFICIENT_DATA;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
