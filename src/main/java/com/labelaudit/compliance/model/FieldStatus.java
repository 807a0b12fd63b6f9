package com.labelaudit.compliance.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FieldStatus {
    PRESENT,
    /** Absent from the merged record */
    MISSING,
    /** Found but malformed; scores like MISSING */
    INVALID;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
