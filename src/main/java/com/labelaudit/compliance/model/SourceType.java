package com.labelaudit.compliance.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of a candidate field value. Declaration order is merge priority:
 * text recognition beats AI enhancement, which beats platform metadata.
 */
public enum SourceType {
    TEXT_RECOGNITION("text_recognition", 0.9),
    AI_ENHANCEMENT("ai_enhancement", 0.8),
    PLATFORM_METADATA("platform_metadata", 0.6);

    private final String key;
    /** Confidence assumed for candidates that arrive without one */
    private final double defaultConfidence;

    SourceType(String key, double defaultConfidence) {
        this.key = key;
        this.defaultConfidence = defaultConfidence;
    }

    @JsonValue
    public String getKey() { return key; }

    public double getDefaultConfidence() { return defaultConfidence; }
}
