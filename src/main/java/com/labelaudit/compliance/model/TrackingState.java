package com.labelaudit.compliance.model;

/**
 * Lifecycle of a manufacturer key. TRACKED is terminal: keys are only appended to.
 */
public enum TrackingState {
    UNKNOWN,
    TRACKED
}
