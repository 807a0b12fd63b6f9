package com.labelaudit.compliance.service.history;

import com.labelaudit.compliance.model.ManufacturerProfile;

/**
 * What happened to the history update of one evaluation. The evaluation itself
 * succeeded whatever the status.
 */
public final class TrackingOutcome {

    public enum Status {
        /** Entry appended and profile updated */
        RECORDED,
        /** Same product and timestamp already recorded; nothing appended */
        DUPLICATE,
        /** The history store failed; the evaluation result is still valid */
        NOT_RECORDED,
        /** No manufacturer identity to record against */
        SKIPPED
    }

    private final Status status;
    private final String manufacturerKey;
    private final ManufacturerProfile profile;
    private final String message;

    private TrackingOutcome(Status status, String manufacturerKey, ManufacturerProfile profile, String message) {
        this.status = status;
        this.manufacturerKey = manufacturerKey;
        this.profile = profile;
        this.message = message;
    }

    public static TrackingOutcome recorded(ManufacturerProfile profile) {
        return new TrackingOutcome(Status.RECORDED, profile.getManufacturerKey(), profile, null);
    }

    public static TrackingOutcome duplicate(ManufacturerProfile profile) {
        return new TrackingOutcome(Status.DUPLICATE, profile.getManufacturerKey(), profile,
                "Entry already recorded; history unchanged");
    }

    public static TrackingOutcome notRecorded(String manufacturerKey, String message) {
        return new TrackingOutcome(Status.NOT_RECORDED, manufacturerKey, null, message);
    }

    public static TrackingOutcome skipped(String message) {
        return new TrackingOutcome(Status.SKIPPED, null, null, message);
    }

    public Status getStatus() { return status; }
    public String getManufacturerKey() { return manufacturerKey; }
    /** Null unless RECORDED or DUPLICATE */
    public ManufacturerProfile getProfile() { return profile; }
    public String getMessage() { return message; }

    public boolean hasProfile() {
        return profile != null;
    }

    @Override
    public String toString() {
        return status + (manufacturerKey != null ? " " + manufacturerKey : "") + (message != null ? ": " + message : "");
    }
}
