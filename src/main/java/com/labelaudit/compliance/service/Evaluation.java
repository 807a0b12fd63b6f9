package com.labelaudit.compliance.service;

import com.labelaudit.compliance.model.ComplianceResult;
import com.labelaudit.compliance.service.history.TrackingOutcome;
import com.labelaudit.compliance.service.merge.MergeResult;

/** Domain-level outcome of one evaluation, before it is rendered as a report. */
public final class Evaluation {
    private final MergeResult merge;
    private final ComplianceResult compliance;
    private final TrackingOutcome tracking;

    public Evaluation(MergeResult merge, ComplianceResult compliance, TrackingOutcome tracking) {
        this.merge = merge;
        this.compliance = compliance;
        this.tracking = tracking;
    }

    public MergeResult getMerge() { return merge; }
    public ComplianceResult getCompliance() { return compliance; }
    public TrackingOutcome getTracking() { return tracking; }
}
