package com.labelaudit.compliance.service.source;

import com.labelaudit.compliance.model.CandidateField;
import com.labelaudit.compliance.model.SourceType;

import java.util.List;
import java.util.Map;

/**
 * Turns one collaborator's raw output into candidate fields tagged with its source.
 * There is exactly one adapter per {@link SourceType}.
 *
 * <p>Adapters translate keys they know into catalogue field names and pass any other
 * key through unchanged; deciding what to drop is the merge engine's job.
 */
public interface SourceAdapter {

    SourceType source();

    /**
     * @param payload parsed JSON-like output of the collaborator (strings, numbers,
     *                lists and nested maps); null yields no candidates
     */
    List<CandidateField> adapt(Map<String, Object> payload);
}
