package com.labelaudit.compliance.service.merge;

import com.labelaudit.compliance.exception.InvalidCandidateException;
import com.labelaudit.compliance.model.CandidateField;
import com.labelaudit.compliance.model.Contender;
import com.labelaudit.compliance.model.FieldName;
import com.labelaudit.compliance.model.MergedField;
import com.labelaudit.compliance.model.MergedRecord;
import com.labelaudit.compliance.model.Quantity;
import com.labelaudit.compliance.model.SourceType;
import com.labelaudit.compliance.service.validation.ValidationResult;
import com.labelaudit.compliance.util.LabelTextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reconciles candidate values from several label sources into one {@link MergedRecord}.
 *
 * <p>For each field the engine walks the {@link MergePolicy} steps in order. A step
 * looks at the candidates from its source, keeps those its validator accepts, and
 * picks the one with the highest confidence (first emitted wins on equal
 * confidence). The first step that yields a value decides the field; a field no
 * step can fill is left out of the record.
 *
 * <p>The engine holds no mutable state and performs no I/O. Problems with
 * individual candidates are reported as {@link MergeDiagnostic}s on the result and
 * never abort the merge.
 *
 * @see MergePolicy
 * @see MergeResult
 */
@Service
public class FieldMergeEngine {
    private static final Logger log = LoggerFactory.getLogger(FieldMergeEngine.class);

    private final MergePolicy policy;

    public FieldMergeEngine(MergePolicy policy) {
        this.policy = policy;
    }

    public MergePolicy getPolicy() {
        return policy;
    }

    public MergeResult merge(String productId, List<CandidateField> candidates, Instant timestamp) {
        List<MergeDiagnostic> diagnostics = new ArrayList<>();
        Map<FieldName, List<Candidate>> groups = group(productId, candidates, diagnostics);

        Map<FieldName, MergedField> fields = new EnumMap<>(FieldName.class);
        for (Map.Entry<FieldName, List<Candidate>> e : groups.entrySet()) {
            resolve(productId, e.getKey(), e.getValue(), diagnostics).ifPresent(mf -> fields.put(e.getKey(), mf));
        }

        MergedRecord record = new MergedRecord(productId, fields, timestamp);
        log.debug("Merged {} candidates for {} into {} fields ({} diagnostics)",
                candidates == null ? 0 : candidates.size(), productId, fields.size(), diagnostics.size());
        return new MergeResult(record, diagnostics);
    }

    private Map<FieldName, List<Candidate>> group(String productId, List<CandidateField> candidates,
                                                  List<MergeDiagnostic> diagnostics) {
        Map<FieldName, List<Candidate>> groups = new EnumMap<>(FieldName.class);
        if (candidates == null) return groups;

        for (CandidateField c : candidates) {
            if (c == null) continue;
            Optional<FieldName> field = FieldName.fromKey(c.getField());
            if (field.isEmpty()) {
                log.warn("Dropping candidate with unknown field '{}' for {}", c.getField(), productId);
                diagnostics.add(MergeDiagnostic.unknownField(productId, c.getField(), c.getSource()));
                continue;
            }
            try {
                groups.computeIfAbsent(field.get(), f -> new ArrayList<>()).add(toCandidate(c));
            } catch (InvalidCandidateException ex) {
                log.warn("Dropping malformed candidate {} for {}: {}", c, productId, ex.getMessage());
                diagnostics.add(MergeDiagnostic.malformed(productId, field.get().getKey(), c.getSource(), ex.getMessage()));
            }
        }
        return groups;
    }

    private static Candidate toCandidate(CandidateField c) {
        if (c.getSource() == null) {
            throw new InvalidCandidateException("Candidate has no source");
        }
        Double declared = c.getConfidence();
        if (declared != null && (declared.isNaN() || declared < 0.0 || declared > 1.0)) {
            throw new InvalidCandidateException("Confidence " + declared + " outside [0,1]");
        }
        String value = c.getValue() == null ? "" : LabelTextUtils.clean(c.getValue());
        Quantity quantity = c.getQuantity();
        if (value.isEmpty() && quantity != null) {
            value = quantity.toString();
        }
        return new Candidate(c.getSource(), value, c.effectiveConfidence());
    }

    private Optional<MergedField> resolve(String productId, FieldName field, List<Candidate> group,
                                          List<MergeDiagnostic> diagnostics) {
        List<Contender> contenders = new ArrayList<>(group.size());
        for (Candidate c : group) {
            Optional<MergeStep> step = policy.stepFor(field, c.source);
            if (step.isEmpty()) {
                c.rejection = "source not accepted for this field";
            } else {
                c.check = step.get().getValidator().validate(c.value);
                if (!c.check.isValid()) {
                    c.rejection = c.check.getReason();
                    diagnostics.add(MergeDiagnostic.rejected(productId, field.getKey(), c.source, c.value, c.rejection));
                }
            }
            contenders.add(new Contender(c.source, c.value, c.confidence, c.rejection == null, c.rejection));
        }

        Candidate winner = null;
        for (MergeStep step : policy.stepsFor(field)) {
            for (Candidate c : group) {
                if (c.source != step.getSource() || c.rejection != null) continue;
                if (winner == null || c.confidence > winner.confidence) {
                    winner = c;
                }
            }
            if (winner != null) break;
        }

        if (winner == null) {
            log.debug("{}: no valid value for {} among {}", productId, field, contenders);
            diagnostics.add(MergeDiagnostic.noValidValue(productId, field.getKey()));
            return Optional.empty();
        }

        for (Candidate c : group) {
            if (c != winner && c.rejection == null && c.source != winner.source
                    && !c.value.equalsIgnoreCase(winner.value)) {
                diagnostics.add(MergeDiagnostic.conflict(productId, field.getKey(),
                        winner.source, winner.value, c.source, c.value));
            }
        }

        log.debug("{}: {} <- '{}' from {} ({})", productId, field, winner.value, winner.source, winner.confidence);
        Quantity quantity = winner.check == null ? null : winner.check.getQuantity();
        return Optional.of(new MergedField(field, winner.value, quantity, winner.source, winner.confidence, contenders));
    }

    /** Working copy of one candidate while its field is being resolved. */
    private static final class Candidate {
        final SourceType source;
        final String value;
        final double confidence;
        ValidationResult check;
        String rejection;

        Candidate(SourceType source, String value, double confidence) {
            this.source = source;
            this.value = value;
            this.confidence = confidence;
        }
    }
}
