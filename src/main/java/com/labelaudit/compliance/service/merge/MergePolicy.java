package com.labelaudit.compliance.service.merge;

import com.labelaudit.compliance.model.FieldName;
import com.labelaudit.compliance.model.SourceType;
import com.labelaudit.compliance.service.validation.FieldValidator;
import com.labelaudit.compliance.service.validation.FieldValidators;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declares, per field, the ordered list of (source, validator) pairs the merge
 * engine walks. The first step whose source offers a value its validator accepts
 * wins; later steps are fallbacks.
 */
public final class MergePolicy {
    private final Map<FieldName, List<MergeStep>> steps;

    private MergePolicy(Map<FieldName, List<MergeStep>> steps) {
        EnumMap<FieldName, List<MergeStep>> copy = new EnumMap<>(FieldName.class);
        steps.forEach((f, s) -> copy.put(f, List.copyOf(s)));
        this.steps = Collections.unmodifiableMap(copy);
    }

    /**
     * Text recognition, then AI enhancement, then platform metadata for every field,
     * each guarded by the field's format check.
     */
    public static MergePolicy defaults() {
        Builder b = builder();
        for (FieldName field : FieldName.values()) {
            FieldValidator check = FieldValidators.formatCheck(field);
            for (SourceType source : SourceType.values()) {
                b.step(field, source, check);
            }
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<MergeStep> stepsFor(FieldName field) {
        return steps.getOrDefault(field, List.of());
    }

    /** The step that governs values from {@code source} for {@code field}, if any. */
    public Optional<MergeStep> stepFor(FieldName field, SourceType source) {
        for (MergeStep s : stepsFor(field)) {
            if (s.getSource() == source) return Optional.of(s);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "MergePolicy" + steps;
    }

    public static final class Builder {
        private final Map<FieldName, List<MergeStep>> steps = new EnumMap<>(FieldName.class);

        public Builder step(FieldName field, SourceType source, FieldValidator validator) {
            List<MergeStep> list = steps.computeIfAbsent(field, f -> new ArrayList<>());
            for (MergeStep s : list) {
                if (s.getSource() == source) {
                    throw new IllegalArgumentException("Source " + source + " already declared for " + field);
                }
            }
            list.add(new MergeStep(source, validator));
            return this;
        }

        public MergePolicy build() {
            return new MergePolicy(steps);
        }
    }
}
