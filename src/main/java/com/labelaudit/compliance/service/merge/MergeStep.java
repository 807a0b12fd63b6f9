package com.labelaudit.compliance.service.merge;

import com.labelaudit.compliance.model.SourceType;
import com.labelaudit.compliance.service.validation.FieldValidator;

import java.util.Objects;

/**
 * One rung of a field's fallback ladder: accept a value from {@code source} if
 * {@code validator} passes it.
 */
public final class MergeStep {
    private final SourceType source;
    private final FieldValidator validator;

    public MergeStep(SourceType source, FieldValidator validator) {
        this.source = Objects.requireNonNull(source, "source");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public SourceType getSource() { return source; }
    public FieldValidator getValidator() { return validator; }

    @Override
    public String toString() {
        return source + "/" + validator.getId();
    }
}
