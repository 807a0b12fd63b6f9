package com.labelaudit.compliance.service.rules;

import com.labelaudit.compliance.model.FieldName;
import com.labelaudit.compliance.model.Requirement;
import com.labelaudit.compliance.service.validation.FieldValidator;

import java.util.Locale;
import java.util.Objects;

/** Catalogue entry: whether a field is required and which validator checks it. */
public final class FieldRule {
    private final FieldName field;
    private final Requirement requirement;
    private final FieldValidator validator;

    public FieldRule(FieldName field, Requirement requirement, FieldValidator validator) {
        this.field = Objects.requireNonNull(field, "field");
        this.requirement = Objects.requireNonNull(requirement, "requirement");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public FieldName getField() { return field; }
    public Requirement getRequirement() { return requirement; }
    public FieldValidator getValidator() { return validator; }

    public boolean isRequired() {
        return requirement == Requirement.REQUIRED;
    }

    @Override
    public String toString() {
        return field + "(" + requirement.name().toLowerCase(Locale.ROOT) + ", " + validator.getId() + ")";
    }
}
