package com.labelaudit.compliance.service.validation;

/**
 * Format check for one kind of label value. Implementations are stateless and
 * safe to share across threads.
 */
public interface FieldValidator {

    /** Identifier used by the rule catalogue, e.g. "currency". */
    String getId();

    /**
     * Validates a raw value. Blank values and "not found" markers are never valid.
     */
    ValidationResult validate(String value);
}
