package com.labelaudit.compliance.service.validation;

import com.labelaudit.compliance.model.Quantity;

/**
 * Verdict of a {@link FieldValidator}. A valid net quantity carries its parsed form.
 */
public final class ValidationResult {
    private static final ValidationResult OK = new ValidationResult(true, null, null);

    private final boolean valid;
    private final String reason;
    private final Quantity quantity;

    private ValidationResult(boolean valid, String reason, Quantity quantity) {
        this.valid = valid;
        this.reason = reason;
        this.quantity = quantity;
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult ok(Quantity quantity) {
        return new ValidationResult(true, null, quantity);
    }

    public static ValidationResult fail(String reason) {
        return new ValidationResult(false, reason, null);
    }

    public boolean isValid() { return valid; }
    public String getReason() { return reason; }
    public Quantity getQuantity() { return quantity; }

    @Override
    public String toString() {
        return valid ? "valid" : "invalid(" + reason + ")";
    }
}
