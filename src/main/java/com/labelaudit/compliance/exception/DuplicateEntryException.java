package com.labelaudit.compliance.exception;

public class DuplicateEntryException extends ComplianceException {
    private final String compositeKey;

    public DuplicateEntryException(String manufacturerKey, String compositeKey) {
        super(ErrorKind.CONFLICT, "History entry " + compositeKey + " already recorded for " + manufacturerKey);
        this.compositeKey = compositeKey;
    }

    public String getCompositeKey() {
        return compositeKey;
    }
}
