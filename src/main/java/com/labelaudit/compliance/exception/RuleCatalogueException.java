package com.labelaudit.compliance.exception;

public class RuleCatalogueException extends ComplianceException {
    public RuleCatalogueException(String message) {
        super(ErrorKind.CONFIG, message);
    }

    public RuleCatalogueException(String message, Throwable cause) {
        super(ErrorKind.CONFIG, message, cause);
    }
}
