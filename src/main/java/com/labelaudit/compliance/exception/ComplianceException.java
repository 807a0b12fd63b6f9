package com.labelaudit.compliance.exception;

public abstract class ComplianceException extends RuntimeException {
    private final ErrorKind kind;

    protected ComplianceException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ComplianceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
