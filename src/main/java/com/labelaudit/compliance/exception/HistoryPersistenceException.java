package com.labelaudit.compliance.exception;

public class HistoryPersistenceException extends ComplianceException {
    public HistoryPersistenceException(String message) {
        super(ErrorKind.PERSISTENCE, message);
    }

    public HistoryPersistenceException(String message, Throwable cause) {
        super(ErrorKind.PERSISTENCE, message, cause);
    }
}
