package com.labelaudit.compliance.exception;

public class InvalidCandidateException extends ComplianceException {
    public InvalidCandidateException(String message) {
        super(ErrorKind.INPUT, message);
    }
}
