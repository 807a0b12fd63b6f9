package com.labelaudit.compliance.exception;

/**
 * The only failure categories the compliance core exposes to callers.
 */
public enum ErrorKind {
    /** Malformed candidate field; dropped at the merge boundary */
    INPUT,
    /** Missing, empty or unversioned rule catalogue; fails the whole evaluation */
    CONFIG,
    /** History store unreachable; evaluation completes without a history update */
    PERSISTENCE,
    /** Duplicate history entry; treated as an idempotent no-op */
    CONFLICT
}
