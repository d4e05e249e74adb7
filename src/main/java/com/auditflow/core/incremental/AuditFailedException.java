package com.auditflow.core.incremental;

/**
 * The audit as a whole could not run: the project root is unreadable, the
 * project lock could not be acquired, or orchestration itself broke. The
 * fingerprint index is left untouched.
 */
public class AuditFailedException extends RuntimeException {
    public AuditFailedException(String message) {
        super(message);
    }

    public AuditFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
