package com.auditflow.core.fingerprint;

/**
 * Thrown when the project root cannot be enumerated. Unlike cache corruption
 * this is not recoverable locally and fails the whole audit.
 */
public class ProjectAccessException extends RuntimeException {
    public ProjectAccessException(String message) {
        super(message);
    }

    public ProjectAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
