package com.auditflow.core.tools;

/**
 * Thrown by a tool adapter when the underlying analyzer fails, e.g. a
 * non-zero exit, a timeout, or output that cannot be parsed.
 */
public class ToolExecutionException extends RuntimeException {
    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
