package com.auditflow.core.model;

/**
 * Lifecycle of one tool invocation within an audit run.
 * PENDING moves to RUNNING, SKIPPED or CANCELLED; RUNNING moves to a terminal state.
 */
public enum ToolState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    public boolean canTransitionTo(ToolState next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == SKIPPED || next == CANCELLED;
            case RUNNING -> next == SUCCEEDED || next == FAILED || next == CANCELLED;
            default -> false;
        };
    }
}
