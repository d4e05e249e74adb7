package com.auditflow.core.model;

import java.io.Serializable;

/**
 * Status snapshot of a tool within an {@link AuditRun}.
 *
 * @param state      current lifecycle state
 * @param durationMs wall-clock time spent running, 0 until terminal
 * @param error      failure or cancellation message, null otherwise
 * @param cached     true when the result was served from a cache without invoking the tool
 */
public record ToolStatus(
    ToolState state,
    long durationMs,
    String error,
    boolean cached
) implements Serializable {

    public static ToolStatus pending() {
        return new ToolStatus(ToolState.PENDING, 0L, null, false);
    }
}
