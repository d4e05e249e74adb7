package com.auditflow.core.model;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminal result of one tool invocation, as collected at the fan-in barrier.
 * A failure is a value, never an exception crossing the barrier.
 *
 * @param tool       tool name
 * @param state      terminal state
 * @param payload    tool output (or cached payload) when SUCCEEDED, null otherwise
 * @param error      failure or cancellation message
 * @param durationMs wall-clock duration of the invocation
 * @param cached     true when served from a cache
 */
public record ToolOutcome(
    String tool,
    ToolState state,
    Map<String, Object> payload,
    String error,
    long durationMs,
    boolean cached
) implements Serializable {

    public static ToolOutcome succeeded(String tool, Map<String, Object> payload, long durationMs, boolean cached) {
        return new ToolOutcome(tool, ToolState.SUCCEEDED, payload, null, durationMs, cached);
    }

    public static ToolOutcome failed(String tool, String error, long durationMs) {
        return new ToolOutcome(tool, ToolState.FAILED, null, error, durationMs, false);
    }

    public static ToolOutcome cancelled(String tool, String reason, long durationMs) {
        return new ToolOutcome(tool, ToolState.CANCELLED, null, reason, durationMs, false);
    }

    public static ToolOutcome skipped(String tool) {
        return new ToolOutcome(tool, ToolState.SKIPPED, null, null, 0L, false);
    }

    public boolean succeeded() {
        return state == ToolState.SUCCEEDED;
    }

    /**
     * The value a report layer consumes for this tool: the payload on success,
     * otherwise a structured status record.
     */
    public Map<String, Object> resultPayload() {
        if (state == ToolState.SUCCEEDED) {
            return payload;
        }
        var record = new LinkedHashMap<String, Object>();
        record.put("tool", tool);
        record.put("status", switch (state) {
            case FAILED -> "error";
            case CANCELLED -> "cancelled";
            case SKIPPED -> "skipped";
            default -> state.name().toLowerCase();
        });
        if (error != null) {
            record.put("error", error);
        }
        return record;
    }

    public ToolStatus toStatus() {
        return new ToolStatus(state, durationMs, error, cached);
    }
}
