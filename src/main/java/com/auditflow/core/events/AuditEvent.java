package com.auditflow.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during an audit run.
 *
 * @param eventType event type (e.g. "audit.started", "tool.completed", "tool.failed")
 * @param runId     the audit run this event belongs to
 * @param tool      the tool this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record AuditEvent(
    String eventType,
    String runId,
    String tool,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static AuditEvent of(String eventType, String runId, String tool, Map<String, Object> payload) {
        return new AuditEvent(eventType, runId, tool, payload, Instant.now());
    }
}
