package com.auditflow.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * What an audit hands back to the report/score layer. Incremental runs
 * produce the same shape and values as a full run over the same files.
 *
 * @param runId             audit run identifier
 * @param mode              mode chosen for this run
 * @param perToolResult     tool name to payload, or a status record for failed/skipped/cancelled tools
 * @param perToolDurationMs tool name to wall-clock duration
 * @param perToolStatus     tool name to terminal status
 * @param changeSetSummary  counts of the detected change set
 * @param durationMs        total audit duration
 */
public record AuditResult(
    String runId,
    AuditMode mode,
    Map<String, Map<String, Object>> perToolResult,
    Map<String, Long> perToolDurationMs,
    Map<String, ToolStatus> perToolStatus,
    ChangeSetSummary changeSetSummary,
    long durationMs
) implements Serializable {

    public long count(ToolState state) {
        return perToolStatus.values().stream().filter(s -> s.state() == state).count();
    }
}
