package com.auditflow.core.orchestrator;

import com.auditflow.core.model.AuditRun;
import com.auditflow.core.model.ToolOutcome;

import java.util.Map;

/**
 * Fan-in result: the run's state machine plus every tool's terminal outcome,
 * in invocation order.
 */
public record OrchestrationResult(AuditRun run, Map<String, ToolOutcome> outcomes) {

    public ToolOutcome outcome(String tool) {
        return outcomes.get(tool);
    }
}
