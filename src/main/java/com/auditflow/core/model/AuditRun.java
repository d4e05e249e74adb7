package com.auditflow.core.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestration metadata for one audit invocation. Tracks each tool's
 * state machine; transitions out of a terminal state are rejected.
 * Thread-safe: workers and the coordinating thread update it concurrently.
 */
public class AuditRun {

    private final String id;
    private final List<String> toolNames;
    private final Map<String, ToolStatus> statuses = new LinkedHashMap<>();

    public AuditRun(String id, Collection<String> toolNames) {
        this.id = id;
        this.toolNames = List.copyOf(toolNames);
        for (String name : this.toolNames) {
            statuses.put(name, ToolStatus.pending());
        }
    }

    public String id() {
        return id;
    }

    public List<String> toolNames() {
        return toolNames;
    }

    /**
     * Moves a tool to {@code next} if its current state allows it.
     *
     * @return true if the transition was applied
     */
    public synchronized boolean transition(String tool, ToolState next) {
        return update(tool, new ToolStatus(next, 0L, null, false));
    }

    /**
     * Records a terminal outcome if the tool's current state allows it.
     *
     * @return true if the outcome was applied
     */
    public synchronized boolean complete(ToolOutcome outcome) {
        return update(outcome.tool(), outcome.toStatus());
    }

    public synchronized ToolStatus status(String tool) {
        return statuses.get(tool);
    }

    public synchronized Map<String, ToolStatus> statuses() {
        return Map.copyOf(statuses);
    }

    public synchronized long count(ToolState state) {
        return statuses.values().stream().filter(s -> s.state() == state).count();
    }

    private boolean update(String tool, ToolStatus next) {
        ToolStatus current = statuses.get(tool);
        if (current == null) {
            throw new IllegalArgumentException("Tool " + tool + " is not part of run " + id);
        }
        if (!current.state().canTransitionTo(next.state())) {
            return false;
        }
        statuses.put(tool, next);
        return true;
    }
}
