package com.auditflow.core.orchestrator;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * One unit of work for the orchestrator: a named tool call wrapped by a cache guard.
 */
public record ToolInvocation(
    String name,
    CacheGuard guard,
    Callable<Map<String, Object>> task
) {

    public static ToolInvocation uncached(String name, Callable<Map<String, Object>> task) {
        return new ToolInvocation(name, CacheGuard.none(), task);
    }
}
