package com.auditflow.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Auditflow-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId, String project) {
        MDC.put("runId", runId);
        MDC.put("project", project);
    }

    public static void setTool(String runId, String tool) {
        MDC.put("runId", runId);
        MDC.put("tool", tool);
    }

    public static void clearTool() {
        MDC.remove("tool");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("project");
        MDC.remove("tool");
    }
}
