package com.auditflow.core.tools;

import java.util.List;
import java.util.Map;

/**
 * Folds a tool's complete per-file findings into its aggregate summary.
 * Must be pure and total: the same map always yields the same aggregate, and
 * no prior aggregate is consulted.
 */
@FunctionalInterface
public interface FindingsReducer {
    Map<String, Object> reduce(Map<String, List<Map<String, Object>>> perFileFindings);
}
