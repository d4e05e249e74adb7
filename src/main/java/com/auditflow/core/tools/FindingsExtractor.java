package com.auditflow.core.tools;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Splits a tool's raw payload into per-file findings keyed by project-relative path.
 * Findings that name no file are dropped.
 */
@FunctionalInterface
public interface FindingsExtractor {
    Map<String, List<Map<String, Object>>> extract(Path projectRoot, Map<String, Object> payload);
}
