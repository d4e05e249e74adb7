package com.auditflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result-store entry for one file-decomposable tool.
 * The aggregate is always the tool's reducer applied to {@code perFileFindings}.
 *
 * @param tool            tool name
 * @param timestamp       when the entry was last written
 * @param perFileFindings project-relative path to that file's findings
 * @param aggregate       reduced summary handed to callers
 */
public record ToolCacheEntry(
    String tool,
    Instant timestamp,
    Map<String, List<Map<String, Object>>> perFileFindings,
    Map<String, Object> aggregate
) implements Serializable {}
