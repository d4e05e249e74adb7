package com.auditflow.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Freshness of one tool's cache artifact.
 *
 * @param tool         tool name
 * @param cache        {@code "result"} or {@code "pattern"}
 * @param timestamp    when the artifact was written
 * @param ageSeconds   age at the time of the snapshot
 * @param filesTracked per-file entries (result store) or dependency files (pattern cache)
 * @param fresh        false when a pattern entry has outlived its max age
 */
public record ToolCacheStats(
    String tool,
    String cache,
    Instant timestamp,
    long ageSeconds,
    int filesTracked,
    boolean fresh
) implements Serializable {}
