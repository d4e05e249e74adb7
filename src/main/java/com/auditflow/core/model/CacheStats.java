package com.auditflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Administrative snapshot of a project's index and caches.
 *
 * @param trackedFiles     files in the persisted index
 * @param indexExists      whether an index artifact is present
 * @param indexLastUpdated when the index was last committed, null if absent
 * @param tools            freshness of every cached tool artifact
 */
public record CacheStats(
    int trackedFiles,
    boolean indexExists,
    Instant indexLastUpdated,
    List<ToolCacheStats> tools
) implements Serializable {}
