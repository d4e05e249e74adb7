package com.auditflow.core.model;

import java.io.Serializable;

/**
 * Counts from a {@link ChangeSet}, returned to callers alongside tool results.
 */
public record ChangeSetSummary(
    int added,
    int modified,
    int removed,
    int unchanged,
    String description
) implements Serializable {}
