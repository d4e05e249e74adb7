package com.auditflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Pattern-cache slot for one tool: the payload of its last run plus the
 * fingerprints of every file its dependency patterns matched at that time.
 */
public record PatternCacheEntry(
    String tool,
    Instant timestamp,
    Map<String, String> dependencyFingerprints,
    Map<String, Object> payload
) implements Serializable {}
