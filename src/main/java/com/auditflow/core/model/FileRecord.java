package com.auditflow.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A tracked source file in the fingerprint index.
 *
 * @param path        project-relative path, always {@code /}-separated
 * @param fingerprint hex content hash
 * @param lastSeen    when the file was last fingerprinted
 */
public record FileRecord(
    String path,
    String fingerprint,
    Instant lastSeen
) implements Serializable {}
