package com.auditflow.core.incremental;

import com.auditflow.core.cache.CacheArtifacts;
import com.auditflow.core.cache.PatternCache;
import com.auditflow.core.cache.ResultStore;
import com.auditflow.core.config.AuditProperties;
import com.auditflow.core.fingerprint.FileScanner;
import com.auditflow.core.fingerprint.FingerprintIndex;
import com.auditflow.core.tools.ToolStrategies;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Set;

/**
 * The index and caches of one project root. Built per audit call; nothing here is shared
 * between projects.
 */
public record AuditWorkspace(
    Path projectRoot,
    FingerprintIndex index,
    ResultStore results,
    PatternCache patterns
) {

    public static AuditWorkspace create(Path projectRoot, AuditProperties properties, CacheArtifacts artifacts,
                                        ToolStrategies strategies, Clock clock) {
        Path root = projectRoot.toAbsolutePath().normalize();
        var scanner = new FileScanner(properties.effectiveExcludeDirs(), properties.getIncludeExtensions());
        // dependency patterns may name any file type, so the pattern cache scans without an extension filter
        var dependencyScanner = new FileScanner(properties.effectiveExcludeDirs(), Set.of());
        return new AuditWorkspace(
                root,
                new FingerprintIndex(root, properties.getIndexDir(), scanner, artifacts, clock,
                        properties.isUpdateGitignore()),
                new ResultStore(root, properties.getIndexDir(), artifacts, strategies, clock),
                new PatternCache(root, properties.getCacheDir(), dependencyScanner, artifacts, clock,
                        properties.getCacheMaxAge(), properties.isUpdateGitignore()));
    }
}
