package com.auditflow.core.orchestrator;

import com.auditflow.core.cache.PatternCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Guards a whole-project tool with its pattern-cache slot. In write-only mode
 * (full audits) the slot is never read but is still refreshed after the run.
 * The reported payload is the stored form, so a later hit returns an equal map.
 * A failed write is logged and the fresh payload is reported as the tool returned it.
 */
public class PatternCacheGuard implements CacheGuard {

    private static final Logger log = LoggerFactory.getLogger(PatternCacheGuard.class);

    private final PatternCache cache;
    private final String tool;
    private final List<String> patterns;
    private final boolean readEnabled;

    public PatternCacheGuard(PatternCache cache, String tool, List<String> patterns, boolean readEnabled) {
        this.cache = cache;
        this.tool = tool;
        this.patterns = List.copyOf(patterns);
        this.readEnabled = readEnabled;
    }

    public static PatternCacheGuard readWrite(PatternCache cache, String tool, List<String> patterns) {
        return new PatternCacheGuard(cache, tool, patterns, true);
    }

    public static PatternCacheGuard writeOnly(PatternCache cache, String tool, List<String> patterns) {
        return new PatternCacheGuard(cache, tool, patterns, false);
    }

    @Override
    public String cacheName() {
        return "pattern";
    }

    @Override
    public boolean consultsCache() {
        return readEnabled;
    }

    @Override
    public Optional<Map<String, Object>> lookup() {
        return readEnabled ? cache.get(tool, patterns) : Optional.empty();
    }

    @Override
    public Map<String, Object> store(Map<String, Object> fresh) {
        try {
            return cache.put(tool, patterns, fresh);
        } catch (IOException e) {
            log.warn("Failed to cache {} results: {}", tool, e.getMessage());
            return fresh;
        }
    }
}
