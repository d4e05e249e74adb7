package com.auditflow.core.orchestrator;

import java.util.Map;
import java.util.Optional;

/**
 * Cache wrapper around one tool invocation. The orchestrator calls
 * {@link #lookup()} first; on a miss it invokes the tool and passes the fresh
 * payload through {@link #store(Map)}, whose return value is what gets reported.
 */
public interface CacheGuard {

    /** Cache name used for metrics, e.g. {@code "result"} or {@code "pattern"}. */
    String cacheName();

    /** False when the guard never serves hits, so no lookup metric is recorded. */
    default boolean consultsCache() {
        return true;
    }

    Optional<Map<String, Object>> lookup();

    Map<String, Object> store(Map<String, Object> fresh);

    static CacheGuard none() {
        return NoCache.INSTANCE;
    }

    enum NoCache implements CacheGuard {
        INSTANCE;

        @Override
        public String cacheName() {
            return "none";
        }

        @Override
        public boolean consultsCache() {
            return false;
        }

        @Override
        public Optional<Map<String, Object>> lookup() {
            return Optional.empty();
        }

        @Override
        public Map<String, Object> store(Map<String, Object> fresh) {
            return fresh;
        }
    }
}
