package com.auditflow.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for audit execution and caching.
 */
@Service
public class AuditMetrics {

    private final MeterRegistry registry;

    public AuditMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordToolExecution(String tool, String state, long ms) {
        Timer.builder("auditflow.tool.duration")
                .tag("tool", tool)
                .tag("state", state)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param cache  "result" or "pattern"
     * @param hit    whether the lookup was served from cache
     */
    public void recordCacheLookup(String cache, boolean hit) {
        Counter.builder("auditflow.cache.lookups")
                .tag("cache", cache)
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void recordAudit(String mode, String outcome, long ms) {
        Counter.builder("auditflow.audits.total")
                .tag("mode", mode)
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        Timer.builder("auditflow.audit.duration")
                .tag("mode", mode)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordChangedFiles(int count) {
        DistributionSummary.builder("auditflow.changeset.changed_files")
                .description("Files added, modified or removed since the last committed index")
                .register(registry)
                .record(count);
    }
}
