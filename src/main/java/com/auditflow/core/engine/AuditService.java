package com.auditflow.core.engine;

import com.auditflow.core.cache.CacheArtifacts;
import com.auditflow.core.config.AuditProperties;
import com.auditflow.core.events.EventBus;
import com.auditflow.core.incremental.AuditWorkspace;
import com.auditflow.core.incremental.IncrementalCoordinator;
import com.auditflow.core.incremental.ProjectLocks;
import com.auditflow.core.metrics.AuditMetrics;
import com.auditflow.core.model.AuditResult;
import com.auditflow.core.model.CacheStats;
import com.auditflow.core.orchestrator.TaskOrchestrator;
import com.auditflow.core.tools.ToolRegistry;
import com.auditflow.core.tools.ToolStrategies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for callers: audits a project directory with the registered
 * tools and administers its caches.
 * <p>
 * Each call builds a fresh {@link AuditWorkspace} for the given root, so one
 * service instance can audit any number of projects; calls on the same
 * project are serialised by {@link ProjectLocks}.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final AuditProperties properties;
    private final ToolRegistry registry;
    private final TaskOrchestrator orchestrator;
    private final ProjectLocks locks;
    private final CacheArtifacts artifacts;
    private final ToolStrategies strategies;
    private final EventBus eventBus;
    private final AuditMetrics metrics;
    private final Clock clock;

    public AuditService(AuditProperties properties, ToolRegistry registry, TaskOrchestrator orchestrator,
                        ProjectLocks locks, CacheArtifacts artifacts, ToolStrategies strategies,
                        EventBus eventBus, AuditMetrics metrics, Clock clock) {
        this.properties = properties;
        this.registry = registry;
        this.orchestrator = orchestrator;
        this.locks = locks;
        this.artifacts = artifacts;
        this.strategies = strategies;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Audits {@code project} with every registered tool.
     */
    public AuditResult runAudit(Path project, boolean forceFull) {
        return coordinator(project).runAudit(registry.tools(), forceFull);
    }

    /**
     * Audits {@code project} with the named tools; names in {@code skip} are
     * reported as skipped.
     *
     * @throws IllegalArgumentException if a name is not registered
     */
    public AuditResult runAudit(Path project, boolean forceFull, Collection<String> tools, Set<String> skip) {
        return coordinator(project).runAudit(registry.select(tools), forceFull, skip);
    }

    public int clearCache(Path project, Optional<String> tool) {
        return coordinator(project).clearCache(tool);
    }

    public CacheStats stats(Path project) {
        return coordinator(project).stats();
    }

    /**
     * Generates a run ID of the form {@code AUD-<year>-<counter>}.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        return String.format("AUD-%d-%04d", year, count);
    }

    IncrementalCoordinator coordinator(Path project) {
        AuditWorkspace workspace = AuditWorkspace.create(project, properties, artifacts, strategies, clock);
        log.debug("Opened audit workspace at {}", workspace.projectRoot());
        return new IncrementalCoordinator(workspace, orchestrator, locks, properties.getLockTimeout(),
                eventBus, metrics, this::generateRunId);
    }
}
