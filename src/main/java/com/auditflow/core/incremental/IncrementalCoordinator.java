package com.auditflow.core.incremental;

import com.auditflow.core.events.AuditEvent;
import com.auditflow.core.events.EventBus;
import com.auditflow.core.fingerprint.FingerprintIndex;
import com.auditflow.core.fingerprint.IndexSnapshot;
import com.auditflow.core.fingerprint.ProjectAccessException;
import com.auditflow.core.logging.MdcContext;
import com.auditflow.core.metrics.AuditMetrics;
import com.auditflow.core.model.*;
import com.auditflow.core.orchestrator.CacheGuard;
import com.auditflow.core.orchestrator.OrchestrationResult;
import com.auditflow.core.orchestrator.PatternCacheGuard;
import com.auditflow.core.orchestrator.TaskOrchestrator;
import com.auditflow.core.orchestrator.ToolInvocation;
import com.auditflow.core.tools.AnalysisTool;
import com.auditflow.core.tools.ToolKind;
import com.auditflow.core.tools.ToolProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Decides between a full and an incremental audit of one project, plans each
 * tool's invocation against the caches, runs them through the
 * {@link TaskOrchestrator} and commits the new fingerprint index.
 *
 * <p>Full mode is used when no index exists or the caller forces it. Otherwise
 * file-decomposable tools re-analyse only added and modified files and their
 * findings are merged into the result store, so the reported aggregates equal
 * those of a full run over the same files. Tools whose profile says they ignore
 * the file subset are re-run over the whole project and replace their entry.
 * Result-store findings are limited to files the fingerprint index tracks. An incremental run with nothing
 * changed serves every file-decomposable tool from the result store.
 *
 * <p>Single-tool failures are reported per tool and do not prevent the index
 * commit. Anything that stops the audit as a whole surfaces as
 * {@link AuditFailedException} and leaves the index untouched.
 */
public class IncrementalCoordinator {

    private static final Logger log = LoggerFactory.getLogger(IncrementalCoordinator.class);

    private final AuditWorkspace workspace;
    private final TaskOrchestrator orchestrator;
    private final ProjectLocks locks;
    private final Duration lockTimeout;
    private final EventBus eventBus;
    private final AuditMetrics metrics;
    private final Supplier<String> runIds;

    public IncrementalCoordinator(AuditWorkspace workspace, TaskOrchestrator orchestrator, ProjectLocks locks,
                                  Duration lockTimeout, EventBus eventBus, AuditMetrics metrics,
                                  Supplier<String> runIds) {
        this.workspace = workspace;
        this.orchestrator = orchestrator;
        this.locks = locks;
        this.lockTimeout = lockTimeout;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.runIds = runIds;
    }

    public AuditResult runAudit(Map<String, AnalysisTool> tools, boolean forceFull) {
        return runAudit(tools, forceFull, Set.of());
    }

    /**
     * Audits the project with {@code tools}.
     *
     * @param tools     tool name to tool
     * @param forceFull re-run every tool over the whole project regardless of the index
     * @param excluded  tool names to report as SKIPPED without running them
     * @throws AuditFailedException if the project cannot be read, the lock cannot be
     *                              acquired, or orchestration fails as a whole
     */
    public AuditResult runAudit(Map<String, AnalysisTool> tools, boolean forceFull, Set<String> excluded) {
        String runId = runIds.get();
        Path root = workspace.projectRoot();
        MdcContext.setRun(runId, root.toString());
        long startNanos = System.nanoTime();
        eventBus.publish(AuditEvent.of("audit.started", runId, null,
                Map.of("project", root.toString(), "tools", List.copyOf(tools.keySet()), "forceFull", forceFull)));

        try (ProjectLocks.Held ignored = locks.acquire(root, lockTimeout)) {
            return audit(runId, tools, forceFull, excluded, startNanos);
        } catch (AuditFailedException e) {
            log.error("Audit {} failed: {}", runId, e.getMessage());
            eventBus.publish(AuditEvent.of("audit.failed", runId, null, Map.of("error", String.valueOf(e.getMessage()))));
            if (metrics != null) {
                metrics.recordAudit("unknown", "failed", millisSince(startNanos));
            }
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private AuditResult audit(String runId, Map<String, AnalysisTool> tools, boolean forceFull,
                              Set<String> excluded, long startNanos) {
        FingerprintIndex index = workspace.index();
        Map<String, String> current;
        try {
            current = index.scan();
        } catch (ProjectAccessException e) {
            throw new AuditFailedException("Cannot read project " + workspace.projectRoot(), e);
        }

        Optional<IndexSnapshot> snapshot = index.load();
        ChangeSet changes = FingerprintIndex.diff(current,
                snapshot.map(IndexSnapshot::fingerprints).orElse(Map.of()));
        AuditMode mode = snapshot.isEmpty() || forceFull ? AuditMode.FULL : AuditMode.INCREMENTAL;
        log.info("Audit {} in {} mode: {}", runId, mode, changes.summary());
        if (metrics != null) {
            metrics.recordChangedFiles(changes.totalChanged());
        }

        var guards = new LinkedHashMap<String, ResultStoreGuard>();
        Set<String> tracked = current.keySet();
        List<ToolInvocation> invocations = plan(tools, mode, changes, tracked::contains, guards);

        OrchestrationResult result;
        try {
            result = orchestrator.execute(runId, invocations, excluded);
        } catch (RuntimeException e) {
            throw new AuditFailedException("Orchestration failed for run " + runId, e);
        }

        Set<String> upToDate = persistStaged(result, guards);
        if (mode == AuditMode.FULL || changes.hasChanges()) {
            clearStaleResults(upToDate);
        }

        try {
            index.commit(current);
        } catch (IOException e) {
            log.error("Failed to commit file index for {}: {}", workspace.projectRoot(), e.getMessage(), e);
        }

        AuditResult audit = toResult(runId, mode, changes, result, millisSince(startNanos));
        eventBus.publish(AuditEvent.of("audit.completed", runId, null, Map.of(
                "mode", mode.name(),
                "durationMs", audit.durationMs(),
                "succeeded", audit.count(ToolState.SUCCEEDED),
                "failed", audit.count(ToolState.FAILED))));
        if (metrics != null) {
            metrics.recordAudit(mode.name(), audit.count(ToolState.FAILED) + audit.count(ToolState.CANCELLED) > 0
                    ? "partial" : "completed", audit.durationMs());
        }
        log.info("Audit {} finished in {}ms", runId, audit.durationMs());
        return audit;
    }

    private List<ToolInvocation> plan(Map<String, AnalysisTool> tools, AuditMode mode, ChangeSet changes,
                                      Predicate<String> tracked, Map<String, ResultStoreGuard> guards) {
        Path root = workspace.projectRoot();
        var invocations = new ArrayList<ToolInvocation>();
        for (Map.Entry<String, AnalysisTool> entry : tools.entrySet()) {
            String name = entry.getKey();
            AnalysisTool tool = entry.getValue();
            ToolProfile profile = tool.profile();

            if (profile.kind() == ToolKind.FILE_DECOMPOSABLE && workspace.results().supports(name)) {
                ResultStoreGuard guard = mode == AuditMode.FULL
                        ? ResultStoreGuard.replace(workspace.results(), name, root, tracked)
                        : ResultStoreGuard.incremental(workspace.results(), name, root, profile.honorsFileSubset(),
                                changes.changedFiles(), changes.removed(), tracked);
                guards.put(name, guard);
                log.debug("Tool {}: result store plan {}", name, guard.plan());
                invocations.add(new ToolInvocation(name, guard, () -> tool.analyze(root, guard.fileSubset())));
                continue;
            }

            if (profile.kind() == ToolKind.FILE_DECOMPOSABLE) {
                log.warn("No findings strategy for {}; running it over the whole project", name);
            }
            CacheGuard guard;
            if (profile.isPatternCached()) {
                guard = mode == AuditMode.FULL
                        ? PatternCacheGuard.writeOnly(workspace.patterns(), name, profile.cachePatterns())
                        : PatternCacheGuard.readWrite(workspace.patterns(), name, profile.cachePatterns());
            } else {
                guard = CacheGuard.none();
            }
            invocations.add(new ToolInvocation(name, guard, () -> tool.analyze(root, Optional.empty())));
        }
        return invocations;
    }

    /**
     * Writes the staged result-store entries of tools that succeeded.
     *
     * @return tools whose result-store entry now reflects the current files
     */
    private Set<String> persistStaged(OrchestrationResult result, Map<String, ResultStoreGuard> guards) {
        var upToDate = new HashSet<String>();
        for (Map.Entry<String, ResultStoreGuard> entry : guards.entrySet()) {
            String tool = entry.getKey();
            ToolOutcome outcome = result.outcome(tool);
            if (outcome == null || !outcome.succeeded()) {
                continue;
            }
            Optional<ToolCacheEntry> staged = entry.getValue().staged();
            if (staged.isEmpty()) {
                // served from an entry that needed no changes
                upToDate.add(tool);
                continue;
            }
            try {
                workspace.results().save(staged.get());
                upToDate.add(tool);
            } catch (IOException e) {
                log.warn("Failed to save {} results: {}", tool, e.getMessage());
            }
        }
        return upToDate;
    }

    private void clearStaleResults(Set<String> upToDate) {
        for (String tool : workspace.results().storedTools()) {
            if (!upToDate.contains(tool) && workspace.results().clear(tool)) {
                log.info("Dropped stale {} results; the next audit re-runs it over the whole project", tool);
            }
        }
    }

    private static AuditResult toResult(String runId, AuditMode mode, ChangeSet changes,
                                        OrchestrationResult result, long durationMs) {
        var perToolResult = new LinkedHashMap<String, Map<String, Object>>();
        var perToolDuration = new LinkedHashMap<String, Long>();
        var perToolStatus = new LinkedHashMap<String, ToolStatus>();
        result.outcomes().forEach((tool, outcome) -> {
            perToolResult.put(tool, outcome.resultPayload());
            perToolDuration.put(tool, outcome.durationMs());
            perToolStatus.put(tool, outcome.toStatus());
        });
        return new AuditResult(runId, mode, perToolResult, perToolDuration, perToolStatus,
                changes.toSummary(), durationMs);
    }

    /**
     * Deletes cached artifacts.
     *
     * @param tool a tool whose result and pattern artifacts to delete; empty deletes
     *             every artifact and the fingerprint index
     * @return number of artifacts deleted
     */
    public int clearCache(Optional<String> tool) {
        try (ProjectLocks.Held ignored = locks.acquire(workspace.projectRoot(), lockTimeout)) {
            int removed;
            if (tool.isPresent()) {
                removed = (workspace.results().clear(tool.get()) ? 1 : 0)
                        + (workspace.patterns().invalidate(tool.get()) ? 1 : 0);
                log.info("Cleared {} cache artifacts for {}", removed, tool.get());
            } else {
                removed = workspace.results().clearAll() + workspace.patterns().clearAll()
                        + (workspace.index().clear() ? 1 : 0);
                log.info("Cleared {} cache artifacts for {}", removed, workspace.projectRoot());
            }
            return removed;
        }
    }

    public CacheStats stats() {
        try (ProjectLocks.Held ignored = locks.acquire(workspace.projectRoot(), lockTimeout)) {
            Optional<IndexSnapshot> snapshot = workspace.index().load();
            var tools = new ArrayList<ToolCacheStats>(workspace.results().stats());
            tools.addAll(workspace.patterns().stats());
            return new CacheStats(
                    snapshot.map(s -> s.files().size()).orElse(0),
                    snapshot.isPresent(),
                    snapshot.map(IndexSnapshot::lastUpdated).orElse(null),
                    tools);
        }
    }

    private static long millisSince(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
