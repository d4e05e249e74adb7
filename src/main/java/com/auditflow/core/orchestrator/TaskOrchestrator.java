package com.auditflow.core.orchestrator;

import com.auditflow.core.config.AuditProperties;
import com.auditflow.core.events.AuditEvent;
import com.auditflow.core.events.EventBus;
import com.auditflow.core.logging.MdcContext;
import com.auditflow.core.metrics.AuditMetrics;
import com.auditflow.core.model.AuditRun;
import com.auditflow.core.model.ToolOutcome;
import com.auditflow.core.model.ToolState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs tool invocations concurrently on a bounded pool and collects one
 * terminal {@link ToolOutcome} per tool at a single fan-in barrier.
 *
 * <p>Each invocation is wrapped by its {@link CacheGuard}: a hit is reported
 * without calling the tool, a miss calls the tool and reports what the guard's
 * {@code store} returns. A tool exception becomes a FAILED outcome and never
 * affects the other tools. When the overall timeout elapses, or the calling
 * thread is interrupted, in-flight workers are interrupted and their tools are
 * reported as CANCELLED.
 */
@Service
public class TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);

    private static final long SHUTDOWN_GRACE_SECONDS = 5;

    private final int maxParallel;
    private final Duration timeout;
    private final EventBus eventBus;
    private final AuditMetrics metrics;

    @Autowired
    public TaskOrchestrator(AuditProperties properties, EventBus eventBus, AuditMetrics metrics) {
        this(properties.getMaxParallel(), properties.getAuditTimeout(), eventBus, metrics);
    }

    TaskOrchestrator(int maxParallel, Duration timeout) {
        this(maxParallel, timeout, new EventBus(), null);
    }

    public TaskOrchestrator(int maxParallel, Duration timeout, EventBus eventBus, AuditMetrics metrics) {
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be at least 1, got " + maxParallel);
        }
        this.maxParallel = maxParallel;
        this.timeout = timeout;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Executes {@code invocations}, recording every name in {@code excluded} as SKIPPED.
     * Duplicate names are dropped; the first invocation of a name wins.
     */
    public OrchestrationResult execute(String runId, List<ToolInvocation> invocations, Set<String> excluded) {
        var unique = new LinkedHashMap<String, ToolInvocation>();
        for (ToolInvocation invocation : invocations) {
            if (unique.putIfAbsent(invocation.name(), invocation) != null) {
                log.warn("Duplicate invocation of tool {} in run {}; keeping the first", invocation.name(), runId);
            }
        }

        var run = new AuditRun(runId, unique.keySet());
        var outcomes = new ConcurrentHashMap<String, ToolOutcome>();

        var toRun = new ArrayList<ToolInvocation>();
        for (ToolInvocation invocation : unique.values()) {
            if (excluded.contains(invocation.name())) {
                record(run, outcomes, ToolOutcome.skipped(invocation.name()));
            } else {
                toRun.add(invocation);
            }
        }

        if (!toRun.isEmpty()) {
            fanOut(run, toRun, outcomes);
        }

        var ordered = new LinkedHashMap<String, ToolOutcome>();
        for (String name : unique.keySet()) {
            ordered.put(name, outcomes.get(name));
        }
        log.info("Run {}: {} succeeded, {} failed, {} cancelled, {} skipped", runId,
                run.count(ToolState.SUCCEEDED), run.count(ToolState.FAILED),
                run.count(ToolState.CANCELLED), run.count(ToolState.SKIPPED));
        return new OrchestrationResult(run, Collections.unmodifiableMap(ordered));
    }

    private void fanOut(AuditRun run, List<ToolInvocation> toRun, Map<String, ToolOutcome> outcomes) {
        String runId = run.id();
        var executor = Executors.newFixedThreadPool(Math.min(maxParallel, toRun.size()), daemonThreads(runId));
        var futures = new LinkedHashMap<String, Future<?>>();
        var started = new ConcurrentHashMap<String, Long>();
        long startNanos = System.nanoTime();

        try {
            for (ToolInvocation invocation : toRun) {
                futures.put(invocation.name(),
                        executor.submit(() -> runTool(run, invocation, outcomes, started)));
            }
            executor.shutdown();

            String cancelReason = null;
            long deadline = startNanos + timeout.toNanos();
            for (Map.Entry<String, Future<?>> entry : futures.entrySet()) {
                try {
                    entry.getValue().get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    cancelReason = "Audit timed out after " + timeout.toSeconds() + "s";
                    break;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancelReason = "Audit interrupted";
                    break;
                } catch (ExecutionException e) {
                    // runTool records its own outcome; reaching here means the worker itself broke
                    log.error("Worker for {} failed unexpectedly", entry.getKey(), e.getCause());
                    record(run, outcomes, ToolOutcome.failed(entry.getKey(),
                            String.valueOf(e.getCause().getMessage()), elapsedMs(started, entry.getKey())));
                }
            }

            if (cancelReason != null) {
                log.warn("Run {}: {}; cancelling in-flight tools", runId, cancelReason);
                for (Map.Entry<String, Future<?>> entry : futures.entrySet()) {
                    if (!entry.getValue().isDone()) {
                        entry.getValue().cancel(true);
                        record(run, outcomes, ToolOutcome.cancelled(entry.getKey(), cancelReason,
                                elapsedMs(started, entry.getKey())));
                    }
                }
            }
        } finally {
            executor.shutdownNow();
            awaitWorkers(executor, runId);
        }

        // a worker can finish between the cancel sweep and the shutdown; make sure nothing is left open
        for (String name : futures.keySet()) {
            if (!outcomes.containsKey(name)) {
                record(run, outcomes, ToolOutcome.cancelled(name, "Audit cancelled", elapsedMs(started, name)));
            }
        }
    }

    private void runTool(AuditRun run, ToolInvocation invocation, Map<String, ToolOutcome> outcomes,
                         Map<String, Long> started) {
        String name = invocation.name();
        String runId = run.id();
        MdcContext.setTool(runId, name);
        long startNanos = System.nanoTime();
        started.put(name, startNanos);
        try {
            if (!run.transition(name, ToolState.RUNNING)) {
                return;
            }
            log.info("Starting tool {}", name);
            eventBus.publish(AuditEvent.of("tool.started", runId, name, Map.of()));

            ToolOutcome outcome;
            try {
                CacheGuard guard = invocation.guard();
                Optional<Map<String, Object>> cached = guard.lookup();
                if (guard.consultsCache() && metrics != null) {
                    metrics.recordCacheLookup(guard.cacheName(), cached.isPresent());
                }
                if (cached.isPresent()) {
                    outcome = ToolOutcome.succeeded(name, cached.get(), millisSince(startNanos), true);
                } else {
                    Map<String, Object> fresh = invocation.task().call();
                    if (fresh == null) {
                        throw new IllegalStateException("Tool " + name + " returned no payload");
                    }
                    if (Thread.currentThread().isInterrupted()) {
                        throw new InterruptedException("Cancelled after tool returned");
                    }
                    outcome = ToolOutcome.succeeded(name, guard.store(fresh), millisSince(startNanos), false);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcome = ToolOutcome.cancelled(name, "Interrupted", millisSince(startNanos));
            } catch (Exception e) {
                log.error("Tool {} failed: {}", name, e.getMessage(), e);
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                outcome = ToolOutcome.failed(name, message, millisSince(startNanos));
            }
            record(run, outcomes, outcome);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Applies a terminal outcome if the tool has not reached one yet. The check and the
     * write happen under the run's lock, so the worker and a cancelling coordinator
     * cannot both record an outcome for the same tool.
     */
    private void record(AuditRun run, Map<String, ToolOutcome> outcomes, ToolOutcome outcome) {
        boolean applied;
        synchronized (run) {
            applied = run.complete(outcome);
            if (applied) {
                outcomes.put(outcome.tool(), outcome);
            }
        }
        if (!applied) {
            return;
        }

        String eventType = switch (outcome.state()) {
            case SUCCEEDED -> "tool.completed";
            case FAILED -> "tool.failed";
            case CANCELLED -> "tool.cancelled";
            case SKIPPED -> "tool.skipped";
            default -> "tool." + outcome.state().name().toLowerCase();
        };
        var payload = new HashMap<String, Object>();
        payload.put("state", outcome.state().name());
        payload.put("durationMs", outcome.durationMs());
        payload.put("cached", outcome.cached());
        if (outcome.error() != null) {
            payload.put("error", outcome.error());
        }
        eventBus.publish(AuditEvent.of(eventType, run.id(), outcome.tool(), payload));

        if (outcome.state() != ToolState.SKIPPED) {
            log.info("Tool {} {} in {}ms{}", outcome.tool(), outcome.state(), outcome.durationMs(),
                    outcome.cached() ? " (cached)" : "");
            if (metrics != null) {
                metrics.recordToolExecution(outcome.tool(), outcome.state().name(), outcome.durationMs());
            }
        }
    }

    private static void awaitWorkers(ExecutorService executor, String runId) {
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Run {}: some tool workers did not stop within {}s", runId, SHUTDOWN_GRACE_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(String runId) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "audit-" + runId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static long elapsedMs(Map<String, Long> started, String tool) {
        Long start = started.get(tool);
        return start == null ? 0L : millisSince(start);
    }

    private static long millisSince(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
