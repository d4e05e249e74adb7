package com.auditflow.core.events;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Logs per-run progress from the {@link EventBus}: one line per finished tool
 * with a done/total count, and a summary when the run ends.
 */
@Component
public class AuditProgressListener {

    private static final Logger log = LoggerFactory.getLogger(AuditProgressListener.class);

    private static final Set<String> TERMINAL_TOOL_EVENTS =
            Set.of("tool.completed", "tool.failed", "tool.cancelled", "tool.skipped");

    private final EventBus eventBus;
    private final ConcurrentHashMap<String, RunProgress> runs = new ConcurrentHashMap<>();
    private EventBus.Subscription subscription;

    public AuditProgressListener(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @PostConstruct
    void start() {
        subscription = eventBus.subscribeAll(this::onEvent);
    }

    @PreDestroy
    void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
        runs.clear();
    }

    void onEvent(AuditEvent event) {
        String type = event.eventType();
        if ("audit.started".equals(type)) {
            int total = event.payload().get("tools") instanceof Collection<?> tools ? tools.size() : 0;
            runs.put(event.runId(), new RunProgress(total));
            log.info("Audit {} started on {} with {} tools", event.runId(), event.payload().get("project"), total);
        } else if (TERMINAL_TOOL_EVENTS.contains(type)) {
            RunProgress progress = runs.get(event.runId());
            if (progress == null) {
                return;
            }
            int done = progress.done.incrementAndGet();
            log.info("Audit {}: {} {} ({}/{})", event.runId(), event.tool(),
                    type.substring("tool.".length()), done, progress.total);
        } else if ("audit.completed".equals(type)) {
            runs.remove(event.runId());
            log.info("Audit {} completed in {} mode: {} succeeded, {} failed, {}ms", event.runId(),
                    event.payload().get("mode"), event.payload().get("succeeded"),
                    event.payload().get("failed"), event.payload().get("durationMs"));
        } else if ("audit.failed".equals(type)) {
            runs.remove(event.runId());
            log.warn("Audit {} failed: {}", event.runId(), event.payload().get("error"));
        }
    }

    /** Finished tools out of the total for a run still in progress. */
    public Optional<Progress> progress(String runId) {
        RunProgress progress = runs.get(runId);
        return progress == null ? Optional.empty() : Optional.of(new Progress(progress.done.get(), progress.total));
    }

    public int activeRuns() {
        return runs.size();
    }

    public record Progress(int done, int total) {}

    private static final class RunProgress {
        private final int total;
        private final AtomicInteger done = new AtomicInteger();

        private RunProgress(int total) {
            this.total = total;
        }
    }
}
