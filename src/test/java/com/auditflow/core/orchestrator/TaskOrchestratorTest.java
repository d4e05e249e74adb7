package com.auditflow.core.orchestrator;

import com.auditflow.core.events.AuditEvent;
import com.auditflow.core.events.EventBus;
import com.auditflow.core.metrics.AuditMetrics;
import com.auditflow.core.model.ToolOutcome;
import com.auditflow.core.model.ToolState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TaskOrchestratorTest {

    private final TaskOrchestrator orchestrator = new TaskOrchestrator(4, Duration.ofSeconds(30));

    private static ToolInvocation ok(String name) {
        return ToolInvocation.uncached(name, () -> Map.of("tool", name));
    }

    /** Guard backed by a fixed lookup result that records what it was asked to store. */
    private static class RecordingGuard implements CacheGuard {
        final Optional<Map<String, Object>> hit;
        final List<Map<String, Object>> stored = new CopyOnWriteArrayList<>();

        RecordingGuard(Optional<Map<String, Object>> hit) {
            this.hit = hit;
        }

        @Override
        public String cacheName() {
            return "pattern";
        }

        @Override
        public Optional<Map<String, Object>> lookup() {
            return hit;
        }

        @Override
        public Map<String, Object> store(Map<String, Object> fresh) {
            stored.add(fresh);
            return Map.of("reduced", fresh.size());
        }
    }

    @Nested
    @DisplayName("fan-out and fan-in")
    class FanOutTests {

        @Test
        @DisplayName("every tool gets a terminal outcome in invocation order")
        void allSucceed() {
            var result = orchestrator.execute("AUD-1", List.of(ok("b"), ok("a"), ok("c")), Set.of());

            assertEquals(List.of("b", "a", "c"), List.copyOf(result.outcomes().keySet()));
            result.outcomes().values().forEach(o -> assertEquals(ToolState.SUCCEEDED, o.state()));
            assertEquals(Map.of("tool", "a"), result.outcome("a").payload());
            assertEquals(3, result.run().count(ToolState.SUCCEEDED));
        }

        @Test
        @DisplayName("tools run concurrently")
        void runsConcurrently() {
            var latch = new CountDownLatch(3);
            Runnable rendezvous = () -> {
                latch.countDown();
                try {
                    assertTrue(latch.await(10, TimeUnit.SECONDS), "all tools should be running at once");
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            };
            var invocations = List.of("a", "b", "c").stream()
                    .map(n -> ToolInvocation.uncached(n, () -> {
                        rendezvous.run();
                        return Map.<String, Object>of();
                    }))
                    .toList();

            var result = orchestrator.execute("AUD-2", invocations, Set.of());

            assertEquals(3, result.run().count(ToolState.SUCCEEDED));
        }

        @Test
        @DisplayName("a failing tool does not affect the others")
        void failureIsolation() {
            var failing = ToolInvocation.uncached("bad", () -> {
                throw new IllegalStateException("analyzer crashed");
            });

            var result = orchestrator.execute("AUD-3", List.of(ok("a"), failing, ok("c")), Set.of());

            ToolOutcome bad = result.outcome("bad");
            assertEquals(ToolState.FAILED, bad.state());
            assertEquals("analyzer crashed", bad.error());
            assertEquals(Map.of("tool", "bad", "status", "error", "error", "analyzer crashed"), bad.resultPayload());
            assertEquals(ToolState.SUCCEEDED, result.outcome("a").state());
            assertEquals(ToolState.SUCCEEDED, result.outcome("c").state());
        }

        @Test
        @DisplayName("duplicate names run once and the first wins")
        void deduplicates() {
            var calls = new AtomicInteger();
            var first = ToolInvocation.uncached("dup", () -> {
                calls.incrementAndGet();
                return Map.of("which", "first");
            });
            var second = ToolInvocation.uncached("dup", () -> {
                calls.incrementAndGet();
                return Map.of("which", "second");
            });

            var result = orchestrator.execute("AUD-4", List.of(first, second), Set.of());

            assertEquals(1, result.outcomes().size());
            assertEquals(Map.of("which", "first"), result.outcome("dup").payload());
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("excluded tools are SKIPPED without executing")
        void skipsExcluded() {
            var calls = new AtomicInteger();
            var skipped = ToolInvocation.uncached("slow", () -> {
                calls.incrementAndGet();
                return Map.of();
            });

            var result = orchestrator.execute("AUD-5", List.of(ok("a"), skipped), Set.of("slow"));

            assertEquals(ToolState.SKIPPED, result.outcome("slow").state());
            assertEquals("skipped", result.outcome("slow").resultPayload().get("status"));
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("empty invocation list yields an empty result")
        void emptyRun() {
            var result = orchestrator.execute("AUD-6", List.of(), Set.of());

            assertTrue(result.outcomes().isEmpty());
        }
    }

    @Nested
    @DisplayName("cache guards")
    class GuardTests {

        @Test
        @DisplayName("a hit is reported as cached without invoking the tool")
        void hitSkipsInvocation() {
            var calls = new AtomicInteger();
            var guard = new RecordingGuard(Optional.of(Map.of("cached", true)));
            var invocation = new ToolInvocation("t", guard, () -> {
                calls.incrementAndGet();
                return Map.of();
            });

            ToolOutcome outcome = orchestrator.execute("AUD-7", List.of(invocation), Set.of()).outcome("t");

            assertTrue(outcome.cached());
            assertEquals(Map.of("cached", true), outcome.payload());
            assertEquals(0, calls.get());
            assertTrue(guard.stored.isEmpty());
        }

        @Test
        @DisplayName("a miss invokes the tool and reports what the guard stores")
        void missStoresFresh() {
            var guard = new RecordingGuard(Optional.empty());
            var invocation = new ToolInvocation("t", guard, () -> Map.of("x", 1, "y", 2));

            ToolOutcome outcome = orchestrator.execute("AUD-8", List.of(invocation), Set.of()).outcome("t");

            assertFalse(outcome.cached());
            assertEquals(List.of(Map.of("x", 1, "y", 2)), guard.stored);
            assertEquals(Map.of("reduced", 2), outcome.payload());
        }

        @Test
        @DisplayName("a failing tool stores nothing")
        void failureStoresNothing() {
            var guard = new RecordingGuard(Optional.empty());
            var invocation = new ToolInvocation("t", guard, () -> {
                throw new java.io.IOException("disk");
            });

            ToolOutcome outcome = orchestrator.execute("AUD-9", List.of(invocation), Set.of()).outcome("t");

            assertEquals(ToolState.FAILED, outcome.state());
            assertTrue(guard.stored.isEmpty());
        }
    }

    @Nested
    @DisplayName("cancellation")
    class CancellationTests {

        @Test
        @DisplayName("the overall timeout cancels in-flight tools and keeps finished results")
        void timeoutCancels() {
            var interrupted = new CountDownLatch(1);
            var hanging = ToolInvocation.uncached("hang", () -> {
                try {
                    Thread.sleep(60_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
                return Map.of();
            });
            var quick = new TaskOrchestrator(4, Duration.ofMillis(300));

            long start = System.nanoTime();
            var result = quick.execute("AUD-10", List.of(ok("fast"), hanging), Set.of());

            assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - start) < 30);
            assertEquals(ToolState.SUCCEEDED, result.outcome("fast").state());
            assertEquals(ToolState.CANCELLED, result.outcome("hang").state());
            assertTrue(result.outcome("hang").error().contains("timed out"));
            assertEquals("cancelled", result.outcome("hang").resultPayload().get("status"));
            assertEquals(0, interrupted.getCount(), "the worker thread is interrupted");
        }

        @Test
        @DisplayName("queued tools that never started are cancelled too")
        void queuedToolsCancelled() {
            var single = new TaskOrchestrator(1, Duration.ofMillis(200));
            var hanging = ToolInvocation.uncached("hang", () -> {
                Thread.sleep(60_000);
                return Map.of();
            });

            var result = single.execute("AUD-11", List.of(hanging, ok("queued")), Set.of());

            assertEquals(ToolState.CANCELLED, result.outcome("hang").state());
            assertEquals(ToolState.CANCELLED, result.outcome("queued").state());
        }
    }

    @Test
    @DisplayName("publishes lifecycle events and records metrics")
    void eventsAndMetrics() {
        var bus = new EventBus();
        var events = new CopyOnWriteArrayList<AuditEvent>();
        bus.subscribe("AUD-12", events::add);
        var registry = new SimpleMeterRegistry();
        var instrumented = new TaskOrchestrator(2, Duration.ofSeconds(30), bus, new AuditMetrics(registry));
        var failing = ToolInvocation.uncached("bad", () -> {
            throw new IllegalStateException("x");
        });
        var cachedGuard = new RecordingGuard(Optional.of(Map.of()));

        instrumented.execute("AUD-12",
                List.of(ok("good"), failing, new ToolInvocation("hit", cachedGuard, Map::of), ok("skip")),
                Set.of("skip"));

        var types = events.stream().map(e -> e.eventType() + ":" + e.tool()).toList();
        assertTrue(types.contains("tool.started:good"));
        assertTrue(types.contains("tool.completed:good"));
        assertTrue(types.contains("tool.failed:bad"));
        assertTrue(types.contains("tool.skipped:skip"));
        assertFalse(types.contains("tool.started:skip"));

        assertNotNull(registry.find("auditflow.tool.duration").tag("tool", "good").tag("state", "SUCCEEDED").timer());
        assertNotNull(registry.find("auditflow.tool.duration").tag("tool", "bad").tag("state", "FAILED").timer());
        assertEquals(1.0, registry.find("auditflow.cache.lookups").tag("cache", "pattern").tag("result", "hit")
                .counter().count());
    }

    @Test
    @DisplayName("maxParallel below one is rejected")
    void rejectsInvalidParallelism() {
        assertThrows(IllegalArgumentException.class, () -> new TaskOrchestrator(0, Duration.ofSeconds(1)));
    }
}
