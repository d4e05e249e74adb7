package com.auditflow.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static AuditEvent event(String type, String runId, String tool) {
        return new AuditEvent(type, runId, tool, Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("AuditEvent")
    class AuditEventTests {

        @Test
        @DisplayName("of() stamps the current time")
        void ofStampsTime() {
            Instant before = Instant.now();
            var event = AuditEvent.of("tool.started", "AUD-2025-0001", "ruff", Map.of("k", "v"));

            assertEquals("tool.started", event.eventType());
            assertEquals("ruff", event.tool());
            assertEquals(Map.of("k", "v"), event.payload());
            assertFalse(event.timestamp().isBefore(before));
        }

        @Test
        @DisplayName("allows a null tool for run-level events")
        void allowsNullTool() {
            assertNull(event("audit.started", "AUD-2025-0001", null).tool());
        }
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers only to subscribers of the event's run")
        void deliversToRunSubscribers() {
            List<AuditEvent> mine = new ArrayList<>();
            List<AuditEvent> other = new ArrayList<>();
            eventBus.subscribe("AUD-1", mine::add);
            eventBus.subscribe("AUD-2", other::add);

            var event = event("tool.completed", "AUD-1", "bandit");
            eventBus.publish(event);

            assertEquals(List.of(event), mine);
            assertTrue(other.isEmpty());
        }

        @Test
        @DisplayName("global subscribers see every run, in publish order")
        void globalSubscriberSeesAll() {
            List<AuditEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event("audit.started", "AUD-1", null));
            eventBus.publish(event("audit.started", "AUD-2", null));

            assertEquals(List.of("AUD-1", "AUD-2"), received.stream().map(AuditEvent::runId).toList());
        }

        @Test
        @DisplayName("unsubscribing stops delivery")
        void unsubscribe() {
            List<AuditEvent> received = new ArrayList<>();
            EventBus.Subscription run = eventBus.subscribe("AUD-1", received::add);
            EventBus.Subscription all = eventBus.subscribeAll(received::add);

            eventBus.publish(event("tool.started", "AUD-1", "ruff"));
            run.unsubscribe();
            all.unsubscribe();
            eventBus.publish(event("tool.completed", "AUD-1", "ruff"));

            assertEquals(2, received.size());
        }
    }

    @Nested
    @DisplayName("robustness")
    class RobustnessTests {

        @Test
        @DisplayName("a throwing subscriber does not block the others")
        void subscriberExceptionIsContained() {
            List<AuditEvent> received = new ArrayList<>();
            eventBus.subscribe("AUD-1", e -> {
                throw new RuntimeException("boom");
            });
            eventBus.subscribe("AUD-1", received::add);

            eventBus.publish(event("tool.failed", "AUD-1", "mypy"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("handles concurrent publishes from tool workers")
        void concurrentPublishes() throws InterruptedException {
            var received = new CopyOnWriteArrayList<AuditEvent>();
            eventBus.subscribe("AUD-1", received::add);

            int threads = 8;
            int perThread = 100;
            var latch = new CountDownLatch(threads);
            for (int t = 0; t < threads; t++) {
                final int id = t;
                new Thread(() -> {
                    for (int i = 0; i < perThread; i++) {
                        eventBus.publish(event("tool.completed", "AUD-1", "tool-" + id));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals(threads * perThread, received.size());
        }
    }
}
