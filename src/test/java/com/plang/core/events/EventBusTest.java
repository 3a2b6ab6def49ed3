package com.plang.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
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

    private static PlangEvent event(String type, String executionId) {
        return new PlangEvent(type, executionId, null, Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("Subscriptions")
    class Subscriptions {

        @Test
        @DisplayName("per-execution subscribers only see their execution")
        void perExecution() {
            var received = new CopyOnWriteArrayList<PlangEvent>();
            eventBus.subscribe("E-1", received::add);

            eventBus.publish(event("run.started", "E-1"));
            eventBus.publish(event("run.started", "E-2"));

            assertEquals(1, received.size());
            assertEquals("E-1", received.get(0).executionId());
        }

        @Test
        @DisplayName("global subscribers see everything, including events without an execution")
        void global() {
            var received = new CopyOnWriteArrayList<String>();
            eventBus.subscribeAll(e -> received.add(e.eventType()));

            eventBus.publish(event("run.started", "E-1"));
            eventBus.publish(event("arbitration.recorded", null));

            assertEquals(List.of("run.started", "arbitration.recorded"), received);
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            var received = new CopyOnWriteArrayList<PlangEvent>();
            var subscription = eventBus.subscribe("E-1", received::add);
            subscription.unsubscribe();
            eventBus.publish(event("run.started", "E-1"));
            assertTrue(received.isEmpty());
            assertEquals(0, eventBus.sinkCount("E-1"));
        }

        @Test
        @DisplayName("publish reports how many sinks accepted the event")
        void deliveredCount() {
            eventBus.subscribe("E-1", e -> { });
            eventBus.subscribe("E-1", e -> {
                throw new IllegalStateException("sink down");
            });
            eventBus.subscribeAll(e -> { });

            assertEquals(2, eventBus.publish(event("run.started", "E-1")));
            assertEquals(1, eventBus.publish(event("arbitration.recorded", null)));
        }

        @Test
        @DisplayName("a sink attached while the last one detaches keeps receiving events")
        void attachDuringDetach() throws Exception {
            var pool = Executors.newFixedThreadPool(2);
            try {
                for (int i = 0; i < 2_000; i++) {
                    String executionId = "E-" + i;
                    var first = eventBus.subscribe(executionId, e -> { });
                    var received = new CopyOnWriteArrayList<PlangEvent>();
                    var start = new CountDownLatch(1);

                    var detach = pool.submit(() -> {
                        start.await();
                        first.unsubscribe();
                        return null;
                    });
                    var attach = pool.submit(() -> {
                        start.await();
                        return eventBus.subscribe(executionId, received::add);
                    });
                    start.countDown();
                    detach.get(5, TimeUnit.SECONDS);
                    attach.get(5, TimeUnit.SECONDS);

                    eventBus.publish(event("stage.completed", executionId));
                    assertEquals(1, received.size(), "lost event for " + executionId);
                    assertEquals(1, eventBus.sinkCount(executionId));
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Test
    @DisplayName("a failing subscriber does not block the others")
    void subscriberFailureIsolated() {
        var received = new CopyOnWriteArrayList<PlangEvent>();
        eventBus.subscribeAll(e -> {
            throw new IllegalStateException("boom");
        });
        eventBus.subscribeAll(received::add);

        eventBus.publish(event("stage.completed", "E-1"));

        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("concurrent publishers deliver every event")
    void concurrentPublish() throws InterruptedException {
        int events = 200;
        var latch = new CountDownLatch(events);
        eventBus.subscribeAll(e -> latch.countDown());
        var pool = Executors.newFixedThreadPool(4);
        try {
            for (int i = 0; i < events; i++) {
                pool.submit(() -> eventBus.publish(event("policy.failed", "E-1")));
            }
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
    }
}
