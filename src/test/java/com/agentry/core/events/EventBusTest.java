package com.agentry.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus bus;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
    }

    private static AgentryEvent event(String type, String correlationId) {
        return AgentryEvent.of(type, correlationId, "reviewer", Map.of("attempt", 1));
    }

    // -- Filtered subscriptions -----------------------------------------------

    @Nested
    @DisplayName("Filtered subscriptions")
    class Filtered {

        @Test
        @DisplayName("type subscriptions receive only the listed event types")
        void deliversListedTypes() {
            List<AgentryEvent> received = new CopyOnWriteArrayList<>();
            bus.subscribeToTypes(Set.of("execution.completed", "recipe.batch"), received::add);

            bus.publish(event("execution.started", "exec-1"));
            bus.publish(event("execution.completed", "exec-1"));
            bus.publish(event("recipe.batch", "run-1"));

            assertEquals(List.of("execution.completed", "recipe.batch"),
                    received.stream().map(AgentryEvent::eventType).toList());
        }

        @Test
        @DisplayName("predicate subscriptions can select by correlation id")
        void predicateFilter() {
            List<AgentryEvent> received = new CopyOnWriteArrayList<>();
            bus.subscribe(e -> "exec-1".equals(e.correlationId()), received::add);

            bus.publish(event("execution.started", "exec-1"));
            bus.publish(event("execution.started", "exec-2"));
            bus.publish(event("cache.swept", null));

            assertEquals(1, received.size());
            assertEquals("exec-1", received.get(0).correlationId());
        }

        @Test
        @DisplayName("closing a subscription stops delivery and releases the listener")
        void closeStopsDelivery() {
            AtomicInteger count = new AtomicInteger();
            try (EventBus.Subscription subscription = bus.subscribeToTypes(Set.of("execution.started"),
                    e -> count.incrementAndGet())) {
                bus.publish(event("execution.started", "exec-1"));
                assertEquals(1, bus.listenerCount());
            }
            bus.publish(event("execution.started", "exec-1"));

            assertEquals(1, count.get());
            assertEquals(0, bus.listenerCount());
        }
    }

    // -- Global subscriptions -------------------------------------------------

    @Test
    @DisplayName("global subscribers receive every event until they unsubscribe")
    void globalSubscription() {
        List<String> types = new CopyOnWriteArrayList<>();
        EventBus.Subscription subscription = bus.subscribeAll(e -> types.add(e.eventType()));

        bus.publish(event("recipe.started", "run-1"));
        bus.publish(event("batch.completed", "batch-7"));
        subscription.unsubscribe();
        bus.publish(event("recipe.completed", "run-1"));

        assertEquals(List.of("recipe.started", "batch.completed"), types);
    }

    // -- Edge cases -----------------------------------------------------------

    @Test
    @DisplayName("a failing subscriber does not stop delivery to the others")
    void subscriberFailureIsolated() {
        AtomicInteger delivered = new AtomicInteger();
        bus.subscribeAll(e -> { throw new IllegalStateException("boom"); });
        bus.subscribeAll(e -> delivered.incrementAndGet());

        assertDoesNotThrow(() -> bus.publish(event("execution.failed", "exec-1")));
        assertEquals(1, delivered.get());
    }

    @Test
    @DisplayName("publishing with no subscribers is a no-op")
    void noSubscribers() {
        assertDoesNotThrow(() -> bus.publish(
                new AgentryEvent("execution.started", "exec-1", null, Map.of(), Instant.now())));
    }

    @Test
    @DisplayName("concurrent publishers deliver every event")
    void concurrentPublish() throws InterruptedException {
        AtomicInteger count = new AtomicInteger();
        bus.subscribeToTypes(Set.of("execution.completed"), e -> count.incrementAndGet());

        int threads = 8;
        int perThread = 50;
        CountDownLatch done = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            new Thread(() -> {
                for (int i = 0; i < perThread; i++) {
                    bus.publish(event("execution.completed", "batch-1"));
                }
                done.countDown();
            }).start();
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertEquals(threads * perThread, count.get());
    }
}
