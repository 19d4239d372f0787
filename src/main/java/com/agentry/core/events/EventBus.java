package com.agentry.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-process fan-out of {@link AgentryEvent}s published by the coordinator and the
 * recipe scheduler.
 * <p>
 * Listeners register with a filter and are called synchronously on the publishing
 * thread, so a batch delivers from its worker threads. A listener that throws is
 * logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    public void publish(AgentryEvent event) {
        log.debug("Publishing {} ({})", event.eventType(), event.correlationId());
        for (Listener listener : listeners) {
            if (listener.filter.test(event)) {
                deliver(listener.consumer, event);
            }
        }
    }

    public Subscription subscribe(Predicate<AgentryEvent> filter, Consumer<AgentryEvent> consumer) {
        Listener listener = new Listener(filter, consumer);
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * @param eventTypes exact event types such as {@code execution.completed}
     */
    public Subscription subscribeToTypes(Set<String> eventTypes, Consumer<AgentryEvent> consumer) {
        Set<String> types = Set.copyOf(eventTypes);
        return subscribe(e -> types.contains(e.eventType()), consumer);
    }

    public Subscription subscribeAll(Consumer<AgentryEvent> consumer) {
        return subscribe(e -> true, consumer);
    }

    public int listenerCount() {
        return listeners.size();
    }

    /**
     * Registration handle; closing it stops delivery.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {

        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }

    private void deliver(Consumer<AgentryEvent> consumer, AgentryEvent event) {
        try {
            consumer.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {}: {}", event.eventType(), e.getMessage(), e);
        }
    }

    private static final class Listener {
        private final Predicate<AgentryEvent> filter;
        private final Consumer<AgentryEvent> consumer;

        private Listener(Predicate<AgentryEvent> filter, Consumer<AgentryEvent> consumer) {
            this.filter = filter;
            this.consumer = consumer;
        }
    }
}
