package com.agentry.dispatch.cli;

import com.agentry.core.events.AgentryEvent;
import com.agentry.core.events.EventBus;

import java.util.Set;

/**
 * Prints a line per finished task and per finished recipe batch while a command runs.
 * Close it to stop printing.
 */
final class ProgressPrinter implements AutoCloseable {

    static final Set<String> EVENT_TYPES = Set.of("execution.completed", "execution.failed", "recipe.batch");

    private final EventBus.Subscription subscription;

    private ProgressPrinter(EventBus eventBus) {
        this.subscription = eventBus.subscribeToTypes(EVENT_TYPES, ProgressPrinter::print);
    }

    static ProgressPrinter attach(EventBus eventBus) {
        return new ProgressPrinter(eventBus);
    }

    static void print(AgentryEvent event) {
        var payload = event.payload();
        switch (event.eventType()) {
            case "execution.completed" ->
                    ConsoleOutput.agent(event.agentName(), "done in " + payload.get("durationMs") + "ms");
            case "execution.failed" ->
                    ConsoleOutput.agent(event.agentName(), "failed (" + payload.get("errorKind") + ") after "
                            + payload.get("durationMs") + "ms");
            case "recipe.batch" ->
                    ConsoleOutput.info("Batch " + payload.get("batch") + " finished (" + payload.get("steps") + " steps)");
            default -> { }
        }
    }

    @Override
    public void close() {
        subscription.unsubscribe();
    }
}
