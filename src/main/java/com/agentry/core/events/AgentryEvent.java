package com.agentry.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while tasks, batches and recipes run.
 *
 * @param eventType     event type (e.g. "execution.started", "batch.completed", "recipe.failed")
 * @param correlationId execution id, batch id or recipe run id the event belongs to
 * @param agentName     the agent involved (nullable for batch- and recipe-level events)
 * @param payload       arbitrary key-value data associated with the event
 * @param timestamp     when the event occurred
 */
public record AgentryEvent(
    String eventType,
    String correlationId,
    String agentName,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static AgentryEvent of(String eventType, String correlationId, String agentName,
                                  Map<String, Object> payload) {
        return new AgentryEvent(eventType, correlationId, agentName, payload, Instant.now());
    }
}
