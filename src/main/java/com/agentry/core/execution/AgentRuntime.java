package com.agentry.core.execution;

import java.time.Duration;

/**
 * The backend that actually runs an agent. Implementations may fail, hang or
 * return partial output; the coordinator enforces the deadline independently
 * and interrupts the calling thread when it expires.
 */
public interface AgentRuntime {

    /**
     * @param agentName identifier of the agent
     * @param task      the instruction text
     * @param context   prepared context and variables, rendered as markdown sections
     * @param timeout   the deadline the coordinator will enforce
     */
    AgentResponse invoke(String agentName, String task, String context, Duration timeout) throws Exception;

    /**
     * Short description for health output.
     */
    default String describe() {
        return getClass().getSimpleName();
    }

    /**
     * True when the runtime can accept work.
     */
    default boolean isAvailable() {
        return true;
    }
}
