package com.agentry.core.execution;

/**
 * Per-agent rolling numbers.
 */
public record AgentStats(
    String agentName,
    long executions,
    long successes,
    double averageDurationMs
) {

    public double successRate() {
        return executions == 0 ? 0.0 : (double) successes / executions;
    }
}
