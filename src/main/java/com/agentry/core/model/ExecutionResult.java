package com.agentry.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Outcome of a single task attempt. Created once, never mutated.
 *
 * @param success   true if the agent completed and any requested output was written
 * @param output    agent output (may be present on failure when the output write failed)
 * @param error     human-readable error; exactly {@code "timeout"} for timed-out tasks
 * @param errorKind failure classification, null on success
 * @param metrics   duration, token and context size measurements
 * @param agentName the agent that was asked to run the task
 * @param timestamp when the result was produced
 */
public record ExecutionResult(
    boolean success,
    String output,
    String error,
    ErrorKind errorKind,
    ExecutionMetrics metrics,
    String agentName,
    Instant timestamp
) implements Serializable {

    public static final String TIMEOUT_ERROR = "timeout";

    public static ExecutionResult succeeded(String agentName, String output, ExecutionMetrics metrics) {
        return new ExecutionResult(true, output, null, null, metrics, agentName, Instant.now());
    }

    public static ExecutionResult failed(String agentName, ErrorKind kind, String error, ExecutionMetrics metrics) {
        return new ExecutionResult(false, null, error, kind, metrics, agentName, Instant.now());
    }

    public static ExecutionResult timedOut(String agentName, ExecutionMetrics metrics) {
        return failed(agentName, ErrorKind.TIMEOUT, TIMEOUT_ERROR, metrics);
    }

    public boolean isTimeout() {
        return errorKind == ErrorKind.TIMEOUT;
    }
}
