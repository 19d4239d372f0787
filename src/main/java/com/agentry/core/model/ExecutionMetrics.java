package com.agentry.core.model;

import java.io.Serializable;

/**
 * Measurements captured for one task attempt.
 *
 * @param durationMs       wall-clock time from submission to result
 * @param tokensUsed       tokens reported (or estimated) by the agent runtime; null if unknown
 * @param contextSizeBytes size of the prepared prompt handed to the runtime
 */
public record ExecutionMetrics(
    long durationMs,
    Integer tokensUsed,
    long contextSizeBytes
) implements Serializable {

    public static ExecutionMetrics of(long durationMs) {
        return new ExecutionMetrics(durationMs, null, 0L);
    }
}
