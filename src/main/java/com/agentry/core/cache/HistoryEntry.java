package com.agentry.core.cache;

import com.agentry.core.model.ExecutionResult;

import java.time.Instant;

/**
 * One retained execution.
 *
 * @param executionId unique id assigned by the coordinator
 * @param taskSummary first part of the task description, for log listings
 * @param result      the final result
 * @param recordedAt  when the entry was added
 */
public record HistoryEntry(
    String executionId,
    String taskSummary,
    ExecutionResult result,
    Instant recordedAt
) {

    public String agentName() {
        return result.agentName();
    }

    /**
     * Rough heap footprint: UTF-16 text plus a fixed per-entry overhead.
     */
    public long estimatedBytes() {
        long chars = length(executionId) + length(taskSummary)
                + length(result.output()) + length(result.error()) + length(result.agentName());
        return 256 + chars * 2;
    }

    private static long length(String value) {
        return value == null ? 0 : value.length();
    }
}
