package com.agentry.core.execution;

/**
 * @param activeExecutions tasks currently running
 * @param completedToday   successful executions retained in history for the current UTC day
 * @param failedToday      failed executions retained in history for the current UTC day
 * @param totalExecutions  executions since startup
 */
public record ExecutionStatus(
    int activeExecutions,
    long completedToday,
    long failedToday,
    long totalExecutions
) {}
