package com.agentry.core.execution;

import java.util.List;

/**
 * Aggregated execution metrics for reporting.
 */
public record ExecutionSummary(
    long totalExecutions,
    long successfulExecutions,
    long failedExecutions,
    double successRate,
    double averageDurationMs,
    long totalTokens,
    String mostUsedAgent,
    List<AgentStats> agents
) {}
