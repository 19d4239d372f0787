package com.agentry.core.cache;

/**
 * @param entries        retained executions
 * @param maxEntries     entry ceiling
 * @param estimatedBytes estimated memory held by retained executions
 * @param maxBytes       memory ceiling
 * @param pressure       max of heap usage ratio and history memory ratio
 * @param evictions      entries evicted since startup
 */
public record HistoryMetrics(
    int entries,
    int maxEntries,
    long estimatedBytes,
    long maxBytes,
    double pressure,
    long evictions
) {}
