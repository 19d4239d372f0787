package com.agentry.core.execution;

import com.agentry.core.cache.CacheMetrics;
import com.agentry.core.cache.HistoryMetrics;

/**
 * @param historyWithinLimits history pressure is under 90% and its ceilings hold
 * @param cacheHealthy        the cache is enabled and meets its hit-rate and latency targets
 * @param history             history counters
 * @param cache               cache counters
 */
public record PerformanceStatus(
    boolean historyWithinLimits,
    boolean cacheHealthy,
    HistoryMetrics history,
    CacheMetrics cache
) {

    public boolean healthy() {
        return historyWithinLimits && cacheHealthy;
    }
}
