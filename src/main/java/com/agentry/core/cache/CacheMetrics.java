package com.agentry.core.cache;

/**
 * Point-in-time counters for the {@link TieredCache}.
 *
 * @param hits              lookups answered by either tier
 * @param misses            lookups answered by neither tier
 * @param memoryHits        hits served by the memory tier
 * @param diskHits          hits served by the disk tier and promoted
 * @param hitRate           hits / (hits + misses), 0 when nothing was requested
 * @param averageResponseMs mean lookup latency in milliseconds
 * @param memoryEntries     entries held by the memory tier
 * @param memoryBytes       estimated bytes held by the memory tier
 * @param diskEntries       entry files in the disk tier
 * @param diskBytes         bytes used by the disk tier
 * @param evictions         entries evicted from the memory tier since startup
 */
public record CacheMetrics(
    long hits,
    long misses,
    long memoryHits,
    long diskHits,
    double hitRate,
    double averageResponseMs,
    int memoryEntries,
    long memoryBytes,
    int diskEntries,
    long diskBytes,
    long evictions
) {

    public long requests() {
        return hits + misses;
    }
}
