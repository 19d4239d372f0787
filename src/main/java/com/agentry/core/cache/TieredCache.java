package com.agentry.core.cache;

import com.agentry.core.metrics.AgentryMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Two-tier cache for JSON-serializable values.
 * <p>
 * Keys are namespaced as {@code category:key}. Lookups try the memory tier,
 * then the disk tier, promoting disk hits back into memory. Writes go to both.
 * A failure in either tier is logged and treated as a miss, so callers always
 * fall back to recomputing.
 */
@Service
public class TieredCache {

    private static final Logger log = LoggerFactory.getLogger(TieredCache.class);

    /** Memory tier payload: the JSON tree plus its serialized size. */
    record CachedValue(JsonNode node, long bytes) {}

    private final CacheProperties properties;
    private final ObjectMapper mapper;
    private final AgentryMetrics metrics;
    private final BoundedLruMap<String, CachedValue> memory;
    private final PersistentCacheTier disk;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong memoryHits = new AtomicLong();
    private final AtomicLong diskHits = new AtomicLong();
    private final AtomicLong totalResponseNanos = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    @Autowired
    public TieredCache(CacheProperties properties, ObjectMapper mapper,
                       @Autowired(required = false) AgentryMetrics metrics,
                       @Autowired(required = false) Clock clock) {
        this.properties = properties;
        this.mapper = mapper;
        this.metrics = metrics;
        Clock effectiveClock = clock != null ? clock : Clock.systemUTC();
        this.memory = new BoundedLruMap<>(
                properties.getMaxEntries(),
                properties.memoryMaxBytes(),
                Duration.ofMinutes(properties.getTtlMinutes()),
                CachedValue::bytes,
                effectiveClock,
                this::onMemoryEviction);
        this.disk = new PersistentCacheTier(
                Path.of(properties.getDirectory()), properties.diskMaxBytes(), mapper, effectiveClock);
    }

    /** Test constructor without metrics. */
    TieredCache(CacheProperties properties, ObjectMapper mapper, Clock clock) {
        this(properties, mapper, null, clock);
    }

    public <T> Optional<T> get(String category, String key, Class<T> type) {
        if (!properties.isEnabled()) {
            return Optional.empty();
        }
        long start = System.nanoTime();
        String fullKey = fullKey(category, key);
        try {
            CachedValue cached = memory.get(fullKey);
            if (cached != null) {
                Optional<T> value = convert(fullKey, cached.node(), type);
                if (value.isPresent()) {
                    memoryHits.incrementAndGet();
                    recordLookup("memory", true);
                    return value;
                }
            }
            Optional<JsonNode> fromDisk = disk.read(fullKey);
            if (fromDisk.isPresent()) {
                Optional<T> value = convert(fullKey, fromDisk.get(), type);
                if (value.isPresent()) {
                    memory.put(fullKey, new CachedValue(fromDisk.get(), sizeOf(fromDisk.get())));
                    diskHits.incrementAndGet();
                    recordLookup("disk", true);
                    log.debug("Promoted {} from disk to memory tier", fullKey);
                    return value;
                }
            }
            recordLookup("none", false);
            return Optional.empty();
        } finally {
            totalResponseNanos.addAndGet(System.nanoTime() - start);
        }
    }

    public boolean put(String category, String key, Object value) {
        return put(category, key, value, Duration.ofMinutes(properties.getTtlMinutes()));
    }

    /**
     * Stores a value in both tiers.
     *
     * @param ttl per-entry lifetime, or null for the configured default
     * @return true if at least one tier accepted the value
     */
    public boolean put(String category, String key, Object value, Duration ttl) {
        if (!properties.isEnabled() || value == null) {
            return false;
        }
        Duration effectiveTtl = ttl != null ? ttl : Duration.ofMinutes(properties.getTtlMinutes());
        String fullKey = fullKey(category, key);
        JsonNode node;
        try {
            node = mapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            log.warn("Value for {} is not JSON-serializable: {}", fullKey, e.getMessage());
            return false;
        }
        boolean inMemory = memory.put(fullKey, new CachedValue(node, sizeOf(node)), effectiveTtl);
        boolean onDisk = disk.write(fullKey, node, effectiveTtl);
        return inMemory || onDisk;
    }

    public boolean delete(String category, String key) {
        String fullKey = fullKey(category, key);
        boolean fromMemory = memory.remove(fullKey, EvictionReason.EXPLICIT) != null;
        boolean fromDisk = disk.delete(fullKey);
        return fromMemory || fromDisk;
    }

    /**
     * Removes one entry because its source changed.
     */
    public void invalidate(String category, String key) {
        String fullKey = fullKey(category, key);
        memory.remove(fullKey, EvictionReason.STALE);
        disk.delete(fullKey);
    }

    public void clear() {
        memory.clear();
        disk.clear();
        log.info("Cache cleared");
    }

    public int clear(String category) {
        String prefix = category + ":";
        int removed = memory.removeIf((k, v) -> k.startsWith(prefix), EvictionReason.EXPLICIT);
        removed += disk.deleteByPrefix(prefix);
        log.info("Cleared {} cache entries in category {}", removed, category);
        return removed;
    }

    /**
     * Purges expired entries from both tiers.
     *
     * @return number of entries removed
     */
    public int sweep() {
        int removed = memory.purgeExpired() + disk.purgeExpired();
        if (removed > 0) {
            log.debug("Cache sweep removed {} expired entries", removed);
        }
        return removed;
    }

    public CacheMetrics metrics() {
        long h = hits.get();
        long m = misses.get();
        long requests = h + m;
        double hitRate = requests == 0 ? 0.0 : (double) h / requests;
        double avgMs = requests == 0 ? 0.0 : totalResponseNanos.get() / (double) requests / 1_000_000.0;
        return new CacheMetrics(h, m, memoryHits.get(), diskHits.get(), hitRate, avgMs,
                memory.size(), memory.weightedSize(), disk.entryCount(), disk.totalBytes(), evictions.get());
    }

    /**
     * Healthy when enabled, lookups average under 100 ms and, once traffic exists,
     * more than 30% of lookups hit.
     */
    public boolean isHealthy() {
        if (!properties.isEnabled()) {
            return false;
        }
        CacheMetrics current = metrics();
        if (current.requests() == 0) {
            return true;
        }
        return current.hitRate() > 0.3 && current.averageResponseMs() < 100.0;
    }

    public String status() {
        if (!properties.isEnabled()) {
            return "Cache disabled";
        }
        CacheMetrics m = metrics();
        return String.format(Locale.ROOT,
                "Cache %s: hit rate %.1f%% (%d hits, %d misses), avg %.2f ms, memory %d entries / %.2f MB, disk %d entries / %.2f MB",
                isHealthy() ? "healthy" : "degraded",
                m.hitRate() * 100, m.hits(), m.misses(), m.averageResponseMs(),
                m.memoryEntries(), m.memoryBytes() / 1048576.0,
                m.diskEntries(), m.diskBytes() / 1048576.0);
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    int memorySize() {
        return memory.size();
    }

    long memoryBytes() {
        return memory.weightedSize();
    }

    private <T> Optional<T> convert(String fullKey, JsonNode node, Class<T> type) {
        try {
            return Optional.ofNullable(mapper.treeToValue(node, type));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Cached value for {} cannot be read as {}, dropping it: {}",
                    fullKey, type.getSimpleName(), e.getMessage());
            memory.remove(fullKey, EvictionReason.STALE);
            disk.delete(fullKey);
            return Optional.empty();
        }
    }

    private long sizeOf(JsonNode node) {
        try {
            return mapper.writeValueAsBytes(node).length;
        } catch (JsonProcessingException e) {
            return node.toString().length();
        }
    }

    private void recordLookup(String tier, boolean hit) {
        if (hit) {
            hits.incrementAndGet();
        } else {
            misses.incrementAndGet();
        }
        if (metrics != null) {
            metrics.recordCacheRequest(tier, hit);
        }
    }

    private void onMemoryEviction(String key, CachedValue value, EvictionReason reason) {
        evictions.incrementAndGet();
        log.debug("Evicted {} from memory tier ({})", key, reason);
        if (metrics != null) {
            metrics.recordCacheEviction("memory", reason.name().toLowerCase(Locale.ROOT));
        }
    }

    private static String fullKey(String category, String key) {
        return category + ":" + key;
    }
}
