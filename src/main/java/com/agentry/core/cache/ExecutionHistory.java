package com.agentry.core.cache;

import com.agentry.core.metrics.AgentryMetrics;
import com.agentry.core.model.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleSupplier;

/**
 * Capped window of recent {@link ExecutionResult}s, bounded by count, estimated
 * memory and age. Oldest entries go first.
 */
@Service
public class ExecutionHistory {

    private static final Logger log = LoggerFactory.getLogger(ExecutionHistory.class);

    static final double WITHIN_LIMITS_PRESSURE = 0.9;

    private final HistoryProperties properties;
    private final AgentryMetrics metrics;
    private final Clock clock;
    private final DoubleSupplier heapPressure;
    private final BoundedLruMap<String, HistoryEntry> entries;
    private final AtomicLong evictions = new AtomicLong();

    @Autowired
    public ExecutionHistory(HistoryProperties properties,
                            @Autowired(required = false) AgentryMetrics metrics,
                            @Autowired(required = false) Clock clock) {
        this(properties, metrics, clock != null ? clock : Clock.systemUTC(), ExecutionHistory::jvmHeapPressure);
    }

    ExecutionHistory(HistoryProperties properties, AgentryMetrics metrics, Clock clock, DoubleSupplier heapPressure) {
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.heapPressure = heapPressure;
        this.entries = new BoundedLruMap<>(
                properties.getMaxEntries(),
                properties.maxMemoryBytes(),
                Duration.ofMinutes(properties.getTtlMinutes()),
                HistoryEntry::estimatedBytes,
                clock,
                this::onEviction);
    }

    public HistoryEntry record(String executionId, String taskDescription, ExecutionResult result) {
        HistoryEntry entry = new HistoryEntry(executionId, summarize(taskDescription), result, clock.instant());
        if (!entries.put(executionId, entry)) {
            log.warn("Execution {} is larger than the history ceiling and was not retained", executionId);
        }
        return entry;
    }

    public Optional<HistoryEntry> find(String executionId) {
        return Optional.ofNullable(entries.get(executionId));
    }

    /**
     * Live entries, newest first.
     */
    public List<HistoryEntry> all() {
        Instant now = clock.instant();
        return entries.values().stream()
                .filter(e -> now.isBefore(e.recordedAt().plus(Duration.ofMinutes(properties.getTtlMinutes())))
                        || properties.getTtlMinutes() <= 0)
                .sorted(Comparator.comparing(HistoryEntry::recordedAt).reversed())
                .toList();
    }

    public List<HistoryEntry> byAgent(String agentName) {
        return all().stream().filter(e -> agentName.equals(e.agentName())).toList();
    }

    public boolean remove(String executionId) {
        return entries.remove(executionId) != null;
    }

    public void clear() {
        entries.clear();
    }

    /**
     * Drops expired entries, then, when pressure is above the configured threshold,
     * evicts the configured fraction of the oldest remaining entries.
     *
     * @return number of entries removed
     */
    public int sweep() {
        int removed = entries.purgeExpired();
        double pressure = pressure();
        if (pressure > properties.getPressureThreshold() && entries.size() > 0) {
            int toEvict = (int) Math.ceil(entries.size() * properties.getPressureEvictFraction());
            int evicted = entries.evictOldest(toEvict, EvictionReason.PRESSURE);
            log.info("Memory pressure {} above {}, evicted {} oldest history entries",
                    String.format(Locale.ROOT, "%.2f", pressure), properties.getPressureThreshold(), evicted);
            removed += evicted;
        }
        return removed;
    }

    public double pressure() {
        double historyRatio = (double) entries.weightedSize() / properties.maxMemoryBytes();
        return Math.max(heapPressure.getAsDouble(), historyRatio);
    }

    public boolean isWithinLimits() {
        return pressure() < WITHIN_LIMITS_PRESSURE
                && entries.size() <= properties.getMaxEntries()
                && entries.weightedSize() <= properties.maxMemoryBytes();
    }

    public HistoryMetrics metrics() {
        return new HistoryMetrics(entries.size(), properties.getMaxEntries(),
                entries.weightedSize(), properties.maxMemoryBytes(), pressure(), evictions.get());
    }

    public int size() {
        return entries.size();
    }

    public String summary() {
        HistoryMetrics m = metrics();
        return String.format(Locale.ROOT, "History: %d/%d entries, %.2f/%.2f MB, pressure %.1f%%, %d evicted",
                m.entries(), m.maxEntries(), m.estimatedBytes() / 1048576.0, m.maxBytes() / 1048576.0,
                m.pressure() * 100, m.evictions());
    }

    private void onEviction(String key, HistoryEntry entry, EvictionReason reason) {
        evictions.incrementAndGet();
        if (metrics != null) {
            metrics.recordCacheEviction("history", reason.name().toLowerCase(Locale.ROOT));
        }
    }

    private static String summarize(String taskDescription) {
        if (taskDescription == null) {
            return "";
        }
        return taskDescription.length() <= 100 ? taskDescription : taskDescription.substring(0, 100);
    }

    static double jvmHeapPressure() {
        Runtime runtime = Runtime.getRuntime();
        long used = runtime.totalMemory() - runtime.freeMemory();
        return (double) used / runtime.maxMemory();
    }
}
