package com.agentry.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiPredicate;
import java.util.function.ToLongFunction;

/**
 * Least-recently-used map bounded by entry count and by cumulative weight,
 * with a per-entry time-to-live.
 * <p>
 * All access goes through one lock. Eviction listeners run after the lock is
 * released so a listener may call back into the map.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class BoundedLruMap<K, V> {

    /**
     * Notified for every entry that leaves the map other than through {@link #put} replacement.
     */
    @FunctionalInterface
    public interface EvictionListener<K, V> {
        void onEviction(K key, V value, EvictionReason reason);
    }

    private record Node<V>(V value, long weight, Instant storedAt, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }

    private record Evicted<K, V>(K key, V value, EvictionReason reason) {}

    private final int maxEntries;
    private final long maxWeight;
    private final Duration defaultTtl;
    private final ToLongFunction<V> weigher;
    private final Clock clock;
    private final EvictionListener<K, V> listener;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<K, Node<V>> entries = new LinkedHashMap<>(16, 0.75f, true);
    private long weightedSize;

    public BoundedLruMap(int maxEntries, long maxWeight, Duration defaultTtl,
                         ToLongFunction<V> weigher, Clock clock, EvictionListener<K, V> listener) {
        if (maxEntries <= 0 || maxWeight <= 0) {
            throw new IllegalArgumentException("Bounds must be positive");
        }
        this.maxEntries = maxEntries;
        this.maxWeight = maxWeight;
        this.defaultTtl = defaultTtl;
        this.weigher = weigher;
        this.clock = clock;
        this.listener = listener != null ? listener : (k, v, r) -> { };
    }

    /**
     * Inserts with the default TTL.
     *
     * @return false when the value alone is heavier than the weight ceiling and was not stored
     */
    public boolean put(K key, V value) {
        return put(key, value, defaultTtl);
    }

    public boolean put(K key, V value, Duration ttl) {
        long weight = Math.max(0, weigher.applyAsLong(value));
        if (weight > maxWeight) {
            return false;
        }
        Instant now = clock.instant();
        Instant expiresAt = ttl == null || ttl.isZero() || ttl.isNegative() ? null : now.plus(ttl);
        List<Evicted<K, V>> evicted = new ArrayList<>();
        lock.lock();
        try {
            Node<V> previous = entries.remove(key);
            if (previous != null) {
                weightedSize -= previous.weight();
            }
            entries.put(key, new Node<>(value, weight, now, expiresAt));
            weightedSize += weight;
            Iterator<Map.Entry<K, Node<V>>> it = entries.entrySet().iterator();
            while ((entries.size() > maxEntries || weightedSize > maxWeight) && it.hasNext()) {
                Map.Entry<K, Node<V>> eldest = it.next();
                if (eldest.getKey().equals(key)) {
                    continue;
                }
                it.remove();
                weightedSize -= eldest.getValue().weight();
                evicted.add(new Evicted<>(eldest.getKey(), eldest.getValue().value(), EvictionReason.CAPACITY));
            }
        } finally {
            lock.unlock();
        }
        fireEvictions(evicted);
        return true;
    }

    /**
     * Returns the live value and marks it most recently used. Expired entries are removed.
     */
    public V get(K key) {
        Evicted<K, V> expired = null;
        V value = null;
        lock.lock();
        try {
            Node<V> node = entries.get(key);
            if (node != null) {
                if (node.isExpired(clock.instant())) {
                    entries.remove(key);
                    weightedSize -= node.weight();
                    expired = new Evicted<>(key, node.value(), EvictionReason.EXPIRED);
                } else {
                    value = node.value();
                }
            }
        } finally {
            lock.unlock();
        }
        if (expired != null) {
            fireEvictions(List.of(expired));
        }
        return value;
    }

    public boolean containsKey(K key) {
        return get(key) != null;
    }

    public V remove(K key) {
        return remove(key, EvictionReason.EXPLICIT);
    }

    public V remove(K key, EvictionReason reason) {
        Node<V> node;
        lock.lock();
        try {
            node = entries.remove(key);
            if (node != null) {
                weightedSize -= node.weight();
            }
        } finally {
            lock.unlock();
        }
        if (node == null) {
            return null;
        }
        fireEvictions(List.of(new Evicted<>(key, node.value(), reason)));
        return node.value();
    }

    /**
     * Removes every entry matching the predicate.
     *
     * @return number of entries removed
     */
    public int removeIf(BiPredicate<K, V> predicate, EvictionReason reason) {
        List<Evicted<K, V>> removed = new ArrayList<>();
        lock.lock();
        try {
            Iterator<Map.Entry<K, Node<V>>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<K, Node<V>> e = it.next();
                if (predicate.test(e.getKey(), e.getValue().value())) {
                    it.remove();
                    weightedSize -= e.getValue().weight();
                    removed.add(new Evicted<>(e.getKey(), e.getValue().value(), reason));
                }
            }
        } finally {
            lock.unlock();
        }
        fireEvictions(removed);
        return removed.size();
    }

    public int purgeExpired() {
        Instant now = clock.instant();
        List<Evicted<K, V>> removed = new ArrayList<>();
        lock.lock();
        try {
            Iterator<Map.Entry<K, Node<V>>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<K, Node<V>> e = it.next();
                if (e.getValue().isExpired(now)) {
                    it.remove();
                    weightedSize -= e.getValue().weight();
                    removed.add(new Evicted<>(e.getKey(), e.getValue().value(), EvictionReason.EXPIRED));
                }
            }
        } finally {
            lock.unlock();
        }
        fireEvictions(removed);
        return removed.size();
    }

    /**
     * Evicts up to {@code count} least-recently-used entries.
     */
    public int evictOldest(int count, EvictionReason reason) {
        List<Evicted<K, V>> removed = new ArrayList<>();
        lock.lock();
        try {
            Iterator<Map.Entry<K, Node<V>>> it = entries.entrySet().iterator();
            while (removed.size() < count && it.hasNext()) {
                Map.Entry<K, Node<V>> e = it.next();
                it.remove();
                weightedSize -= e.getValue().weight();
                removed.add(new Evicted<>(e.getKey(), e.getValue().value(), reason));
            }
        } finally {
            lock.unlock();
        }
        fireEvictions(removed);
        return removed.size();
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
            weightedSize = 0;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public long weightedSize() {
        lock.lock();
        try {
            return weightedSize;
        } finally {
            lock.unlock();
        }
    }

    public int maxEntries() {
        return maxEntries;
    }

    public long maxWeight() {
        return maxWeight;
    }

    /**
     * Values from least to most recently used. Does not change recency.
     */
    public List<V> values() {
        lock.lock();
        try {
            List<V> values = new ArrayList<>(entries.size());
            for (Node<V> node : entries.values()) {
                values.add(node.value());
            }
            return values;
        } finally {
            lock.unlock();
        }
    }

    private void fireEvictions(List<Evicted<K, V>> evicted) {
        for (Evicted<K, V> e : evicted) {
            listener.onEviction(e.key(), e.value(), e.reason());
        }
    }
}
