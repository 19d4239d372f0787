package com.agentry.core.context;

import com.agentry.core.cache.Digests;
import com.agentry.core.cache.TieredCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Context snapshots keyed by source path, validated against the current
 * signature on every lookup.
 */
@Component
public class ContextCache {

    private static final Logger log = LoggerFactory.getLogger(ContextCache.class);

    static final String CATEGORY = "context";

    private final TieredCache cache;

    public ContextCache(TieredCache cache) {
        this.cache = cache;
    }

    /**
     * Returns the cached snapshot only if its signature equals {@code currentSignature}.
     * A mismatching entry is evicted and reported as a miss.
     */
    public Optional<ContextSnapshot> lookup(Path source, String currentSignature) {
        String key = keyFor(source);
        Optional<ContextSnapshot> cached = cache.get(CATEGORY, key, ContextSnapshot.class);
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        if (!currentSignature.equals(cached.get().signature())) {
            log.debug("Context for {} changed since it was cached, evicting", source);
            cache.invalidate(CATEGORY, key);
            return Optional.empty();
        }
        return cached;
    }

    public void store(Path source, ContextSnapshot snapshot) {
        cache.put(CATEGORY, keyFor(source), snapshot);
    }

    public void evict(Path source) {
        cache.invalidate(CATEGORY, keyFor(source));
    }

    public int clear() {
        return cache.clear(CATEGORY);
    }

    static String keyFor(Path source) {
        return Digests.sha256Hex(source.toAbsolutePath().normalize().toString());
    }
}
