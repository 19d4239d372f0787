package com.agentry.core.cache;

import com.agentry.core.metrics.AgentryMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TieredCacheTest {

    record Plan(String name, List<String> steps) {}

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private MutableClock clock;
    private CacheProperties properties;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        properties = new CacheProperties();
        properties.setDirectory(tempDir.resolve("cache").toString());
    }

    private TieredCache newCache() {
        return new TieredCache(properties, mapper, clock);
    }

    @Nested
    @DisplayName("Lookups")
    class Lookups {

        @Test
        @DisplayName("a miss is recorded and returns empty")
        void miss() {
            var cache = newCache();

            assertTrue(cache.get("plans", "p1", Plan.class).isEmpty());
            assertEquals(1, cache.metrics().misses());
        }

        @Test
        @DisplayName("a stored value is served from memory")
        void memoryHit() {
            var cache = newCache();
            var plan = new Plan("deploy", List.of("build", "test"));
            cache.put("plans", "p1", plan);

            assertEquals(plan, cache.get("plans", "p1", Plan.class).orElseThrow());
            assertEquals(1, cache.metrics().memoryHits());
            assertEquals(0, cache.metrics().diskHits());
        }

        @Test
        @DisplayName("a disk hit is promoted into memory")
        void diskHitPromotes() {
            newCache().put("plans", "p1", new Plan("deploy", List.of("build")));

            var fresh = newCache();
            assertEquals(0, fresh.memorySize());

            assertTrue(fresh.get("plans", "p1", Plan.class).isPresent());
            assertEquals(1, fresh.metrics().diskHits());
            assertEquals(1, fresh.memorySize());

            fresh.get("plans", "p1", Plan.class);
            assertEquals(1, fresh.metrics().memoryHits());
        }

        @Test
        @DisplayName("a value that no longer fits the requested type is dropped")
        void incompatibleValue() {
            var cache = newCache();
            cache.put("plans", "p1", "not a number");

            assertTrue(cache.get("plans", "p1", Integer.class).isEmpty());
            assertTrue(cache.get("plans", "p1", String.class).isEmpty());
        }

        @Test
        @DisplayName("entries expire in both tiers")
        void expiry() {
            var cache = newCache();
            cache.put("plans", "p1", new Plan("deploy", List.of()), Duration.ofMinutes(1));
            clock.advance(Duration.ofMinutes(2));

            assertTrue(cache.get("plans", "p1", Plan.class).isEmpty());
            assertTrue(newCache().get("plans", "p1", Plan.class).isEmpty());
        }
    }

    @Nested
    @DisplayName("Invalidation")
    class Invalidation {

        @Test
        @DisplayName("clearing a category leaves other categories alone")
        void clearCategory() {
            var cache = newCache();
            cache.put("context", "a", "1");
            cache.put("context", "b", "2");
            cache.put("other", "c", "3");

            assertTrue(cache.clear("context") >= 2);

            assertTrue(cache.get("context", "a", String.class).isEmpty());
            assertTrue(cache.get("context", "b", String.class).isEmpty());
            assertEquals("3", cache.get("other", "c", String.class).orElseThrow());
        }

        @Test
        @DisplayName("invalidate removes the entry from both tiers")
        void invalidate() {
            var cache = newCache();
            cache.put("context", "a", "1");
            cache.invalidate("context", "a");

            assertTrue(cache.get("context", "a", String.class).isEmpty());
            assertEquals(0, cache.metrics().diskEntries());
        }

        @Test
        @DisplayName("sweep purges expired entries without a read")
        void sweep() {
            var cache = newCache();
            cache.put("plans", "old", "1", Duration.ofMinutes(1));
            cache.put("plans", "new", "2", Duration.ofHours(1));
            clock.advance(Duration.ofMinutes(5));

            assertEquals(2, cache.sweep());
            assertEquals(1, cache.memorySize());
        }
    }

    @Nested
    @DisplayName("Health")
    class Health {

        @Test
        @DisplayName("healthy before any traffic")
        void healthyWithoutTraffic() {
            assertTrue(newCache().isHealthy());
        }

        @Test
        @DisplayName("degraded when almost nothing hits")
        void degradedOnMisses() {
            var cache = newCache();
            for (int i = 0; i < 10; i++) {
                cache.get("plans", "missing-" + i, String.class);
            }

            assertFalse(cache.isHealthy());
            assertTrue(cache.status().contains("degraded"));
        }

        @Test
        @DisplayName("a disabled cache stores nothing and reports unhealthy")
        void disabled() {
            properties.setEnabled(false);
            var cache = newCache();

            assertFalse(cache.put("plans", "p1", "v"));
            assertTrue(cache.get("plans", "p1", String.class).isEmpty());
            assertFalse(cache.isHealthy());
        }
    }

    @Test
    @DisplayName("lookups and evictions are published as meters")
    void publishesMeters() {
        var registry = new SimpleMeterRegistry();
        var cache = new TieredCache(properties, mapper, new AgentryMetrics(registry), clock);
        cache.put("plans", "p1", "v");
        cache.get("plans", "p1", String.class);
        cache.get("plans", "p2", String.class);
        cache.delete("plans", "p1");

        assertEquals(1.0, registry.get("agentry.cache.requests").tag("tier", "memory").tag("result", "hit").counter().count());
        assertEquals(1.0, registry.get("agentry.cache.requests").tag("tier", "none").tag("result", "miss").counter().count());
        assertEquals(1.0, registry.get("agentry.cache.evictions").tag("reason", "explicit").counter().count());
    }
}
