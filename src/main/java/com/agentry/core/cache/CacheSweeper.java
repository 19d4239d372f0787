package com.agentry.core.cache;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically purges expired cache entries and relieves history memory pressure,
 * so stale entries go away even when nothing reads them.
 */
@Component
public class CacheSweeper {

    private static final Logger log = LoggerFactory.getLogger(CacheSweeper.class);

    private final TieredCache cache;
    private final ExecutionHistory history;
    private final CacheProperties properties;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "cache-sweeper");
        t.setDaemon(true);
        return t;
    });

    public CacheSweeper(TieredCache cache, ExecutionHistory history, CacheProperties properties) {
        this.cache = cache;
        this.history = history;
        this.properties = properties;
    }

    @PostConstruct
    void start() {
        long interval = Math.max(1, properties.getSweepIntervalMinutes());
        scheduler.scheduleAtFixedRate(this::sweep, interval, interval, TimeUnit.MINUTES);
        log.info("Cache sweeper started (interval={}m)", interval);
    }

    @PreDestroy
    void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Cache sweeper stopped");
    }

    /**
     * One sweep pass. Exceptions are logged so the schedule keeps running.
     */
    void sweep() {
        try {
            int cacheRemoved = cache.sweep();
            int historyRemoved = history.sweep();
            log.debug("Sweep removed {} cache entries and {} history entries", cacheRemoved, historyRemoved);
        } catch (Exception e) {
            log.warn("Cache sweep failed: {}", e.getMessage(), e);
        }
    }
}
