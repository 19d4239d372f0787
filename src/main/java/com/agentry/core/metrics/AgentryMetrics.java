package com.agentry.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task, recipe, cache and security activity.
 */
@Service
public class AgentryMetrics {

    private final MeterRegistry registry;

    public AgentryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(String agentName, long ms, boolean success) {
        Timer.builder("agentry.task.duration")
                .tag("agent", agentName == null ? "unknown" : agentName)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskError(String errorKind) {
        Counter.builder("agentry.task.errors")
                .tag("kind", errorKind)
                .register(registry)
                .increment();
    }

    /**
     * Records the size of a submitted batch and the admission slot count it ran with.
     */
    public void recordBatch(int taskCount, int concurrencyLimit) {
        DistributionSummary.builder("agentry.batch.size")
                .description("Tasks per submitted batch")
                .register(registry)
                .record(taskCount);
        DistributionSummary.builder("agentry.batch.concurrency")
                .description("Admission slots per batch")
                .register(registry)
                .record(concurrencyLimit);
    }

    public void recordRecipeResult(String status) {
        Counter.builder("agentry.recipe.executions")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordCacheRequest(String tier, boolean hit) {
        Counter.builder("agentry.cache.requests")
                .tag("tier", tier)
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void recordCacheEviction(String cache, String reason) {
        Counter.builder("agentry.cache.evictions")
                .tag("cache", cache)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordSecurityEvent(String kind, String severity) {
        Counter.builder("agentry.security.events")
                .tag("kind", kind)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }
}
