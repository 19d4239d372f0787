package com.agentry.core.health;

import com.agentry.core.cache.ExecutionHistory;
import com.agentry.core.cache.TieredCache;
import com.agentry.core.execution.AgentRuntime;
import com.agentry.core.security.SecurityGate;
import com.agentry.core.security.SecurityReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final AgentRuntime runtime;
    private final ExecutionHistory history;
    private final TieredCache cache;
    private final SecurityGate gate;

    public HealthCheckService(
            @Autowired(required = false) AgentRuntime runtime,
            ExecutionHistory history,
            TieredCache cache,
            SecurityGate gate) {
        this.runtime = runtime;
        this.history = history;
        this.cache = cache;
        this.gate = gate;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkRuntime());
        results.add(checkHistory());
        results.add(checkCache());
        results.add(checkSecurity());
        return results;
    }

    private HealthStatus checkRuntime() {
        if (runtime == null) {
            return new HealthStatus("runtime", HealthStatus.Status.DOWN,
                    "No agent runtime configured", Map.of());
        }
        try {
            if (runtime.isAvailable()) {
                return new HealthStatus("runtime", HealthStatus.Status.UP,
                        "Agent runtime available (" + runtime.describe() + ")", Map.of());
            }
            return new HealthStatus("runtime", HealthStatus.Status.DOWN,
                    "Agent runtime unavailable (" + runtime.describe() + ")", Map.of());
        } catch (Exception e) {
            log.warn("Runtime health check failed: {}", e.getMessage());
            return new HealthStatus("runtime", HealthStatus.Status.DOWN,
                    "Runtime error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkHistory() {
        var metrics = history.metrics();
        var metadata = Map.of(
                "entries", String.valueOf(metrics.entries()),
                "pressure", String.format(Locale.ROOT, "%.2f", metrics.pressure()));
        if (history.isWithinLimits()) {
            return new HealthStatus("history", HealthStatus.Status.UP, history.summary(), metadata);
        }
        return new HealthStatus("history", HealthStatus.Status.DEGRADED,
                "Memory pressure high: " + history.summary(), metadata);
    }

    private HealthStatus checkCache() {
        if (!cache.isEnabled()) {
            return new HealthStatus("cache", HealthStatus.Status.DEGRADED, "Cache disabled", Map.of());
        }
        var metrics = cache.metrics();
        var metadata = Map.of(
                "hitRate", String.format(Locale.ROOT, "%.2f", metrics.hitRate()),
                "avgResponseMs", String.format(Locale.ROOT, "%.2f", metrics.averageResponseMs()));
        return new HealthStatus("cache",
                cache.isHealthy() ? HealthStatus.Status.UP : HealthStatus.Status.DEGRADED,
                cache.status(), metadata);
    }

    private HealthStatus checkSecurity() {
        SecurityReport report = gate.report();
        var metadata = Map.of(
                "events", String.valueOf(report.totalEvents()),
                "critical", String.valueOf(report.criticalEvents()));
        if (report.criticalEvents() > 0) {
            return new HealthStatus("security", HealthStatus.Status.DEGRADED,
                    report.criticalEvents() + " critical security event(s) recorded", metadata);
        }
        return new HealthStatus("security", HealthStatus.Status.UP,
                "Security gate active (" + gate.allowedBases().size() + " allowed base path(s))", metadata);
    }
}
