package com.agentry.dispatch.cli;

import com.agentry.core.execution.AgentStats;
import com.agentry.core.execution.TaskCoordinator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Locale;

/**
 * CLI command: agentry metrics
 */
@Command(name = "metrics", mixinStandardHelpOptions = true, description = "Show execution metrics and performance status")
@Component
public class MetricsCommand implements Runnable {

    private final TaskCoordinator coordinator;

    public MetricsCommand(TaskCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var status = coordinator.status();
        var summary = coordinator.summary();
        var performance = coordinator.performanceStatus();

        ConsoleOutput.info("Active: " + status.activeExecutions()
                + " | Completed today: " + status.completedToday()
                + " | Failed today: " + status.failedToday());
        System.out.printf(Locale.ROOT, "  Executions: %d (%.1f%% success), avg %.0fms, tokens %d%n",
                summary.totalExecutions(), summary.successRate() * 100, summary.averageDurationMs(),
                summary.totalTokens());
        if (summary.mostUsedAgent() != null) {
            System.out.println("  Most used agent: " + summary.mostUsedAgent());
        }
        if (!summary.agents().isEmpty()) {
            System.out.printf("  %-24s %10s %10s %12s%n", "AGENT", "RUNS", "SUCCESS", "AVG MS");
            System.out.println("  " + "-".repeat(60));
            for (AgentStats agent : summary.agents()) {
                System.out.printf(Locale.ROOT, "  %-24s %10d %9.1f%% %12.0f%n", agent.agentName(),
                        agent.executions(), agent.successRate() * 100, agent.averageDurationMs());
            }
        }

        System.out.println(ConsoleOutput.RULE);
        var history = performance.history();
        System.out.printf(Locale.ROOT, "  History: %d/%d entries, pressure %.1f%%%n",
                history.entries(), history.maxEntries(), history.pressure() * 100);
        var cache = performance.cache();
        System.out.printf(Locale.ROOT, "  Cache: hit rate %.1f%%, avg %.2fms, %d memory / %d disk entries%n",
                cache.hitRate() * 100, cache.averageResponseMs(), cache.memoryEntries(), cache.diskEntries());
        if (performance.healthy()) {
            ConsoleOutput.success("Performance: healthy");
        } else {
            ConsoleOutput.warn("Performance: degraded (history within limits: " + performance.historyWithinLimits()
                    + ", cache healthy: " + performance.cacheHealthy() + ")");
        }
    }
}
