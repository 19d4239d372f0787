package com.agentry.dispatch.cli;

import com.agentry.core.cache.HistoryEntry;
import com.agentry.core.execution.TaskCoordinator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: agentry logs
 * <p>
 * Lists recent executions from the bounded history, newest first.
 */
@Command(name = "logs", mixinStandardHelpOptions = true, description = "List recent executions")
@Component
public class LogsCommand implements Runnable {

    @Option(names = {"--agent", "-a"}, description = "Only this agent")
    private String agent;

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "20")
    private int limit;

    private final TaskCoordinator coordinator;

    public LogsCommand(TaskCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<HistoryEntry> entries = coordinator.logs(agent, limit);
        if (entries.isEmpty()) {
            ConsoleOutput.info("No executions recorded.");
            return;
        }

        System.out.printf("  %-14s %-20s %-8s %8s  %s%n", "EXECUTION", "AGENT", "STATUS", "MS", "TASK");
        System.out.println("  " + "-".repeat(76));
        for (HistoryEntry entry : entries) {
            var result = entry.result();
            long ms = result.metrics() != null ? result.metrics().durationMs() : 0;
            System.out.printf("  %-14s %-20s %-8s %8d  %s%n",
                    entry.executionId(),
                    ConsoleOutput.truncate(entry.agentName(), 20),
                    result.success() ? "OK" : "FAILED",
                    ms,
                    ConsoleOutput.truncate(entry.taskSummary(), 30));
        }
    }
}
