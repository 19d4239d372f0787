package com.agentry.dispatch.cli;

import com.agentry.core.events.EventBus;
import com.agentry.core.execution.BatchOptions;
import com.agentry.core.execution.TaskCoordinator;
import com.agentry.core.model.BatchResult;
import com.agentry.core.model.OutputFormat;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: agentry batch "&lt;task&gt;" --agents a,b,c
 * <p>
 * Runs the same task against several agents with bounded concurrency.
 */
@Command(name = "batch", mixinStandardHelpOptions = true, description = "Run one task against several agents")
@Component
public class BatchCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task description")
    private String task;

    @Option(names = {"--agents", "-a"}, split = ",", required = true, description = "Comma-separated agent names")
    private List<String> agents;

    @Option(names = {"--context", "-c"}, description = "Context file or directory")
    private String contextPath;

    @Option(names = {"--output", "-o"}, description = "Base output file; each agent writes <dir>/<agent>_<file>")
    private String outputPath;

    @Option(names = {"--format", "-f"}, description = "Output format: text, json, markdown", defaultValue = "text")
    private String format;

    @Option(names = {"--parallel", "-p"}, description = "Maximum concurrent agents", defaultValue = "0")
    private int maxConcurrency;

    @Option(names = {"--timeout", "-t"}, description = "Per-task timeout in seconds")
    private Long timeoutSeconds;

    @Option(names = "--summary", description = "Print the markdown batch summary")
    private boolean printSummary;

    private final TaskCoordinator coordinator;
    private final EventBus eventBus;

    public BatchCommand(TaskCoordinator coordinator, EventBus eventBus) {
        this.coordinator = coordinator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        OutputFormat outputFormat;
        try {
            outputFormat = OutputFormat.parse(format);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        ConsoleOutput.info("Dispatching to " + agents.size() + " agent(s): " + String.join(", ", agents));
        var options = new BatchOptions(contextPath, outputPath, outputFormat, maxConcurrency,
                timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : null, Map.of());
        BatchResult result;
        try (var progress = ProgressPrinter.attach(eventBus)) {
            result = coordinator.executeBatch(agents, task, options);
        }

        ConsoleOutput.batch(result);
        if (printSummary) {
            System.out.println();
            System.out.println(result.summary());
        }
        return result.failed() == 0 ? 0 : 1;
    }
}
