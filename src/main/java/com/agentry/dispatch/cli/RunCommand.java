package com.agentry.dispatch.cli;

import com.agentry.core.execution.TaskCoordinator;
import com.agentry.core.model.ExecutionResult;
import com.agentry.core.model.OutputFormat;
import com.agentry.core.model.Task;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: agentry run &lt;agent&gt; "&lt;task&gt;"
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run one task against an agent")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Agent name")
    private String agent;

    @Parameters(index = "1", description = "Task description")
    private String task;

    @Option(names = {"--context", "-c"}, description = "Context file or directory")
    private String contextPath;

    @Option(names = {"--output", "-o"}, description = "Write the agent output to this file")
    private String outputPath;

    @Option(names = {"--format", "-f"}, description = "Output format: text, json, markdown", defaultValue = "text")
    private String format;

    @Option(names = {"--timeout", "-t"}, description = "Timeout in seconds")
    private Long timeoutSeconds;

    @Option(names = "--var", description = "Variable as name=value (repeatable)")
    private List<String> variables;

    private final TaskCoordinator coordinator;

    public RunCommand(TaskCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        OutputFormat outputFormat;
        Map<String, Object> vars;
        try {
            outputFormat = OutputFormat.parse(format);
            vars = VariableArguments.parse(variables, Map.of());
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        ConsoleOutput.agent(agent, "running: " + ConsoleOutput.truncate(task, 60));
        Task request = new Task(agent, task, contextPath, List.of(), outputPath, outputFormat,
                timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : null, vars);
        ExecutionResult result = coordinator.executeSingle(request);

        ConsoleOutput.result(result);
        if (result.output() != null && !result.output().isBlank() && outputPath == null) {
            System.out.println(ConsoleOutput.RULE);
            System.out.println(result.output());
        }
        return result.success() ? 0 : 1;
    }
}
