package com.agentry.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Agentry.
 */
@Command(
        name = "agentry",
        mixinStandardHelpOptions = true,
        version = "Agentry 0.1.0",
        description = "Runs agent tasks, batches and dependency-ordered recipes",
        subcommands = {
                RunCommand.class,
                BatchCommand.class,
                RecipeCommand.class,
                ValidateCommand.class,
                MetricsCommand.class,
                LogsCommand.class,
                CacheCommand.class,
                AuditCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AgentryCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
