package com.agentry.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree inside the Spring context and hands its exit
 * code back to Spring Boot. A command that throws is logged and exits 1.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_FAILURE = 1;

    private final AgentryCommand agentryCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(AgentryCommand agentryCommand, IFactory factory) {
        this.agentryCommand = agentryCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine().execute(args);
        log.debug("Command finished with exit code {}", exitCode);
    }

    CommandLine commandLine() {
        return new CommandLine(agentryCommand, factory)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    log.error("Command '{}' failed: {}", cmd.getCommandName(), ex.getMessage(), ex);
                    ConsoleOutput.error(cmd.getCommandName() + " failed: " + ex.getMessage());
                    return EXIT_FAILURE;
                });
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
