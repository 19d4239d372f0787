package com.agentry.dispatch.cli;

import com.agentry.core.security.FileOperation;
import com.agentry.core.security.SecurityEvent;
import com.agentry.core.security.SecurityGate;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Locale;

/**
 * CLI command: agentry audit
 * <p>
 * Shows the security report and recent audit events of this process.
 */
@Command(name = "audit", mixinStandardHelpOptions = true, description = "Show the security audit trail")
@Component
public class AuditCommand implements Runnable {

    @Option(names = {"--severity", "-s"}, description = "Only events of this severity: LOW, MEDIUM, HIGH, CRITICAL")
    private String severity;

    @Option(names = {"--limit", "-n"}, description = "Number of events", defaultValue = "20")
    private int limit;

    @Option(names = "--check", description = "Validate this path for reading before reporting")
    private String checkPath;

    private final SecurityGate gate;

    public AuditCommand(SecurityGate gate) {
        this.gate = gate;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (checkPath != null) {
            var validation = gate.validatePath(checkPath, FileOperation.READ);
            if (validation.valid()) {
                ConsoleOutput.success(checkPath + " -> " + validation.resolvedPath());
            } else {
                ConsoleOutput.error(checkPath + " rejected: " + validation.describeViolations());
            }
        }

        SecurityEvent.Severity filter;
        try {
            filter = severity != null ? SecurityEvent.Severity.valueOf(severity.toUpperCase(Locale.ROOT)) : null;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid severity: " + severity);
            return;
        }

        var report = gate.report();
        ConsoleOutput.info("Events: " + report.totalEvents()
                + " | critical: " + report.criticalEvents()
                + " | high: " + report.highSeverityEvents()
                + " | traversal attempts: " + report.pathTraversalAttempts()
                + " | injection attempts: " + report.injectionAttempts());

        var events = gate.auditEvents(filter, limit);
        for (SecurityEvent event : events) {
            String line = event.timestamp() + " " + event.kind() + " [" + event.severity() + "] "
                    + event.operation() + " " + ConsoleOutput.truncate(event.originalPath(), 40)
                    + ": " + event.detail();
            switch (event.severity()) {
                case CRITICAL, HIGH -> ConsoleOutput.error(line);
                case MEDIUM -> ConsoleOutput.warn(line);
                case LOW -> System.out.println("  " + line);
            }
        }
    }
}
