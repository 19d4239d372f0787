package com.agentry.dispatch.cli;

import com.agentry.core.health.HealthCheckService;
import com.agentry.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: agentry health [--component name] [--verbose]
 * <p>
 * Exits 0 when every checked component is UP, 1 otherwise.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check runtime, history, cache and security health")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = {"--component"}, description = "Only show this component")
    private String component;

    @Option(names = {"--verbose", "-v"}, description = "Show the figures behind each verdict")
    private boolean verbose;

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        List<HealthStatus> checks = healthCheckService.checkAll().stream()
                .filter(c -> component == null || component.equalsIgnoreCase(c.component()))
                .toList();
        if (checks.isEmpty()) {
            ConsoleOutput.error("Unknown component: " + component);
            return 2;
        }

        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> ConsoleOutput.error(label);
                case DEGRADED -> ConsoleOutput.warn(label);
            }
            if (verbose) {
                for (Map.Entry<String, String> figure : check.metadata().entrySet()) {
                    System.out.println("    " + figure.getKey() + " = " + figure.getValue());
                }
            }
        }

        System.out.println(ConsoleOutput.RULE);
        HealthStatus.Status overall = HealthStatus.overall(checks);
        if (overall == HealthStatus.Status.UP) {
            ConsoleOutput.success("Overall: all systems operational");
            return 0;
        }
        ConsoleOutput.error("Overall: " + overall.name().toLowerCase(Locale.ROOT) + ", one or more components need attention");
        return 1;
    }
}
