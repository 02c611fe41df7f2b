package com.scriptorium.dispatch.cli;

import com.scriptorium.core.health.HealthCheckService;
import com.scriptorium.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI command: scriptorium health
 * <p>
 * Prints git, index and storage checks. A degraded component (an in-memory
 * index) still counts as operational; the exit code is 1 only when something is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check git, index and storage health")
@Component
public class HealthCommand implements Callable<Integer> {

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

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warning(label);
                case DOWN -> ConsoleOutput.error(label);
            }
        }

        System.out.println("──────────────────────────────────");
        switch (HealthStatus.overall(checks)) {
            case UP -> {
                ConsoleOutput.success("Overall: UP");
                return 0;
            }
            case DEGRADED -> {
                ConsoleOutput.warning("Overall: DEGRADED (" + components(checks, HealthStatus.Status.DEGRADED) + ")");
                return 0;
            }
            default -> {
                ConsoleOutput.error("Overall: DOWN (" + components(checks, HealthStatus.Status.DOWN) + ")");
                return 1;
            }
        }
    }

    private static String components(List<HealthStatus> checks, HealthStatus.Status status) {
        return checks.stream()
                .filter(check -> check.status() == status)
                .map(HealthStatus::component)
                .collect(Collectors.joining(", "));
    }
}
