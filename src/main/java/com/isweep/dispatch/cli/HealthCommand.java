package com.isweep.dispatch.cli;

import com.isweep.core.health.HealthCheckService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: isweep health
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check rules and preferences store")
@Component
public class HealthCommand implements Runnable {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return;
        }

        var checks = healthCheckService.checkAll();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> ConsoleOutput.error(label);
                case DEGRADED -> ConsoleOutput.info(label);
            }
        }

        System.out.println("──────────────────────────────────");
        if (healthCheckService.isHealthy(checks)) {
            ConsoleOutput.success("Overall: healthy");
        } else {
            ConsoleOutput.error("Overall: degraded");
        }
    }
}
