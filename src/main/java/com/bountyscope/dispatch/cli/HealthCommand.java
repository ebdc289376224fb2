package com.bountyscope.dispatch.cli;

import com.bountyscope.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: bountyscope health
 * <p>
 * Runs all health checks and exits non-zero if any component is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check tools, storage and services")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        boolean anyDown = false;
        boolean anyDegraded = false;
        for (var check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    anyDown = true;
                }
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    anyDegraded = true;
                }
            }
        }

        System.out.println(ConsoleOutput.RULE);
        if (anyDown) {
            ConsoleOutput.error("Overall: one or more components down");
            return 1;
        }
        if (anyDegraded) {
            ConsoleOutput.info("Overall: operational with reduced capability");
        } else {
            ConsoleOutput.success("Overall: all systems operational");
        }
        return 0;
    }
}
