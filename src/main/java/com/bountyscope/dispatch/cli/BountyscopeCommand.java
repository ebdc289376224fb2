package com.bountyscope.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for bountyscope.
 * Routes to subcommands: scan, report, train, history, health.
 */
@Command(
        name = "bountyscope",
        mixinStandardHelpOptions = true,
        version = "bountyscope 0.1.0",
        description = "Policy-gated bug bounty scan pipeline",
        subcommands = {
                ScanCommand.class,
                ReportCommand.class,
                TrainCommand.class,
                HistoryCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class BountyscopeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
