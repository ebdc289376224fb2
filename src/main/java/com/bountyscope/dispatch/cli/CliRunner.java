package com.bountyscope.dispatch.cli;

import com.bountyscope.core.config.ConfigurationException;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_CONFIGURATION_ERROR = 2;

    private final BountyscopeCommand bountyscopeCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(BountyscopeCommand bountyscopeCommand, IFactory factory) {
        this.bountyscopeCommand = bountyscopeCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(bountyscopeCommand, factory)
                .setExecutionExceptionHandler(CliRunner::handleExecutionException)
                .execute(args);
    }

    static int handleExecutionException(Exception e, CommandLine commandLine, CommandLine.ParseResult parseResult)
            throws Exception {
        if (e instanceof ConfigurationException) {
            ConsoleOutput.error("Configuration error: " + e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }
        throw e;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
