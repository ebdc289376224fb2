package com.bountyscope.dispatch.cli;

import com.bountyscope.core.engine.PipelineEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: bountyscope report --run-id &lt;id&gt;
 * <p>
 * Rebuilds a run's report from stored findings without scanning again.
 */
@Command(name = "report", mixinStandardHelpOptions = true, description = "Regenerate the report of a stored run")
@Component
public class ReportCommand implements Callable<Integer> {

    @Option(names = "--run-id", required = true, description = "Run to report on")
    private String runId;

    private final PipelineEngine engine;

    public ReportCommand(PipelineEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        return engine.regenerateReport(runId)
                .map(location -> {
                    ConsoleOutput.success("Report written to " + location);
                    return CommandLine.ExitCode.OK;
                })
                .orElseGet(() -> {
                    ConsoleOutput.error("Could not regenerate report for run " + runId);
                    return 1;
                });
    }
}
