package com.bountyscope.dispatch.cli;

import com.bountyscope.core.model.RunRecord;
import com.bountyscope.core.persistence.ScanStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: bountyscope history
 * <p>
 * Lists stored runs, newest first: Run ID | Status | Mode | Findings | Target.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List stored runs")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final ScanStore store;

    public HistoryCommand(ScanStore store) {
        this.store = store;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<RunRecord> runs = store.listRuns(limit);
        if (runs.isEmpty()) {
            ConsoleOutput.info("No runs found.");
            return;
        }

        ConsoleOutput.info("Runs (" + runs.size() + "):");
        System.out.println();
        System.out.printf("  %-36s %-10s %-26s %-9s %s%n", "RUN ID", "STATUS", "MODE", "FINDINGS", "TARGET");
        System.out.println("  " + "-".repeat(96));
        for (RunRecord run : runs) {
            System.out.printf("  %-36s %-10s %-26s %-9d %s%n", truncate(run.runId(), 36), run.status(),
                    run.mode() != null ? run.mode().cliName() : "-", run.findingsCount(), run.target());
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
