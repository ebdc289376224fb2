package com.bountyscope.dispatch.cli;

import com.bountyscope.core.events.ScanEvent;
import com.bountyscope.core.model.RunResult;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the bountyscope CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) BOUNTYSCOPE v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [BOUNTYSCOPE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void event(ScanEvent event) {
        String prefix = switch (event.eventType()) {
            case "run.started" -> "@|fg(cyan) [RUN]|@";
            case "stage.entered" -> "@|fg(blue) [STAGE]|@";
            case "policy.decision" -> "@|fg(magenta) [POLICY]|@";
            case "scan.started" -> "@|fg(yellow) [SCAN]|@";
            case "run.finished" -> "@|bold [DONE]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + describe(event)));
    }

    static String describe(ScanEvent event) {
        var p = event.payload();
        return switch (event.eventType()) {
            case "run.started" -> event.target() + " (" + p.get("mode") + ") -> " + p.get("outputDir");
            case "stage.entered" -> String.valueOf(p.get("stage"));
            case "policy.decision" -> p.get("check") + ": " + p.get("decision") + " - " + p.get("reason");
            case "scan.started" -> p.get("scanner") + " on " + p.get("host");
            case "run.finished" -> event.target() + ": " + p.get("outcome") + " (" + p.get("reason") + ")";
            default -> String.valueOf(p);
        };
    }

    public static void result(RunResult result) {
        if (result.success()) {
            success(result.target() + " completed: " + result.findingsCount() + " finding(s)"
                    + (result.reportLocation() != null ? ", report at " + result.reportLocation() : ""));
        } else {
            error(result.target() + " " + result.outcome() + ": " + result.reason());
        }
    }

    public static void summary(List<RunResult> results) {
        long succeeded = results.stream().filter(RunResult::success).count();
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Summary|@: @|fg(green) " + succeeded + " completed|@"
                + (results.size() > succeeded ? ", @|fg(red) " + (results.size() - succeeded) + " not completed|@" : "")));
    }

    public static void overrideWarning(String target, String reason) {
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red),bold [MANUAL OVERRIDE]|@ scope for " + target + " is unresolved: " + reason));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) Testing targets outside an authorized program may be illegal.|@"));
    }
}
