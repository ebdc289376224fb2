package com.bountyscope.core.model;

import java.io.Serializable;

/**
 * Structured result produced for every run, wherever it stopped.
 *
 * @param runId          the run identifier
 * @param target         the target processed
 * @param success        true only for {@link RunOutcome#COMPLETED}
 * @param reason         terminal reason, e.g. "blocked_by_policy", "unknown_scope", or an error message
 * @param outcome        classification of the ending
 * @param findingsCount  number of triaged findings persisted
 * @param reportLocation report path, or null when no report was written
 */
public record RunResult(
    String runId,
    String target,
    boolean success,
    String reason,
    RunOutcome outcome,
    int findingsCount,
    String reportLocation
) implements Serializable {

    public static RunResult completed(String runId, String target, int findingsCount, String reportLocation) {
        return new RunResult(runId, target, true, "completed", RunOutcome.COMPLETED, findingsCount, reportLocation);
    }

    public static RunResult failed(String runId, String target, RunOutcome outcome, String reason) {
        return new RunResult(runId, target, false, reason, outcome, 0, null);
    }
}
