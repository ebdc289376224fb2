package com.bountyscope.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Persisted metadata for one pipeline run against one target.
 */
public record RunRecord(
    String runId,
    String target,
    ScanMode mode,
    String outputLocation,
    RunStatus status,
    Instant startTime,
    Instant endTime,
    int findingsCount
) implements Serializable {

    public static RunRecord started(String runId, String target, ScanMode mode, String outputLocation) {
        return new RunRecord(runId, target, mode, outputLocation, RunStatus.RUNNING, Instant.now(), null, 0);
    }

    public RunRecord finish(RunStatus terminal, Integer count) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Run " + runId + " already finished as " + status);
        }
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        return new RunRecord(runId, target, mode, outputLocation, terminal, startTime, Instant.now(),
                count != null ? count : findingsCount);
    }
}
