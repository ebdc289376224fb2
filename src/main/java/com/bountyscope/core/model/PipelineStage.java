package com.bountyscope.core.model;

/**
 * Stages of the per-target pipeline state machine.
 */
public enum PipelineStage {
    SCOPE_CHECK,
    RECON,
    PROBE,
    CRAWL,      // active modes only
    SCAN,
    TRIAGE,
    REPORT,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
