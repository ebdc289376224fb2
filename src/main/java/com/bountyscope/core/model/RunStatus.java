package com.bountyscope.core.model;

/**
 * Persisted lifecycle status of a pipeline run.
 */
public enum RunStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
