package com.bountyscope.core.engine;

/**
 * Thrown at a stage boundary or limiter wait once the run has been cancelled
 * or its deadline has passed.
 */
public class RunCancelledException extends RuntimeException {

    private final String reason;

    public RunCancelledException(String reason) {
        super("Run aborted: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
