package com.bountyscope.core.engine;

import com.bountyscope.core.model.ScopeDefinition;
import com.bountyscope.core.policy.OverrideChannel;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Live handles of a running pipeline that cannot travel in graph state: the operator's
 * override channel, the scope definition and the cancellation signal.
 * <p>
 * A run counts as cancelled once {@link #cancel()} was called or its deadline passed.
 */
public class RunContext implements CancellationSignal {

    public static final String CANCELLED = "cancelled";
    public static final String TIMEOUT = "timeout";

    private final String runId;
    private final RunRequest request;
    private final long deadlineNanos;
    private final LongSupplier nanoClock;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    RunContext(String runId, RunRequest request, long deadlineNanos, LongSupplier nanoClock) {
        this.runId = runId;
        this.request = request;
        this.deadlineNanos = deadlineNanos;
        this.nanoClock = nanoClock;
    }

    public String runId() {
        return runId;
    }

    public Optional<ScopeDefinition> scope() {
        return request.scopeDefinition();
    }

    public OverrideChannel overrideChannel() {
        return request.overrideChannel();
    }

    public boolean allowUnblock() {
        return request.allowUnblock();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isTimedOut() {
        return nanoClock.getAsLong() - deadlineNanos >= 0;
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get() || isTimedOut();
    }

    @Override
    public String reason() {
        if (cancelled.get()) {
            return CANCELLED;
        }
        return isTimedOut() ? TIMEOUT : "";
    }
}
