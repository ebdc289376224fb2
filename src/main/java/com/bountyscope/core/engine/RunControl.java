package com.bountyscope.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Registry of active runs, keyed by run id. Graph nodes look up their
 * {@link RunContext} here; the CLI uses it to cancel runs.
 */
@Component
public class RunControl {

    private static final Logger log = LoggerFactory.getLogger(RunControl.class);

    private final ConcurrentHashMap<String, RunContext> runs = new ConcurrentHashMap<>();
    private final LongSupplier nanoClock;

    public RunControl() {
        this(System::nanoTime);
    }

    RunControl(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    public RunContext register(String runId, RunRequest request, Duration timeout) {
        long deadline = nanoClock.getAsLong() + timeout.toNanos();
        var context = new RunContext(runId, request, deadline, nanoClock);
        if (runs.putIfAbsent(runId, context) != null) {
            throw new IllegalStateException("Run already registered: " + runId);
        }
        return context;
    }

    /**
     * Returns the context of an active run. Nodes call this for every stage, so an
     * unknown id means the graph was invoked outside the engine.
     */
    public RunContext require(String runId) {
        RunContext context = runs.get(runId);
        if (context == null) {
            throw new IllegalStateException("No active run: " + runId);
        }
        return context;
    }

    public Optional<RunContext> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    public boolean cancel(String runId) {
        RunContext context = runs.get(runId);
        if (context == null) {
            return false;
        }
        log.warn("Cancellation requested for run {}", runId);
        context.cancel();
        return true;
    }

    public void cancelAll() {
        runs.keySet().forEach(this::cancel);
    }

    public void release(String runId) {
        runs.remove(runId);
    }

    public int activeRuns() {
        return runs.size();
    }
}
