package com.bountyscope.core.nodes;

import com.bountyscope.core.engine.RunCancelledException;
import com.bountyscope.core.engine.RunContext;
import com.bountyscope.core.engine.RunControl;
import com.bountyscope.core.events.EventBus;
import com.bountyscope.core.events.ScanEvent;
import com.bountyscope.core.logging.MdcContext;
import com.bountyscope.core.metrics.BountyscopeMetrics;
import com.bountyscope.core.model.PipelineStage;
import com.bountyscope.core.model.RunOutcome;
import com.bountyscope.core.model.RunStatus;
import com.bountyscope.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Common frame of a pipeline stage.
 * <p>
 * Checks for cancellation on entry, announces the stage, and converts exceptions into a
 * {@code FAILED} state update so the graph can route straight to the finish node.
 * Subclasses only produce the stage's own state updates.
 */
public abstract class StageNode {

    private static final Logger log = LoggerFactory.getLogger(StageNode.class);

    private final PipelineStage stage;
    protected final RunControl runControl;
    protected final EventBus eventBus;
    protected final BountyscopeMetrics metrics;

    protected StageNode(PipelineStage stage, RunControl runControl, EventBus eventBus, BountyscopeMetrics metrics) {
        this.stage = stage;
        this.runControl = runControl;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public PipelineStage stage() {
        return stage;
    }

    public final Map<String, Object> apply(PipelineState state) {
        MdcContext.setStage(stage.name());
        long started = System.currentTimeMillis();
        try {
            RunContext context = runControl.require(state.runId());
            context.throwIfCancelled();
            eventBus.publish(ScanEvent.of("stage.entered", state.runId(), state.target(),
                    Map.of("stage", stage.name())));
            var updates = new HashMap<String, Object>(execute(state, context));
            updates.putIfAbsent("stage", stage.name());
            return updates;
        } catch (RunCancelledException e) {
            log.warn("Run {} aborted during {}: {}", state.runId(), stage, e.getReason());
            return failed(RunOutcome.CANCELLED, e.getReason());
        } catch (RuntimeException e) {
            log.error("Stage {} failed for {}: {}", stage, state.target(), e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return failed(RunOutcome.ERROR, stage.name().toLowerCase(Locale.ROOT) + " failed: " + message);
        } finally {
            metrics.recordStageDuration(stage.name(), System.currentTimeMillis() - started);
        }
    }

    protected abstract Map<String, Object> execute(PipelineState state, RunContext context);

    static Map<String, Object> failed(RunOutcome outcome, String reason) {
        var updates = new HashMap<String, Object>();
        updates.put("status", RunStatus.FAILED.name());
        updates.put("stage", PipelineStage.FAILED.name());
        updates.put("outcome", outcome.name());
        updates.put("reason", reason);
        return updates;
    }
}
