package com.bountyscope.core.nodes;

import com.bountyscope.core.engine.RunContext;
import com.bountyscope.core.engine.RunControl;
import com.bountyscope.core.engine.RunRequest;
import com.bountyscope.core.events.EventBus;
import com.bountyscope.core.events.ScanEvent;
import com.bountyscope.core.metrics.BountyscopeMetrics;
import com.bountyscope.core.model.PipelineStage;
import com.bountyscope.core.model.ScanMode;
import com.bountyscope.core.state.PipelineState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class StageNodeTest {

    private RunControl runControl;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private final List<ScanEvent> events = new ArrayList<>();
    private final PipelineState state = new PipelineState(Map.of("runId", "r1", "target", "example.com"));

    @BeforeEach
    void setUp() {
        runControl = new RunControl();
        eventBus = new EventBus();
        eventBus.subscribeAll(events::add);
        registry = new SimpleMeterRegistry();
        runControl.register("r1", RunRequest.of("example.com", ScanMode.SAFE_SCAN, null), Duration.ofMinutes(1));
    }

    private StageNode node(Function<RunContext, Map<String, Object>> body) {
        return new StageNode(PipelineStage.RECON, runControl, eventBus, new BountyscopeMetrics(registry)) {
            @Override
            protected Map<String, Object> execute(PipelineState s, RunContext context) {
                return body.apply(context);
            }
        };
    }

    @Test
    @DisplayName("a successful stage gets its stage name stamped and announced")
    void success() {
        var updates = node(ctx -> Map.of("subdomains", List.of("a.example.com"))).apply(state);

        assertEquals("RECON", updates.get("stage"));
        assertEquals(List.of("a.example.com"), updates.get("subdomains"));
        assertEquals("stage.entered", events.get(0).eventType());
        assertEquals(1, registry.find("bountyscope.stage.duration").tag("stage", "RECON").timer().count());
    }

    @Test
    @DisplayName("a runtime exception becomes a FAILED update with an error reason")
    void exceptionBecomesFailure() {
        var updates = node(ctx -> { throw new IllegalStateException("disk full"); }).apply(state);

        assertEquals("FAILED", updates.get("status"));
        assertEquals("FAILED", updates.get("stage"));
        assertEquals("ERROR", updates.get("outcome"));
        assertEquals("recon failed: disk full", updates.get("reason"));
    }

    @Test
    @DisplayName("a cancelled run fails before the stage body runs")
    void cancelledBeforeEntry() {
        runControl.cancel("r1");
        var ran = new boolean[1];

        var updates = node(ctx -> { ran[0] = true; return Map.of(); }).apply(state);

        assertFalse(ran[0]);
        assertEquals("CANCELLED", updates.get("outcome"));
        assertEquals("cancelled", updates.get("reason"));
        assertTrue(events.isEmpty());
    }

    @Test
    @DisplayName("an unregistered run is reported as a stage error")
    void unknownRun() {
        var updates = node(ctx -> Map.of()).apply(new PipelineState(Map.of("runId", "ghost", "target", "x.com")));

        assertEquals("FAILED", updates.get("status"));
        assertEquals("ERROR", updates.get("outcome"));
    }
}
