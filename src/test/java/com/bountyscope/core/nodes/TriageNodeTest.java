package com.bountyscope.core.nodes;

import com.bountyscope.core.engine.PipelineProperties;
import com.bountyscope.core.engine.RunControl;
import com.bountyscope.core.engine.RunRequest;
import com.bountyscope.core.events.EventBus;
import com.bountyscope.core.metrics.BountyscopeMetrics;
import com.bountyscope.core.model.FindingRecord;
import com.bountyscope.core.model.ScanMode;
import com.bountyscope.core.persistence.InMemoryScanStore;
import com.bountyscope.core.state.PipelineState;
import com.bountyscope.core.triage.FusionTriageScorer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TriageNodeTest {

    @TempDir
    Path runDir;

    private FusionTriageScorer scorer;
    private InMemoryScanStore store;
    private TriageNode node;

    @BeforeEach
    void setUp() {
        scorer = mock(FusionTriageScorer.class);
        store = new InMemoryScanStore();
        var runControl = new RunControl();
        runControl.register("r1", RunRequest.of("example.com", ScanMode.SAFE_SCAN, null), Duration.ofMinutes(1));
        node = new TriageNode(scorer, store, new ArtifactWriter(new PipelineProperties()), runControl,
                new EventBus(), new BountyscopeMetrics(new SimpleMeterRegistry()));
    }

    private static FindingRecord finding(String name) {
        return new FindingRecord("example.com", name, "medium", "desc", Map.of(), "nuclei",
                "https://example.com", "t-" + name);
    }

    @Test
    @DisplayName("scores, persists and writes every finding")
    void triagesAll() {
        var a = finding("a");
        var b = finding("b");
        var state = new PipelineState(Map.of("runId", "r1", "target", "example.com",
                "outputDir", runDir.toString(), "findings", List.of(a, b)));

        var updates = node.apply(state);

        assertEquals(2, updates.get("findingsCount"));
        assertEquals(2, store.listFindings("r1").size());
        verify(scorer, times(2)).scoreAndApply(any(), any());
        assertTrue(Files.exists(runDir.resolve(ArtifactWriter.FINDINGS_FILE)));
    }

    @Test
    @DisplayName("a finding that cannot be scored is dropped and reported")
    void unscorableFindingDropped() {
        var good = finding("good");
        var bad = finding("bad");
        when(scorer.scoreAndApply(argThat(f -> f != null && "bad".equals(f.getName())), any()))
                .thenThrow(new IllegalArgumentException("no text"));
        var state = new PipelineState(Map.of("runId", "r1", "target", "example.com",
                "outputDir", runDir.toString(), "findings", List.of(good, bad)));

        var updates = node.apply(state);

        assertEquals(1, updates.get("findingsCount"));
        assertEquals(1, store.listFindings("r1").size());
        assertEquals(List.of("triage bad: no text"), updates.get("errors"));
    }
}
