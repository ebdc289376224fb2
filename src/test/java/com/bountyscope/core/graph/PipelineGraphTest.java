package com.bountyscope.core.graph;

import com.bountyscope.core.model.RunStatus;
import com.bountyscope.core.model.ScanMode;
import com.bountyscope.core.nodes.CrawlNode;
import com.bountyscope.core.nodes.FinishNode;
import com.bountyscope.core.nodes.ProbeNode;
import com.bountyscope.core.nodes.ReconNode;
import com.bountyscope.core.nodes.ReportNode;
import com.bountyscope.core.nodes.ScanNode;
import com.bountyscope.core.nodes.ScopeCheckNode;
import com.bountyscope.core.nodes.TriageNode;
import com.bountyscope.core.state.PipelineState;
import org.bsc.langgraph4j.RunnableConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the LangGraph4j pipeline wiring with stubbed stage nodes.
 */
class PipelineGraphTest {

    private ScopeCheckNode scopeCheck;
    private ReconNode recon;
    private ProbeNode probe;
    private CrawlNode crawl;
    private ScanNode scan;
    private TriageNode triage;
    private ReportNode report;
    private PipelineGraph graph;

    private static final Map<String, Object> FAILED = Map.of(
            "status", RunStatus.FAILED.name(),
            "stage", "FAILED",
            "outcome", "POLICY_BLOCKED",
            "reason", "blocked_by_policy");

    @BeforeEach
    void setUp() throws Exception {
        scopeCheck = mock(ScopeCheckNode.class);
        recon = mock(ReconNode.class);
        probe = mock(ProbeNode.class);
        crawl = mock(CrawlNode.class);
        scan = mock(ScanNode.class);
        triage = mock(TriageNode.class);
        report = mock(ReportNode.class);

        when(scopeCheck.apply(any(PipelineState.class))).thenReturn(Map.of("stage", "SCOPE_CHECK"));
        when(recon.apply(any(PipelineState.class))).thenReturn(Map.of("stage", "RECON"));
        when(probe.apply(any(PipelineState.class))).thenReturn(Map.of("stage", "PROBE"));
        when(crawl.apply(any(PipelineState.class))).thenReturn(Map.of("stage", "CRAWL"));
        when(scan.apply(any(PipelineState.class))).thenReturn(Map.of("stage", "SCAN"));
        when(triage.apply(any(PipelineState.class))).thenReturn(Map.of("stage", "TRIAGE", "findingsCount", 2));
        when(report.apply(any(PipelineState.class))).thenReturn(Map.of("stage", "REPORT", "reportLocation", "/tmp/report.md"));

        graph = new PipelineGraph(scopeCheck, recon, probe, crawl, scan, triage, report, new FinishNode());
    }

    private PipelineState run(ScanMode mode) throws Exception {
        return graph.getCompiledGraph()
                .invoke(Map.of("runId", "r1", "target", "example.com", "mode", mode.name()),
                        RunnableConfig.builder().threadId("r1").build())
                .orElseThrow();
    }

    @Nested
    @DisplayName("execution")
    class Execution {

        @Test
        @DisplayName("an active run visits every stage and completes")
        void activeRun() throws Exception {
            PipelineState state = run(ScanMode.SAFE_SCAN);

            assertEquals(RunStatus.COMPLETED, state.status());
            assertEquals(2, state.findingsCount());
            assertEquals("/tmp/report.md", state.reportLocation().orElseThrow());
            var order = inOrder(scopeCheck, recon, probe, crawl, scan, triage, report);
            order.verify(scopeCheck).apply(any());
            order.verify(recon).apply(any());
            order.verify(probe).apply(any());
            order.verify(crawl).apply(any());
            order.verify(scan).apply(any());
            order.verify(triage).apply(any());
            order.verify(report).apply(any());
        }

        @Test
        @DisplayName("a passive run finishes after probing")
        void passiveRun() throws Exception {
            PipelineState state = run(ScanMode.PASSIVE_ONLY);

            assertEquals(RunStatus.COMPLETED, state.status());
            verify(probe).apply(any());
            verifyNoInteractions(crawl, scan, triage, report);
        }

        @Test
        @DisplayName("a failed scope check routes straight to finish and keeps the failure")
        void failedScopeCheck() throws Exception {
            when(scopeCheck.apply(any(PipelineState.class))).thenReturn(FAILED);

            PipelineState state = run(ScanMode.SAFE_SCAN);

            assertEquals(RunStatus.FAILED, state.status());
            assertEquals("blocked_by_policy", state.reason());
            verifyNoInteractions(recon, probe, crawl, scan, triage, report);
        }

        @Test
        @DisplayName("a failure in a middle stage skips the remaining stages")
        void failedScan() throws Exception {
            when(scan.apply(any(PipelineState.class))).thenReturn(FAILED);

            PipelineState state = run(ScanMode.FULL_SCAN_WITH_VALIDATION);

            assertTrue(state.isFailed());
            verifyNoInteractions(triage, report);
        }
    }

    @Nested
    @DisplayName("routing")
    class Routing {

        @Test
        @DisplayName("next returns finish once the state has failed")
        void nextOnFailure() {
            var failed = new PipelineState(Map.of("status", "FAILED"));
            var running = new PipelineState(Map.of("status", "RUNNING"));

            assertEquals(PipelineGraph.FINISH, PipelineGraph.next(failed, PipelineGraph.RECON));
            assertEquals(PipelineGraph.RECON, PipelineGraph.next(running, PipelineGraph.RECON));
        }

        @Test
        @DisplayName("routeAfterProbe sends active modes to crawl")
        void routeAfterProbe() {
            assertEquals(PipelineGraph.CRAWL,
                    graph.routeAfterProbe(new PipelineState(Map.of("mode", "SAFE_SCAN"))));
            assertEquals(PipelineGraph.FINISH,
                    graph.routeAfterProbe(new PipelineState(Map.of("mode", "PASSIVE_ONLY"))));
            assertEquals(PipelineGraph.FINISH,
                    graph.routeAfterProbe(new PipelineState(Map.of("mode", "SAFE_SCAN", "status", "FAILED"))));
        }
    }
}
