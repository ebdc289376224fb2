package com.bountyscope.core.nodes;

import com.bountyscope.core.engine.RunControl;
import com.bountyscope.core.engine.RunRequest;
import com.bountyscope.core.events.EventBus;
import com.bountyscope.core.metrics.BountyscopeMetrics;
import com.bountyscope.core.model.ActionDescriptor;
import com.bountyscope.core.model.Decision;
import com.bountyscope.core.model.FindingRecord;
import com.bountyscope.core.model.PolicyDecision;
import com.bountyscope.core.model.RateBudget;
import com.bountyscope.core.model.ScanMode;
import com.bountyscope.core.policy.PolicyDecisionGate;
import com.bountyscope.core.ratelimit.RateLimiter;
import com.bountyscope.core.state.PipelineState;
import com.bountyscope.tools.ScanAdapter;
import com.bountyscope.tools.ScanConstraints;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link ScanNode} with a mocked policy gate and scanner.
 */
class ScanNodeTest {

    private PolicyDecisionGate gate;
    private ScanAdapter scanner;
    private RunControl runControl;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        gate = mock(PolicyDecisionGate.class);
        scanner = mock(ScanAdapter.class);
        when(scanner.kind()).thenReturn("nuclei");
        runControl = new RunControl();
        registry = new SimpleMeterRegistry();
    }

    private ScanNode node() {
        return new ScanNode(List.of(scanner), gate, new RateLimiter("scan", new RateBudget(100, 4)),
                runControl, new EventBus(), new BountyscopeMetrics(registry));
    }

    private PipelineState state(ScanMode mode, List<String> liveHosts) {
        runControl.register("r1", RunRequest.of("example.com", mode, null), Duration.ofMinutes(1));
        return new PipelineState(Map.of("runId", "r1", "target", "example.com", "mode", mode.name(),
                "liveHosts", liveHosts));
    }

    private static FindingRecord finding(String url) {
        return new FindingRecord("example.com", "Exposed panel", "medium", "admin panel reachable",
                Map.of(), "nuclei", url, "exposed-panels");
    }

    @ParameterizedTest(name = "{0} in {1} approved={2}")
    @CsvSource({
            "ALLOWED, PASSIVE_ONLY, true",
            "ALLOWED, SAFE_SCAN, true",
            "REQUIRES_VALIDATION, SAFE_SCAN, false",
            "REQUIRES_VALIDATION, FULL_SCAN_WITH_VALIDATION, true",
            "BLOCKED, FULL_SCAN_WITH_VALIDATION, false",
            "UNKNOWN, FULL_SCAN_WITH_VALIDATION, false"
    })
    @DisplayName("isApproved honours the decision and the mode")
    void isApproved(Decision decision, ScanMode mode, boolean expected) {
        assertEquals(expected, ScanNode.isApproved(new PolicyDecision(decision, 1.0, "r", ""), mode));
    }

    @Test
    @DisplayName("constraintsFor splits the severity hint")
    void constraintsFor() {
        ScanConstraints constraints = ScanNode.constraintsFor(
                new ActionDescriptor("nuclei", "https://a.example.com", "cves", "low, medium,"));

        assertEquals("cves", constraints.templateOrRuleId());
        assertEquals(List.of("low", "medium"), constraints.severities());
    }

    @Nested
    @DisplayName("execution")
    class Execution {

        @Test
        @DisplayName("runs approved actions and counts skipped ones")
        void runsApprovedSkipsBlocked() {
            when(scanner.plan(anyString(), any())).thenAnswer(inv -> List.of(
                    new ActionDescriptor("nuclei", inv.getArgument(0), "exposures", "low,medium"),
                    new ActionDescriptor("nuclei", inv.getArgument(0), "rce", "critical")));
            when(gate.validateAction(any(), any())).thenAnswer(inv -> {
                ActionDescriptor a = inv.getArgument(0);
                return a.templateOrRuleId().equals("rce")
                        ? PolicyDecision.blocked("rce-templates", "")
                        : PolicyDecision.allowed("no_rule_matched", "");
            });
            when(scanner.run(anyString(), any())).thenAnswer(inv -> List.of(finding(inv.getArgument(0))));

            var updates = node().apply(state(ScanMode.SAFE_SCAN, List.of("https://example.com")));

            assertEquals(1, ((List<?>) updates.get("findings")).size());
            assertEquals(1, updates.get("skippedActions"));
            assertEquals(0, updates.get("failedScans"));
            verify(scanner, times(1)).run(eq("https://example.com"), any());
            assertEquals(1.0, registry.find("bountyscope.scan.skipped").tag("reason", "blocked").counter().count());
        }

        @Test
        @DisplayName("a failing action is recorded without failing the stage")
        void failureIsolated() {
            when(scanner.plan(anyString(), any())).thenAnswer(inv -> List.of(
                    new ActionDescriptor("nuclei", inv.getArgument(0), "", "low,medium")));
            when(gate.validateAction(any(), any())).thenReturn(PolicyDecision.allowed("no_rule_matched", ""));
            when(scanner.run(eq("https://a.example.com"), any())).thenThrow(new IllegalStateException("exit 2"));
            when(scanner.run(eq("https://b.example.com"), any()))
                    .thenReturn(List.of(finding("https://b.example.com")));

            var updates = node().apply(state(ScanMode.SAFE_SCAN,
                    List.of("https://a.example.com", "https://b.example.com")));

            assertNull(updates.get("status"));
            assertEquals(1, ((List<?>) updates.get("findings")).size());
            assertEquals(1, updates.get("failedScans"));
            assertTrue(((List<?>) updates.get("errors")).get(0).toString().contains("exit 2"));
        }

        @Test
        @DisplayName("nothing runs when every action needs validation in safe-scan")
        void nothingApproved() {
            when(scanner.plan(anyString(), any())).thenAnswer(inv -> List.of(
                    new ActionDescriptor("nuclei", inv.getArgument(0), "auth-bypass", "high")));
            when(gate.validateAction(any(), any()))
                    .thenReturn(new PolicyDecision(Decision.REQUIRES_VALIDATION, 0.9, "auth-bypass", ""));

            var updates = node().apply(state(ScanMode.SAFE_SCAN, List.of("https://example.com")));

            assertEquals(List.of(), updates.get("findings"));
            assertEquals(1, updates.get("skippedActions"));
            verify(scanner, never()).run(anyString(), any());
        }

        @Test
        @DisplayName("every adapter plans for every host and each action is gated on its own")
        void multipleAdapters() {
            ScanAdapter nikto = mock(ScanAdapter.class);
            when(nikto.kind()).thenReturn("nikto");
            when(nikto.plan(anyString(), any())).thenAnswer(inv -> List.of(
                    new ActionDescriptor("nikto", inv.getArgument(0), "nikto-tuning-123", "low")));
            when(nikto.run(anyString(), any())).thenAnswer(inv -> List.of(new FindingRecord("example.com",
                    "Directory indexing found.", "low", "", Map.of(), "nikto", inv.getArgument(0) + "/icons/", "000726")));
            when(scanner.plan(anyString(), any())).thenAnswer(inv -> List.of(
                    new ActionDescriptor("nuclei", inv.getArgument(0), "exposures", "low,medium")));
            when(scanner.run(anyString(), any())).thenAnswer(inv -> List.of(finding(inv.getArgument(0))));
            when(gate.validateAction(any(), any())).thenReturn(PolicyDecision.allowed("no_rule_matched", ""));
            var node = new ScanNode(List.of(scanner, nikto), gate, new RateLimiter("scan", new RateBudget(100, 4)),
                    runControl, new EventBus(), new BountyscopeMetrics(registry));

            var updates = node.apply(state(ScanMode.SAFE_SCAN,
                    List.of("https://a.example.com", "https://b.example.com")));

            assertEquals(4, ((List<?>) updates.get("findings")).size());
            assertEquals(0, updates.get("skippedActions"));
            verify(gate, times(4)).validateAction(any(), any());
            verify(nikto).run(eq("https://a.example.com"), argThat(c -> c.templateOrRuleId().equals("nikto-tuning-123")));
            verify(nikto).run(eq("https://b.example.com"), any());
            verify(scanner, times(2)).run(anyString(), any());
        }
    }
}
