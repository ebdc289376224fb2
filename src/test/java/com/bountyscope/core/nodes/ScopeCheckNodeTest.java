package com.bountyscope.core.nodes;

import com.bountyscope.core.engine.RunControl;
import com.bountyscope.core.engine.RunRequest;
import com.bountyscope.core.events.EventBus;
import com.bountyscope.core.metrics.BountyscopeMetrics;
import com.bountyscope.core.model.PolicyDecision;
import com.bountyscope.core.model.ScanMode;
import com.bountyscope.core.model.ScopeDefinition;
import com.bountyscope.core.policy.OverrideChannel;
import com.bountyscope.core.policy.PolicyDecisionGate;
import com.bountyscope.core.policy.PolicyProperties;
import com.bountyscope.core.state.PipelineState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ScopeCheckNodeTest {

    private PolicyDecisionGate gate;
    private PolicyProperties policyProperties;
    private RunControl runControl;
    private ScopeCheckNode node;
    private final PipelineState state = new PipelineState(Map.of("runId", "r1", "target", "shop.example.com"));
    private final ScopeDefinition scope = new ScopeDefinition(List.of("*.example.com"), List.of());

    @BeforeEach
    void setUp() {
        gate = mock(PolicyDecisionGate.class);
        policyProperties = new PolicyProperties();
        runControl = new RunControl();
        node = new ScopeCheckNode(gate, policyProperties, runControl, new EventBus(),
                new BountyscopeMetrics(new SimpleMeterRegistry()));
    }

    private void register(boolean allowUnblock) {
        runControl.register("r1", new RunRequest("shop.example.com", ScanMode.SAFE_SCAN, scope, allowUnblock,
                null, null, OverrideChannel.NONE), Duration.ofMinutes(1));
    }

    @Test
    @DisplayName("an allowed target records the decision and continues")
    void allowed() {
        register(false);
        var decision = PolicyDecision.allowed("in_scope", "matches *.example.com");
        when(gate.validateScope(eq("shop.example.com"), any(), any())).thenReturn(decision);

        var updates = node.apply(state);

        assertNull(updates.get("status"));
        assertEquals(decision, updates.get("scopeDecision"));
    }

    @Test
    @DisplayName("a blocked target fails with blocked_by_policy")
    void blocked() {
        register(false);
        when(gate.validateScope(anyString(), any(), any())).thenReturn(PolicyDecision.blocked("out_of_scope", ""));

        var updates = node.apply(state);

        assertEquals("FAILED", updates.get("status"));
        assertEquals("POLICY_BLOCKED", updates.get("outcome"));
        assertEquals(ScopeCheckNode.BLOCKED_BY_POLICY, updates.get("reason"));
    }

    @Test
    @DisplayName("an unknown target without an override fails with unknown_scope")
    void unknownWithoutOverride() {
        register(false);
        when(gate.validateScope(anyString(), any(), any())).thenReturn(PolicyDecision.unknown("no_scope", ""));

        var updates = node.apply(state);

        assertEquals("POLICY_UNRESOLVED", updates.get("outcome"));
        assertEquals(ScopeCheckNode.UNKNOWN_SCOPE, updates.get("reason"));
    }

    @Test
    @DisplayName("a declined override fails with override_declined")
    void overrideDeclined() {
        register(true);
        policyProperties.setAllowManualUnblock(true);
        when(gate.validateScope(anyString(), any(), any())).thenReturn(PolicyDecision.unknown("no_scope", ""));
        when(gate.confirmManualOverride(anyString(), any(), any(), eq(true))).thenReturn(false);

        var updates = node.apply(state);

        assertEquals(ScopeCheckNode.OVERRIDE_DECLINED, updates.get("reason"));
    }

    @Test
    @DisplayName("an accepted override continues and marks the run")
    void overrideAccepted() {
        register(true);
        policyProperties.setAllowManualUnblock(true);
        when(gate.validateScope(anyString(), any(), any())).thenReturn(PolicyDecision.unknown("no_scope", ""));
        when(gate.confirmManualOverride(anyString(), any(), any(), eq(true))).thenReturn(true);

        var updates = node.apply(state);

        assertNull(updates.get("status"));
        assertEquals(true, updates.get("overrideAccepted"));
    }
}
