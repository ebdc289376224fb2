package com.bountyscope.core.nodes;

import com.bountyscope.core.engine.RunContext;
import com.bountyscope.core.engine.RunControl;
import com.bountyscope.core.events.EventBus;
import com.bountyscope.core.events.ScanEvent;
import com.bountyscope.core.metrics.BountyscopeMetrics;
import com.bountyscope.core.model.Decision;
import com.bountyscope.core.model.PipelineStage;
import com.bountyscope.core.model.PolicyDecision;
import com.bountyscope.core.model.RunOutcome;
import com.bountyscope.core.policy.PolicyDecisionGate;
import com.bountyscope.core.policy.PolicyProperties;
import com.bountyscope.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * First stage: authorizes the target against the program scope.
 * <p>
 * {@code BLOCKED} ends the run as {@code blocked_by_policy}. An unresolved decision
 * ends it as {@code unknown_scope}, unless the operator confirms a manual override;
 * a declined override ends it as {@code override_declined}.
 */
@Component
public class ScopeCheckNode extends StageNode {

    private static final Logger log = LoggerFactory.getLogger(ScopeCheckNode.class);

    public static final String BLOCKED_BY_POLICY = "blocked_by_policy";
    public static final String UNKNOWN_SCOPE = "unknown_scope";
    public static final String OVERRIDE_DECLINED = "override_declined";

    private final PolicyDecisionGate gate;
    private final PolicyProperties policyProperties;

    public ScopeCheckNode(PolicyDecisionGate gate, PolicyProperties policyProperties,
                          RunControl runControl, EventBus eventBus, BountyscopeMetrics metrics) {
        super(PipelineStage.SCOPE_CHECK, runControl, eventBus, metrics);
        this.gate = gate;
        this.policyProperties = policyProperties;
    }

    @Override
    protected Map<String, Object> execute(PipelineState state, RunContext context) {
        String target = state.target();
        PolicyDecision decision = gate.validateScope(target, context.scope(), context);
        log.info("Scope decision for {}: {} ({})", target, decision.decision(), decision.reason());
        eventBus.publish(ScanEvent.of("policy.decision", state.runId(), target, Map.of(
                "check", "scope",
                "decision", decision.decision().wireName(),
                "reason", decision.reason())));

        if (decision.decision() == Decision.ALLOWED) {
            return Map.of("scopeDecision", decision);
        }
        if (decision.decision() == Decision.BLOCKED) {
            return withDecision(failed(RunOutcome.POLICY_BLOCKED, BLOCKED_BY_POLICY), decision);
        }

        boolean offered = context.allowUnblock() && policyProperties.isAllowManualUnblock();
        if (gate.confirmManualOverride(target, decision, context.overrideChannel(), context.allowUnblock())) {
            log.warn("Proceeding with {} under manual override", target);
            var updates = new HashMap<String, Object>();
            updates.put("scopeDecision", decision);
            updates.put("overrideAccepted", true);
            return updates;
        }
        return withDecision(failed(RunOutcome.POLICY_UNRESOLVED, offered ? OVERRIDE_DECLINED : UNKNOWN_SCOPE), decision);
    }

    private static Map<String, Object> withDecision(Map<String, Object> updates, PolicyDecision decision) {
        updates.put("scopeDecision", decision);
        return updates;
    }
}
