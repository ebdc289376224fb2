package com.bountyscope.core.policy;

import com.bountyscope.core.advisory.AdvisoryClient;
import com.bountyscope.core.advisory.AdvisoryDecision;
import com.bountyscope.core.advisory.AdvisoryOutcome;
import com.bountyscope.core.engine.CancellationSignal;
import com.bountyscope.core.model.ActionDescriptor;
import com.bountyscope.core.model.Decision;
import com.bountyscope.core.model.PolicyDecision;
import com.bountyscope.core.model.ScopeDefinition;
import com.bountyscope.core.scope.ScopeMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Authorizes targets and scan actions.
 * <p>
 * Local rules decide first: an out-of-scope match or a manifest block rule is final.
 * The advisory service is consulted only where local rules are inconclusive, and its
 * failures resolve toward the safe side: {@code UNKNOWN} for scope, {@code BLOCKED}
 * for actions. Every decision is appended to the {@link PolicyAuditLog} before it is
 * returned.
 */
@Component
public class PolicyDecisionGate {

    private static final Logger log = LoggerFactory.getLogger(PolicyDecisionGate.class);

    static final String SCOPE_CHECK = "scope_check";
    static final String SCOPE_CHECK_ADVISORY = "scope_check_advisory";
    static final String MANUAL_OVERRIDE = "manual_override";

    private final RuleManifest manifest;
    private final PolicyProperties properties;
    private final PolicyAuditLog auditLog;
    private final ScopeMatcher matcher;
    private final AdvisoryClient advisory;

    @Autowired
    public PolicyDecisionGate(RuleManifestLoader manifestLoader,
                              PolicyProperties properties,
                              PolicyAuditLog auditLog,
                              ScopeMatcher matcher,
                              @Autowired(required = false) AdvisoryClient advisory) {
        this(manifestLoader.load(properties.getManifestPath()), properties, auditLog, matcher, advisory);
    }

    PolicyDecisionGate(RuleManifest manifest, PolicyProperties properties, PolicyAuditLog auditLog,
                       ScopeMatcher matcher, AdvisoryClient advisory) {
        this.manifest = manifest;
        this.properties = properties;
        this.auditLog = auditLog;
        this.matcher = matcher;
        this.advisory = advisory;
        log.info("Policy gate ready: {} block rules, {} validation rules, advisory {}",
                manifest.blockRules().size(), manifest.validationRules().size(),
                advisory != null ? "enabled" : "disabled");
    }

    /**
     * Decides whether {@code target} may be tested under {@code scope}.
     * Exclusions are checked before inclusions.
     */
    public PolicyDecision validateScope(String target, Optional<ScopeDefinition> scope) {
        return validateScope(target, scope, CancellationSignal.NONE);
    }

    /**
     * As {@link #validateScope(String, Optional)}, with an advisory wait that stops when
     * {@code cancel} fires.
     */
    public PolicyDecision validateScope(String target, Optional<ScopeDefinition> scope, CancellationSignal cancel) {
        if (scope.isEmpty()) {
            return audit(target, SCOPE_CHECK,
                    PolicyDecision.unknown("no scope provided", "Supply a scope file to authorize this target"));
        }
        ScopeDefinition definition = scope.get();

        Optional<String> excluded = matcher.firstMatch(target, definition.outOfScope());
        if (excluded.isPresent()) {
            return audit(target, SCOPE_CHECK,
                    PolicyDecision.blocked("Target matches out-of-scope pattern: " + excluded.get(),
                            "Target explicitly excluded from program scope"));
        }
        Optional<String> included = matcher.firstMatch(target, definition.inScope());
        if (included.isPresent()) {
            return audit(target, SCOPE_CHECK,
                    PolicyDecision.allowed("Target matches in-scope pattern: " + included.get(),
                            "Target explicitly included in program scope"));
        }

        if (advisory == null) {
            return audit(target, SCOPE_CHECK,
                    PolicyDecision.unknown("Target does not match any scope pattern", "Manual review required"));
        }
        AdvisoryOutcome<AdvisoryDecision> outcome = advisory.validateScope(target, definition, cancel);
        PolicyDecision decision = outcome.isSuccess()
                ? fromAdvisory(outcome.value(), "Advisory scope validation")
                : PolicyDecision.unknown("Advisory scope validation failed: " + outcome.failure(),
                        "Manual review required");
        return audit(target, SCOPE_CHECK_ADVISORY, decision);
    }

    /**
     * Decides whether a scan action may run. Block rules are evaluated before
     * validation rules; within each group the first matching rule wins.
     */
    public PolicyDecision validateAction(ActionDescriptor action) {
        return validateAction(action, CancellationSignal.NONE);
    }

    public PolicyDecision validateAction(ActionDescriptor action, CancellationSignal cancel) {
        String templateId = action.templateOrRuleId();

        Optional<ManifestRule> blockRule = manifest.firstBlockMatch(templateId);
        if (blockRule.isPresent()) {
            return audit(action.target(), action.actionKind(),
                    PolicyDecision.blocked("Template matches blocked pattern: " + blockRule.get().id(),
                            blockRule.get().notes()));
        }

        Optional<ManifestRule> validationRule = manifest.firstValidationMatch(templateId);
        if (validationRule.isPresent()) {
            ManifestRule rule = validationRule.get();
            if (advisory == null) {
                return audit(action.target(), action.actionKind(),
                        new PolicyDecision(Decision.REQUIRES_VALIDATION, 0.5,
                                "Template requires validation: " + rule.id(), rule.notes()));
            }
            log.debug("Escalating action {} on {} to advisory validation (rule {})",
                    action.actionKind(), action.target(), rule.id());
            AdvisoryOutcome<AdvisoryDecision> outcome = advisory.validateAction(action, cancel);
            PolicyDecision decision = outcome.isSuccess()
                    ? fromAdvisory(outcome.value(), "Advisory action validation")
                    : new PolicyDecision(Decision.BLOCKED, 0.0,
                            "Advisory action validation failed: " + outcome.failure(),
                            "Failed to validate, blocking for safety");
            return audit(action.target(), action.actionKind() + "_advisory", decision);
        }

        return audit(action.target(), action.actionKind(),
                PolicyDecision.allowed("No policy restrictions matched", "Action is within safe parameters"));
    }

    /**
     * Asks the operator to confirm an unresolved scope decision.
     *
     * @param requested whether the run asked for manual unblocking
     * @return true only if overrides are enabled, requested, the decision is {@code UNKNOWN}
     *         and the operator entered exactly the configured token
     */
    public boolean confirmManualOverride(String target, PolicyDecision scopeDecision,
                                         OverrideChannel channel, boolean requested) {
        if (scopeDecision.decision() != Decision.UNKNOWN) {
            log.debug("Manual override not applicable to {} decision for {}", scopeDecision.decision(), target);
            return false;
        }
        if (!properties.isAllowManualUnblock() || !requested) {
            log.info("Manual override unavailable for {} (enabled={}, requested={})",
                    target, properties.isAllowManualUnblock(), requested);
            return false;
        }
        String answer;
        try {
            answer = channel != null ? channel.requestConfirmation(target, scopeDecision) : null;
        } catch (RuntimeException e) {
            log.warn("Override channel failed for {}: {}", target, e.getMessage());
            answer = null;
        }
        if (answer == null || !answer.equals(properties.getOverrideToken())) {
            log.warn("Manual override declined for {}", target);
            return false;
        }
        audit(target, MANUAL_OVERRIDE,
                PolicyDecision.allowed("manual override accepted", "Operator confirmed testing of an unresolved target"));
        return true;
    }

    public boolean isAdvisoryEnabled() {
        return advisory != null;
    }

    private PolicyDecision audit(String target, String actionKind, PolicyDecision decision) {
        auditLog.append(target, actionKind, decision);
        return decision;
    }

    private static PolicyDecision fromAdvisory(AdvisoryDecision payload, String fallbackReason) {
        Decision decision = Decision.fromWireName(payload.decision());
        double confidence = payload.confidence() != null ? payload.confidence() : 0.0;
        String reason = payload.reasons().isEmpty() ? fallbackReason : String.join("; ", payload.reasons());
        String details;
        if (!payload.suggestedNextSteps().isEmpty()) {
            details = String.join("; ", payload.suggestedNextSteps());
        } else if (payload.riskLevel() != null) {
            details = "Risk level: " + payload.riskLevel();
        } else {
            details = "";
        }
        return new PolicyDecision(decision, confidence, reason, details);
    }
}
