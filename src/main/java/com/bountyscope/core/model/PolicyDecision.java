package com.bountyscope.core.model;

import java.io.Serializable;

/**
 * Auditable result of a scope or action check.
 *
 * @param decision   the verdict
 * @param confidence 0.0 to 1.0, clamped on construction
 * @param reason     short machine-greppable reason
 * @param details    operator-facing explanation or follow-up
 */
public record PolicyDecision(
    Decision decision,
    double confidence,
    String reason,
    String details
) implements Serializable {

    public PolicyDecision {
        if (decision == null) {
            throw new IllegalArgumentException("decision must not be null");
        }
        if (Double.isNaN(confidence)) {
            confidence = 0.0;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        reason = reason != null ? reason : "";
        details = details != null ? details : "";
    }

    public static PolicyDecision allowed(String reason, String details) {
        return new PolicyDecision(Decision.ALLOWED, 1.0, reason, details);
    }

    public static PolicyDecision blocked(String reason, String details) {
        return new PolicyDecision(Decision.BLOCKED, 1.0, reason, details);
    }

    public static PolicyDecision unknown(String reason, String details) {
        return new PolicyDecision(Decision.UNKNOWN, 0.0, reason, details);
    }

    public boolean isAllowed() {
        return decision == Decision.ALLOWED;
    }

    public boolean isBlocked() {
        return decision == Decision.BLOCKED;
    }
}
