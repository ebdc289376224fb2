package com.bountyscope.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Persisted audit entry for a policy decision. Field names and decision wire values
 * are read by external tooling.
 */
public record PolicyAuditRecord(
    String target,
    String actionKind,
    Decision decision,
    String reason,
    double confidence,
    Instant timestamp
) implements Serializable {

    public static PolicyAuditRecord of(String target, String actionKind, PolicyDecision decision) {
        return new PolicyAuditRecord(target, actionKind, decision.decision(), decision.reason(),
                decision.confidence(), Instant.now());
    }
}
