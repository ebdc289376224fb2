package com.bountyscope.core.policy;

import com.bountyscope.core.model.PolicyDecision;

/**
 * Interactive confirmation source for overriding an unresolved scope decision.
 */
@FunctionalInterface
public interface OverrideChannel {

    /** Never answers; every override request is declined. */
    OverrideChannel NONE = (target, decision) -> null;

    /**
     * Asks the operator to confirm testing {@code target}.
     *
     * @return the raw text the operator entered, or null if nothing was entered
     */
    String requestConfirmation(String target, PolicyDecision decision);
}
