package com.bountyscope.core.model;

/**
 * Why a run ended. Policy outcomes are kept apart from failures so callers can
 * tell a refused target from a broken run.
 */
public enum RunOutcome {
    COMPLETED,
    POLICY_BLOCKED,
    POLICY_UNRESOLVED,
    CANCELLED,
    ERROR
}
