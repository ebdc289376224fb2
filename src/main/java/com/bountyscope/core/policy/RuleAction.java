package com.bountyscope.core.policy;

/**
 * What a matching manifest rule does to an action.
 */
public enum RuleAction {
    BLOCK,
    REQUIRES_VALIDATION
}
