package com.bountyscope.core.policy;

import java.util.List;
import java.util.Optional;

/**
 * Immutable, ordered rule set consulted by the policy gate. Block rules are always
 * evaluated before validation rules; within each group declaration order wins.
 */
public final class RuleManifest {

    private final List<ManifestRule> blockRules;
    private final List<ManifestRule> validationRules;

    public RuleManifest(List<ManifestRule> rules) {
        this.blockRules = rules.stream().filter(r -> r.action() == RuleAction.BLOCK).toList();
        this.validationRules = rules.stream().filter(r -> r.action() == RuleAction.REQUIRES_VALIDATION).toList();
    }

    public Optional<ManifestRule> firstBlockMatch(String templateOrRuleId) {
        return firstMatch(blockRules, templateOrRuleId);
    }

    public Optional<ManifestRule> firstValidationMatch(String templateOrRuleId) {
        return firstMatch(validationRules, templateOrRuleId);
    }

    public List<ManifestRule> blockRules() {
        return blockRules;
    }

    public List<ManifestRule> validationRules() {
        return validationRules;
    }

    private static Optional<ManifestRule> firstMatch(List<ManifestRule> rules, String templateOrRuleId) {
        for (ManifestRule rule : rules) {
            if (rule.matches(templateOrRuleId)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }
}
