package com.bountyscope.core.policy;

import java.util.regex.Pattern;

/**
 * One tagged rule of the policy manifest.
 *
 * @param id      stable rule id referenced in decision reasons, e.g. "rce-templates"
 * @param pattern case-insensitive expression searched in the action's template/rule id
 * @param action  what a match means
 * @param notes   operator-facing explanation
 */
public record ManifestRule(
    String id,
    Pattern pattern,
    RuleAction action,
    String notes
) {

    public static ManifestRule of(String id, String regex, RuleAction action, String notes) {
        return new ManifestRule(id, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), action,
                notes != null ? notes : "");
    }

    public boolean matches(String templateOrRuleId) {
        return templateOrRuleId != null && pattern.matcher(templateOrRuleId).find();
    }
}
