package com.bountyscope.tools;

import java.time.Duration;
import java.util.List;

/**
 * Limits handed to a scan adapter for one approved action.
 *
 * @param templateOrRuleId template or rule the policy gate approved; empty for the tool's defaults
 * @param severities       severity bands to report
 * @param timeout          wall-clock limit for the whole scan
 */
public record ScanConstraints(String templateOrRuleId, List<String> severities, Duration timeout) {

    public ScanConstraints {
        templateOrRuleId = templateOrRuleId != null ? templateOrRuleId : "";
        severities = severities != null ? List.copyOf(severities) : List.of();
    }
}
