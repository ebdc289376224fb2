package com.bountyscope.core.model;

import java.io.Serializable;

/**
 * A pending scan action submitted to the policy gate.
 *
 * @param scannerKind      adapter kind, e.g. "nuclei"
 * @param target           host or URL the action would touch
 * @param templateOrRuleId template id, tag list or rule id the scanner would run; may be empty
 * @param severityHint     requested severity band, e.g. "low,medium"
 */
public record ActionDescriptor(
    String scannerKind,
    String target,
    String templateOrRuleId,
    String severityHint
) implements Serializable {

    public ActionDescriptor {
        scannerKind = scannerKind != null ? scannerKind : "unknown";
        target = target != null ? target : "";
        templateOrRuleId = templateOrRuleId != null ? templateOrRuleId : "";
        severityHint = severityHint != null ? severityHint : "";
    }

    /** Action kind recorded in the audit trail. */
    public String actionKind() {
        return "scanner_" + scannerKind;
    }
}
