package com.bountyscope.core.advisory;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Advisory payload for scope and action checks.
 */
public record AdvisoryDecision(
    @JsonProperty("decision") String decision,
    @JsonProperty("confidence") Double confidence,
    @JsonProperty("reasons") List<String> reasons,
    @JsonProperty("suggested_next_steps") List<String> suggestedNextSteps,
    @JsonProperty("risk_level") String riskLevel
) {

    public AdvisoryDecision {
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
        suggestedNextSteps = suggestedNextSteps != null ? List.copyOf(suggestedNextSteps) : List.of();
    }
}
