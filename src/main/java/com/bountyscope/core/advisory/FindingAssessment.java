package com.bountyscope.core.advisory;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Advisory payload for finding triage.
 */
public record FindingAssessment(
    @JsonProperty("score") Double score,
    @JsonProperty("confidence") Double confidence,
    @JsonProperty("explanation") String explanation,
    @JsonProperty("severity") String severity,
    @JsonProperty("is_likely_fp") Boolean likelyFalsePositive
) {}
