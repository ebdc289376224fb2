package com.bountyscope.core.model;

import java.io.Serializable;

/**
 * Fused triage verdict for a single finding.
 */
public record TriageResult(
    double mlScore,
    double llmScore,
    double finalScore,
    double confidence,
    String explanation,
    boolean falsePositive,
    String severityAdjusted
) implements Serializable {}
