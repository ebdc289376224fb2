package com.bountyscope.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A potential vulnerability reported by a scan adapter.
 * <p>
 * Created by an adapter and owned by the pipeline run until persisted. The triage
 * fields start empty and are filled exactly once through {@link #applyTriage}.
 */
public class FindingRecord implements Serializable {

    private final String target;
    private final String name;
    private final String severity;
    private final String description;
    private final LinkedHashMap<String, Object> evidence;
    private final String scannerKind;
    private final String matchedAt;
    private final String templateId;
    private final Instant discoveredAt;

    private Double mlScore;
    private Double llmScore;
    private Double finalScore;
    private Double confidence;
    private String severityAdjusted;
    private boolean falsePositive;
    private String explanation;

    public FindingRecord(String target, String name, String severity, String description,
                         Map<String, Object> evidence, String scannerKind, String matchedAt,
                         String templateId) {
        this(target, name, severity, description, evidence, scannerKind, matchedAt, templateId, Instant.now());
    }

    public FindingRecord(String target, String name, String severity, String description,
                         Map<String, Object> evidence, String scannerKind, String matchedAt,
                         String templateId, Instant discoveredAt) {
        this.target = target != null ? target : "";
        this.name = name != null && !name.isBlank() ? name : "Unknown";
        this.severity = severity != null && !severity.isBlank() ? severity : "unknown";
        this.description = description != null ? description : "";
        this.evidence = evidence != null ? new LinkedHashMap<>(evidence) : new LinkedHashMap<>();
        this.scannerKind = scannerKind != null ? scannerKind : "unknown";
        this.matchedAt = matchedAt != null ? matchedAt : this.target;
        this.templateId = templateId != null ? templateId : "";
        this.discoveredAt = discoveredAt != null ? discoveredAt : Instant.now();
    }

    /**
     * Stores the triage verdict on this finding. Subsequent calls replace the previous
     * verdict so that re-scoring stays idempotent.
     */
    public synchronized void applyTriage(TriageResult result) {
        this.mlScore = result.mlScore();
        this.llmScore = result.llmScore();
        this.finalScore = result.finalScore();
        this.confidence = result.confidence();
        this.severityAdjusted = result.severityAdjusted();
        this.falsePositive = result.falsePositive();
        this.explanation = result.explanation();
    }

    public boolean isTriaged() {
        return finalScore != null;
    }

    public String getTarget() {
        return target;
    }

    public String getName() {
        return name;
    }

    public String getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Object> getEvidence() {
        return Collections.unmodifiableMap(evidence);
    }

    public String getScannerKind() {
        return scannerKind;
    }

    public String getMatchedAt() {
        return matchedAt;
    }

    public String getTemplateId() {
        return templateId;
    }

    public Instant getDiscoveredAt() {
        return discoveredAt;
    }

    public Double getMlScore() {
        return mlScore;
    }

    public Double getLlmScore() {
        return llmScore;
    }

    /** Final fused score, or 0.0 when the finding has not been triaged. */
    public double getFinalScore() {
        return finalScore != null ? finalScore : 0.0;
    }

    public Double getConfidence() {
        return confidence;
    }

    /** Adjusted severity, falling back to the reported severity before triage. */
    public String getSeverityAdjusted() {
        return severityAdjusted != null ? severityAdjusted : severity;
    }

    public boolean isFalsePositive() {
        return falsePositive;
    }

    public String getExplanation() {
        return explanation != null ? explanation : "";
    }

    @Override
    public String toString() {
        return "FindingRecord[" + name + " @ " + matchedAt + ", severity=" + severity
                + (finalScore != null ? ", score=" + String.format("%.2f", finalScore) : "") + "]";
    }
}
