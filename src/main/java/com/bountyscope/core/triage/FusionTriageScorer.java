package com.bountyscope.core.triage;

import com.bountyscope.core.advisory.AdvisoryClient;
import com.bountyscope.core.advisory.AdvisoryOutcome;
import com.bountyscope.core.advisory.FindingAssessment;
import com.bountyscope.core.config.ConfigurationException;
import com.bountyscope.core.engine.CancellationSignal;
import com.bountyscope.core.metrics.BountyscopeMetrics;
import com.bountyscope.core.model.FindingRecord;
import com.bountyscope.core.model.TriageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Fuses the local classifier score and the advisory score into one triage verdict.
 * <p>
 * Either signal degrades to a neutral 0.5 when unavailable, so a finding is always
 * scored. {@code final = mlWeight * ml + llmWeight * llm}; a final score below the
 * false-positive threshold marks the finding as a likely false positive.
 */
@Component
public class FusionTriageScorer {

    private static final Logger log = LoggerFactory.getLogger(FusionTriageScorer.class);

    static final double NEUTRAL = 0.5;

    private final FindingClassifier classifier;
    private final AdvisoryClient advisory;
    private final BountyscopeMetrics metrics;
    private final double mlWeight;
    private final double llmWeight;
    private final double falsePositiveThreshold;

    @Autowired
    public FusionTriageScorer(TriageProperties properties,
                              FindingClassifier classifier,
                              @Autowired(required = false) AdvisoryClient advisory,
                              BountyscopeMetrics metrics) {
        this.classifier = classifier;
        this.advisory = advisory;
        this.metrics = metrics;
        this.mlWeight = requireUnit("bounty.triage.ml-weight", properties.getMlWeight());
        this.llmWeight = requireUnit("bounty.triage.llm-weight", properties.getLlmWeight());
        this.falsePositiveThreshold = requireUnit("bounty.triage.false-positive-threshold",
                properties.getFalsePositiveThreshold());
        if (Math.abs(mlWeight + llmWeight - 1.0) > 1e-6) {
            log.warn("Triage weights do not sum to 1.0 (ml={}, llm={}); final scores may leave [0,1]",
                    mlWeight, llmWeight);
        }
    }

    FusionTriageScorer(TriageProperties properties, FindingClassifier classifier, AdvisoryClient advisory) {
        this(properties, classifier, advisory, null);
    }

    public TriageResult score(FindingRecord finding) {
        return score(finding, CancellationSignal.NONE);
    }

    /**
     * Scores one finding. Does not mutate it.
     *
     * @param cancel observed while the advisory call waits for a permit
     */
    public TriageResult score(FindingRecord finding, CancellationSignal cancel) {
        double ml = mlScore(finding);

        double llm = NEUTRAL;
        double confidence = 0.0;
        boolean likelyFalsePositive = false;
        String explanation;
        if (advisory == null) {
            explanation = "Advisory scoring disabled";
        } else {
            AdvisoryOutcome<FindingAssessment> outcome = advisory.scoreFinding(finding, cancel);
            if (outcome.isSuccess()) {
                FindingAssessment assessment = outcome.value();
                llm = clamp(assessment.score());
                confidence = assessment.confidence() != null ? clamp(assessment.confidence()) : NEUTRAL;
                likelyFalsePositive = Boolean.TRUE.equals(assessment.likelyFalsePositive());
                explanation = assessment.explanation() != null ? assessment.explanation() : "";
            } else {
                explanation = "Advisory scoring unavailable: " + outcome.failure();
            }
        }

        double finalScore = mlWeight * ml + llmWeight * llm;
        boolean falsePositive = likelyFalsePositive || finalScore < falsePositiveThreshold;
        String severity = adjustSeverity(finding.getSeverity(), finalScore);

        log.info("Triaged finding: {} - score {}{}", finding.getName(), String.format("%.2f", finalScore),
                falsePositive ? " (likely false positive)" : "");
        if (metrics != null) {
            metrics.recordFinalScore(finalScore, falsePositive);
        }
        return new TriageResult(ml, llm, finalScore, confidence, explanation, falsePositive, severity);
    }

    /**
     * Scores the finding and stores the verdict on it.
     */
    public TriageResult scoreAndApply(FindingRecord finding) {
        return scoreAndApply(finding, CancellationSignal.NONE);
    }

    public TriageResult scoreAndApply(FindingRecord finding, CancellationSignal cancel) {
        TriageResult result = score(finding, cancel);
        finding.applyTriage(result);
        return result;
    }

    /**
     * Damps or raises severity according to the final score:
     * below 0.3 becomes info, below 0.5 caps high/critical at medium, above 0.8 raises medium to high.
     */
    static String adjustSeverity(String severity, double finalScore) {
        String original = severity != null ? severity.toLowerCase(Locale.ROOT) : "unknown";
        if (finalScore < 0.3) {
            return "info";
        }
        if (finalScore < 0.5) {
            return original.equals("high") || original.equals("critical") ? "medium" : original;
        }
        if (finalScore > 0.8 && original.equals("medium")) {
            return "high";
        }
        return original;
    }

    private double mlScore(FindingRecord finding) {
        try {
            OptionalDouble prediction = classifier.predict(TextFeatures.extract(finding));
            if (prediction.isEmpty() || Double.isNaN(prediction.getAsDouble())) {
                return NEUTRAL;
            }
            return clamp(prediction.getAsDouble());
        } catch (RuntimeException e) {
            log.warn("Classifier scoring failed for {}: {}", finding.getName(), e.getMessage());
            return NEUTRAL;
        }
    }

    private static double clamp(Double value) {
        if (value == null || value.isNaN()) {
            return NEUTRAL;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ConfigurationException(name + " must be between 0.0 and 1.0 (was " + value + ")");
        }
        return value;
    }
}
