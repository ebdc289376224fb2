package com.bountyscope.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for policy decisions, runs, scans and triage.
 */
@Service
public class BountyscopeMetrics {

    private final MeterRegistry registry;

    public BountyscopeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPolicyDecision(String actionKind, String decision) {
        Counter.builder("bountyscope.policy.decisions")
                .tag("action", actionKind.startsWith("scanner_") ? "scanner" : actionKind)
                .tag("decision", decision)
                .register(registry)
                .increment();
    }

    public void recordRunResult(String outcome) {
        Counter.builder("bountyscope.runs.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordStageDuration(String stage, long ms) {
        Timer.builder("bountyscope.stage.duration")
                .tag("stage", stage)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordScanDuration(String scannerKind, long ms, boolean success) {
        Timer.builder("bountyscope.scan.duration")
                .tag("scanner", scannerKind)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Counts scan actions the pipeline did not execute.
     *
     * @param reason "blocked", "unknown", "requires_validation" or "failed"
     */
    public void recordSkippedAction(String reason) {
        Counter.builder("bountyscope.scan.skipped")
                .description("Scan actions not executed")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordFinalScore(double score, boolean falsePositive) {
        DistributionSummary.builder("bountyscope.triage.final_score")
                .tag("false_positive", String.valueOf(falsePositive))
                .register(registry)
                .record(score);
    }

    public void recordAdvisoryCall(String purpose, boolean success) {
        Counter.builder("bountyscope.advisory.calls")
                .tag("purpose", purpose)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }
}
