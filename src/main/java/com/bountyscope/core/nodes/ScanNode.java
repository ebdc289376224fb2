package com.bountyscope.core.nodes;

import com.bountyscope.core.engine.CancellationSignal;
import com.bountyscope.core.engine.PipelineProperties;
import com.bountyscope.core.engine.RunCancelledException;
import com.bountyscope.core.engine.RunContext;
import com.bountyscope.core.engine.RunControl;
import com.bountyscope.core.events.EventBus;
import com.bountyscope.core.events.ScanEvent;
import com.bountyscope.core.logging.MdcContext;
import com.bountyscope.core.metrics.BountyscopeMetrics;
import com.bountyscope.core.model.ActionDescriptor;
import com.bountyscope.core.model.FindingRecord;
import com.bountyscope.core.model.PipelineStage;
import com.bountyscope.core.model.PolicyDecision;
import com.bountyscope.core.model.RateBudget;
import com.bountyscope.core.model.ScanMode;
import com.bountyscope.core.policy.PolicyDecisionGate;
import com.bountyscope.core.ratelimit.RateLimiter;
import com.bountyscope.core.state.PipelineState;
import com.bountyscope.tools.HostSanitizer;
import com.bountyscope.tools.ScanAdapter;
import com.bountyscope.tools.ScanConstraints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Plans scan actions for every live host, authorizes each one through the policy gate,
 * then runs the approved actions on a bounded worker pool behind the scan rate limiter.
 * <p>
 * Authorization is sequential so the audit trail has a deterministic order. Actions
 * that need validation run only in {@link ScanMode#FULL_SCAN_WITH_VALIDATION}. A failed
 * action is counted and logged; it never fails the stage.
 */
@Component
public class ScanNode extends StageNode {

    private static final Logger log = LoggerFactory.getLogger(ScanNode.class);

    private static final long AWAIT_POLL_MS = 200;

    private final List<ScanAdapter> adapters;
    private final PolicyDecisionGate gate;
    private final RateLimiter limiter;

    @Autowired
    public ScanNode(List<ScanAdapter> adapters, PolicyDecisionGate gate, PipelineProperties properties,
                    RunControl runControl, EventBus eventBus, BountyscopeMetrics metrics) {
        this(adapters, gate,
                new RateLimiter("scan", new RateBudget(properties.getRequestsPerMinute(), properties.getMaxConcurrency())),
                runControl, eventBus, metrics);
    }

    ScanNode(List<ScanAdapter> adapters, PolicyDecisionGate gate, RateLimiter limiter,
             RunControl runControl, EventBus eventBus, BountyscopeMetrics metrics) {
        super(PipelineStage.SCAN, runControl, eventBus, metrics);
        this.adapters = List.copyOf(adapters);
        this.gate = gate;
        this.limiter = limiter;
    }

    record ApprovedAction(ScanAdapter adapter, ActionDescriptor action) {}

    @Override
    protected Map<String, Object> execute(PipelineState state, RunContext context) {
        ScanMode mode = state.mode();
        var approved = new ArrayList<ApprovedAction>();
        int skipped = 0;

        for (String host : state.liveHosts()) {
            String url = HostSanitizer.toUrl(host);
            for (ScanAdapter adapter : adapters) {
                for (ActionDescriptor action : adapter.plan(url, mode)) {
                    context.throwIfCancelled();
                    PolicyDecision decision = gate.validateAction(action, context);
                    if (isApproved(decision, mode)) {
                        approved.add(new ApprovedAction(adapter, action));
                    } else {
                        skipped++;
                        String reason = decision.decision().name().toLowerCase(Locale.ROOT);
                        metrics.recordSkippedAction(reason);
                        log.info("Skipping {} on {} ({}): {}", action.actionKind(), url, reason, decision.reason());
                    }
                }
            }
        }

        if (approved.isEmpty()) {
            log.info("No approved scan actions for {} ({} skipped)", state.target(), skipped);
            return Map.of("findings", List.<FindingRecord>of(), "skippedActions", skipped);
        }

        var failures = new ArrayList<String>();
        List<FindingRecord> findings = runApproved(approved, state, context, failures);
        log.info("Scanning produced {} finding(s) from {} action(s), {} skipped, {} failed",
                findings.size(), approved.size(), skipped, failures.size());
        return Map.of(
                "findings", List.copyOf(findings),
                "skippedActions", skipped,
                "failedScans", failures.size(),
                "errors", failures);
    }

    static boolean isApproved(PolicyDecision decision, ScanMode mode) {
        return switch (decision.decision()) {
            case ALLOWED -> true;
            case REQUIRES_VALIDATION -> mode.allowsValidatedScanning();
            case BLOCKED, UNKNOWN -> false;
        };
    }

    private List<FindingRecord> runApproved(List<ApprovedAction> approved, PipelineState state,
                                            RunContext context, List<String> failures) {
        int poolSize = Math.min(limiter.budget().maxConcurrency(), approved.size());
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, workerThreads(state.runId()));
        var findings = new ArrayList<FindingRecord>();
        try {
            var futures = new ArrayList<Future<List<FindingRecord>>>();
            for (ApprovedAction a : approved) {
                futures.add(pool.submit(() -> runAction(a, state, context)));
            }
            for (int i = 0; i < futures.size(); i++) {
                ActionDescriptor action = approved.get(i).action();
                try {
                    findings.addAll(await(futures.get(i), context));
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RunCancelledException cancelled) {
                        throw cancelled;
                    }
                    log.warn("Scan {} failed on {}: {}", action.actionKind(), action.target(),
                            cause != null ? cause.getMessage() : e.getMessage());
                    failures.add("scan " + action.target() + ": " + (cause != null ? cause.getMessage() : e.getMessage()));
                }
            }
        } finally {
            pool.shutdownNow();
        }
        return findings;
    }

    private List<FindingRecord> runAction(ApprovedAction approved, PipelineState state, CancellationSignal signal) {
        ActionDescriptor action = approved.action();
        MdcContext.setRun(state.runId(), state.target());
        MdcContext.setStage(PipelineStage.SCAN.name());
        MdcContext.setHost(action.target());
        try (var permit = limiter.acquire(signal)) {
            eventBus.publish(ScanEvent.of("scan.started", state.runId(), state.target(), Map.of(
                    "host", action.target(),
                    "scanner", action.scannerKind(),
                    "template", action.templateOrRuleId())));
            long started = System.currentTimeMillis();
            boolean success = false;
            try {
                List<FindingRecord> result = approved.adapter().run(action.target(), constraintsFor(action));
                success = true;
                return result;
            } finally {
                metrics.recordScanDuration(action.scannerKind(), System.currentTimeMillis() - started, success);
            }
        } finally {
            MdcContext.clear();
        }
    }

    static ScanConstraints constraintsFor(ActionDescriptor action) {
        List<String> severities = Arrays.stream(action.severityHint().split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        return new ScanConstraints(action.templateOrRuleId(), severities, null);
    }

    private static <T> T await(Future<T> future, CancellationSignal signal) throws ExecutionException {
        while (true) {
            try {
                return future.get(AWAIT_POLL_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                signal.throwIfCancelled();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RunCancelledException("interrupted");
            }
        }
    }

    private static ThreadFactory workerThreads(String runId) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "scan-" + runId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
