package com.bountyscope.core.engine;

import com.bountyscope.core.events.EventBus;
import com.bountyscope.core.events.ScanEvent;
import com.bountyscope.core.graph.PipelineGraph;
import com.bountyscope.core.logging.MdcContext;
import com.bountyscope.core.metrics.BountyscopeMetrics;
import com.bountyscope.core.model.FindingRecord;
import com.bountyscope.core.model.RunOutcome;
import com.bountyscope.core.model.RunRecord;
import com.bountyscope.core.model.RunResult;
import com.bountyscope.core.model.RunStatus;
import com.bountyscope.core.persistence.ScanStore;
import com.bountyscope.core.state.PipelineState;
import com.bountyscope.report.ReportPolicy;
import com.bountyscope.report.ReportWriter;
import com.bountyscope.tools.HostSanitizer;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the pipeline graph for one target or a batch of targets.
 * <p>
 * {@link #runTarget} never throws: every ending, including policy refusals, cancellation
 * and unexpected errors, comes back as a {@link RunResult}, and the persisted run record
 * is moved to its terminal status exactly once.
 */
@Service
public class PipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(PipelineEngine.class);

    private final PipelineGraph graph;
    private final RunControl runControl;
    private final RunIdGenerator runIds;
    private final ScanStore store;
    private final ReportWriter reportWriter;
    private final PipelineProperties properties;
    private final EventBus eventBus;
    private final BountyscopeMetrics metrics;
    private final AtomicBoolean stopping = new AtomicBoolean(false);

    public PipelineEngine(PipelineGraph graph, RunControl runControl, RunIdGenerator runIds, ScanStore store,
                          ReportWriter reportWriter, PipelineProperties properties, EventBus eventBus,
                          BountyscopeMetrics metrics) {
        this.graph = graph;
        this.runControl = runControl;
        this.runIds = runIds;
        this.store = store;
        this.reportWriter = reportWriter;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public RunResult runTarget(RunRequest request) {
        String target = request.target() != null ? request.target().trim() : "";
        String runId = runIds.next(target);
        MdcContext.setRun(runId, target);
        try {
            Optional<String> sanitized = HostSanitizer.sanitizeDomain(target);
            if (sanitized.isEmpty()) {
                log.error("Invalid target: '{}'", target);
                RunResult result = RunResult.failed(runId, target, RunOutcome.ERROR, "invalid target: " + target);
                metrics.recordRunResult(result.outcome().name());
                return result;
            }
            return execute(runId, sanitized.get(), request);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs targets one after another. A failing target does not stop the batch; after
     * {@link #cancelAll()} the remaining targets are reported as cancelled without running.
     */
    public List<RunResult> runBatch(List<String> targets, RunRequest template) {
        var results = new ArrayList<RunResult>();
        for (String target : targets) {
            if (target == null || target.isBlank()) {
                continue;
            }
            if (stopping.get()) {
                results.add(RunResult.failed(runIds.next(target), target, RunOutcome.CANCELLED, RunContext.CANCELLED));
                continue;
            }
            results.add(runTarget(template.withTarget(target)));
        }
        long succeeded = results.stream().filter(RunResult::success).count();
        log.info("Batch finished: {} of {} target(s) completed", succeeded, results.size());
        return results;
    }

    public boolean cancel(String runId) {
        return runControl.cancel(runId);
    }

    /** Cancels every active run and stops any batch in progress. */
    public void cancelAll() {
        stopping.set(true);
        runControl.cancelAll();
    }

    /**
     * Rebuilds the report of a finished run from its persisted findings.
     *
     * @return the report location, or empty when the run is unknown or the report could not be written
     */
    public Optional<String> regenerateReport(String runId) {
        Optional<RunRecord> run = store.findRun(runId);
        if (run.isEmpty()) {
            log.warn("Run {} not found", runId);
            return Optional.empty();
        }
        List<FindingRecord> findings = store.listFindings(runId).stream()
                .sorted(ReportPolicy.BY_SCORE_DESC)
                .toList();
        try {
            return Optional.of(reportWriter.write(runId, run.get().target(), findings,
                    Path.of(run.get().outputLocation())));
        } catch (IOException e) {
            log.error("Could not regenerate report for {}: {}", runId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    private RunResult execute(String runId, String target, RunRequest request) {
        Path outputDir = (request.outputDir() != null ? request.outputDir() : Path.of(properties.getOutputDir()))
                .resolve(runId);
        Duration timeout = request.timeout() != null ? request.timeout() : properties.getRunTimeout();

        log.info("Starting run {} for {} in mode {}", runId, target, request.mode().cliName());
        store.createRun(RunRecord.started(runId, target, request.mode(), outputDir.toString()));
        runControl.register(runId, request, timeout);
        eventBus.publish(ScanEvent.of("run.started", runId, target, Map.of(
                "mode", request.mode().cliName(),
                "outputDir", outputDir.toString())));

        RunResult result;
        try {
            var stateMap = new HashMap<String, Object>();
            stateMap.put("runId", runId);
            stateMap.put("target", target);
            stateMap.put("mode", request.mode().name());
            stateMap.put("outputDir", outputDir.toString());

            var config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();

            PipelineState state = graph.getCompiledGraph()
                    .invoke(Map.copyOf(stateMap), config)
                    .orElseThrow(() -> new IllegalStateException("Graph execution returned empty state for run " + runId));
            result = toResult(runId, target, state);
        } catch (Exception e) {
            RunCancelledException cancelled = findCancellation(e);
            if (cancelled != null) {
                result = RunResult.failed(runId, target, RunOutcome.CANCELLED, cancelled.getReason());
            } else {
                log.error("Run {} failed: {}", runId, e.getMessage(), e);
                result = RunResult.failed(runId, target, RunOutcome.ERROR,
                        e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        } finally {
            runControl.release(runId);
        }

        finish(result);
        return result;
    }

    private void finish(RunResult result) {
        RunStatus status = result.success() ? RunStatus.COMPLETED : RunStatus.FAILED;
        if (!store.updateRunStatus(result.runId(), status, result.findingsCount())) {
            log.warn("Run {} status was already final", result.runId());
        }
        metrics.recordRunResult(result.outcome().name());
        var payload = new HashMap<String, Object>();
        payload.put("outcome", result.outcome().name());
        payload.put("reason", result.reason());
        payload.put("findings", result.findingsCount());
        if (result.reportLocation() != null) {
            payload.put("report", result.reportLocation());
        }
        eventBus.publish(ScanEvent.of("run.finished", result.runId(), result.target(), payload));
        log.info("Run {} finished: {} ({})", result.runId(), result.outcome(), result.reason());
    }

    static RunResult toResult(String runId, String target, PipelineState state) {
        if (state.status() == RunStatus.COMPLETED) {
            return RunResult.completed(runId, target, state.findingsCount(), state.reportLocation().orElse(null));
        }
        RunOutcome outcome = state.outcome().orElse(RunOutcome.ERROR);
        String reason = state.reason().isBlank() ? "run did not complete" : state.reason();
        return RunResult.failed(runId, target, outcome, reason);
    }

    private static RunCancelledException findCancellation(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof RunCancelledException cancelled) {
                return cancelled;
            }
            current = current.getCause();
        }
        return null;
    }
}
