package com.bountyscope.core.nodes;

import com.bountyscope.core.engine.RunContext;
import com.bountyscope.core.engine.RunControl;
import com.bountyscope.core.events.EventBus;
import com.bountyscope.core.metrics.BountyscopeMetrics;
import com.bountyscope.core.model.FindingRecord;
import com.bountyscope.core.model.PipelineStage;
import com.bountyscope.core.state.PipelineState;
import com.bountyscope.report.ReportPolicy;
import com.bountyscope.report.ReportWriter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Renders the run report from the triaged findings, highest score first.
 */
@Component
public class ReportNode extends StageNode {

    private final ReportWriter writer;

    public ReportNode(ReportWriter writer, RunControl runControl, EventBus eventBus, BountyscopeMetrics metrics) {
        super(PipelineStage.REPORT, runControl, eventBus, metrics);
        this.writer = writer;
    }

    @Override
    protected Map<String, Object> execute(PipelineState state, RunContext context) {
        List<FindingRecord> ordered = state.findings().stream()
                .sorted(ReportPolicy.BY_SCORE_DESC)
                .toList();
        try {
            String location = writer.write(state.runId(), state.target(), ordered, Path.of(state.outputDir()));
            return Map.of("reportLocation", location);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write report: " + e.getMessage(), e);
        }
    }
}
