package com.bountyscope.core.nodes;

import com.bountyscope.core.engine.RunCancelledException;
import com.bountyscope.core.engine.RunContext;
import com.bountyscope.core.engine.RunControl;
import com.bountyscope.core.events.EventBus;
import com.bountyscope.core.metrics.BountyscopeMetrics;
import com.bountyscope.core.model.FindingRecord;
import com.bountyscope.core.model.PipelineStage;
import com.bountyscope.core.persistence.ScanStore;
import com.bountyscope.core.state.PipelineState;
import com.bountyscope.core.triage.FusionTriageScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scores every finding, persists the scored ones and writes {@code findings.json}.
 * A finding that cannot be scored is dropped with a warning.
 */
@Component
public class TriageNode extends StageNode {

    private static final Logger log = LoggerFactory.getLogger(TriageNode.class);

    private final FusionTriageScorer scorer;
    private final ScanStore store;
    private final ArtifactWriter artifacts;

    public TriageNode(FusionTriageScorer scorer, ScanStore store, ArtifactWriter artifacts,
                      RunControl runControl, EventBus eventBus, BountyscopeMetrics metrics) {
        super(PipelineStage.TRIAGE, runControl, eventBus, metrics);
        this.scorer = scorer;
        this.store = store;
        this.artifacts = artifacts;
    }

    @Override
    protected Map<String, Object> execute(PipelineState state, RunContext context) {
        var scored = new ArrayList<FindingRecord>();
        var errors = new ArrayList<String>();
        for (FindingRecord finding : state.findings()) {
            context.throwIfCancelled();
            try {
                scorer.scoreAndApply(finding, context);
                store.saveFinding(state.runId(), finding);
                scored.add(finding);
            } catch (RunCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Triage failed for finding '{}': {}", finding.getName(), e.getMessage());
                errors.add("triage " + finding.getName() + ": " + e.getMessage());
            }
        }
        long falsePositives = scored.stream().filter(FindingRecord::isFalsePositive).count();
        log.info("Triaged {} finding(s), {} likely false positive(s)", scored.size(), falsePositives);
        artifacts.writeFindings(state.outputDir(), scored);
        return Map.of("findings", List.copyOf(scored), "findingsCount", scored.size(), "errors", errors);
    }
}
