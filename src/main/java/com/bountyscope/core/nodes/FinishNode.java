package com.bountyscope.core.nodes;

import com.bountyscope.core.logging.MdcContext;
import com.bountyscope.core.model.PipelineStage;
import com.bountyscope.core.model.RunOutcome;
import com.bountyscope.core.model.RunStatus;
import com.bountyscope.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Terminal node. Keeps a failure recorded by an earlier stage; otherwise marks the run completed.
 */
@Component
public class FinishNode {

    private static final Logger log = LoggerFactory.getLogger(FinishNode.class);

    public Map<String, Object> apply(PipelineState state) {
        MdcContext.setStage(PipelineStage.COMPLETED.name());
        if (state.isFailed()) {
            log.info("Run {} ended in {}: {}", state.runId(),
                    state.outcome().map(Enum::name).orElse(RunOutcome.ERROR.name()), state.reason());
            return Map.of();
        }
        log.info("Run {} completed: {} finding(s), {} skipped action(s), {} failed scan(s)",
                state.runId(), state.findingsCount(), state.skippedActions(), state.failedScans());
        return Map.of(
                "status", RunStatus.COMPLETED.name(),
                "stage", PipelineStage.COMPLETED.name(),
                "outcome", RunOutcome.COMPLETED.name(),
                "reason", "completed");
    }
}
