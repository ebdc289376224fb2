package com.bountyscope.core.nodes;

import com.bountyscope.core.engine.RunCancelledException;
import com.bountyscope.core.engine.RunContext;
import com.bountyscope.core.engine.RunControl;
import com.bountyscope.core.events.EventBus;
import com.bountyscope.core.metrics.BountyscopeMetrics;
import com.bountyscope.core.model.PipelineStage;
import com.bountyscope.core.state.PipelineState;
import com.bountyscope.tools.ProbeAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Probes enumerated hosts for HTTP(S) liveness and writes {@code recon.json}.
 */
@Component
public class ProbeNode extends StageNode {

    private static final Logger log = LoggerFactory.getLogger(ProbeNode.class);

    private final ProbeAdapter probe;
    private final ArtifactWriter artifacts;

    public ProbeNode(ProbeAdapter probe, ArtifactWriter artifacts, RunControl runControl,
                     EventBus eventBus, BountyscopeMetrics metrics) {
        super(PipelineStage.PROBE, runControl, eventBus, metrics);
        this.probe = probe;
        this.artifacts = artifacts;
    }

    @Override
    protected Map<String, Object> execute(PipelineState state, RunContext context) {
        List<String> hosts = state.subdomains();
        var errors = new ArrayList<String>();
        List<String> live;
        try {
            live = hosts.isEmpty() ? List.of() : List.copyOf(probe.probe(hosts));
        } catch (RunCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Probing failed for {}: {}", state.target(), e.getMessage());
            errors.add("probe: " + e.getMessage());
            live = List.of();
        }
        log.info("{} of {} host(s) are live", live.size(), hosts.size());
        artifacts.writeRecon(state.outputDir(), state.target(), hosts, live);
        return Map.of("liveHosts", live, "errors", errors);
    }
}
