package com.bountyscope.core.nodes;

import com.bountyscope.core.engine.RunCancelledException;
import com.bountyscope.core.engine.RunContext;
import com.bountyscope.core.engine.RunControl;
import com.bountyscope.core.events.EventBus;
import com.bountyscope.core.metrics.BountyscopeMetrics;
import com.bountyscope.core.model.PipelineStage;
import com.bountyscope.core.state.PipelineState;
import com.bountyscope.tools.HostSanitizer;
import com.bountyscope.tools.ReconAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Passive subdomain enumeration. The target itself is always the first entry; a
 * failing adapter only loses its own results.
 */
@Component
public class ReconNode extends StageNode {

    private static final Logger log = LoggerFactory.getLogger(ReconNode.class);

    private final List<ReconAdapter> adapters;

    public ReconNode(List<ReconAdapter> adapters, RunControl runControl, EventBus eventBus,
                     BountyscopeMetrics metrics) {
        super(PipelineStage.RECON, runControl, eventBus, metrics);
        this.adapters = List.copyOf(adapters);
    }

    @Override
    protected Map<String, Object> execute(PipelineState state, RunContext context) {
        String root = HostSanitizer.sanitizeDomain(state.target()).orElse(state.target());
        var discovered = new TreeSet<String>();
        var errors = new ArrayList<String>();

        for (ReconAdapter adapter : adapters) {
            context.throwIfCancelled();
            try {
                for (String candidate : adapter.enumerate(root)) {
                    HostSanitizer.sanitizeDomain(candidate).ifPresent(discovered::add);
                }
            } catch (RunCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Recon adapter {} failed for {}: {}", adapter.name(), root, e.getMessage());
                errors.add("recon " + adapter.name() + ": " + e.getMessage());
            }
        }

        var subdomains = new LinkedHashSet<String>();
        subdomains.add(root);
        subdomains.addAll(discovered);
        log.info("Recon found {} host(s) for {}", subdomains.size(), root);
        return Map.of("subdomains", List.copyOf(subdomains), "errors", errors);
    }
}
