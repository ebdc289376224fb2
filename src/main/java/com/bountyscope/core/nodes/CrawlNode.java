package com.bountyscope.core.nodes;

import com.bountyscope.core.engine.PipelineProperties;
import com.bountyscope.core.engine.RunCancelledException;
import com.bountyscope.core.engine.RunContext;
import com.bountyscope.core.engine.RunControl;
import com.bountyscope.core.events.EventBus;
import com.bountyscope.core.logging.MdcContext;
import com.bountyscope.core.metrics.BountyscopeMetrics;
import com.bountyscope.core.model.PipelineStage;
import com.bountyscope.core.state.PipelineState;
import com.bountyscope.tools.CrawlAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Crawls the first few live hosts for same-origin URLs. Active modes only.
 */
@Component
public class CrawlNode extends StageNode {

    private static final Logger log = LoggerFactory.getLogger(CrawlNode.class);

    private final CrawlAdapter crawler;
    private final ArtifactWriter artifacts;
    private final PipelineProperties properties;

    public CrawlNode(CrawlAdapter crawler, ArtifactWriter artifacts, PipelineProperties properties,
                     RunControl runControl, EventBus eventBus, BountyscopeMetrics metrics) {
        super(PipelineStage.CRAWL, runControl, eventBus, metrics);
        this.crawler = crawler;
        this.artifacts = artifacts;
        this.properties = properties;
    }

    @Override
    protected Map<String, Object> execute(PipelineState state, RunContext context) {
        var urls = new LinkedHashSet<String>();
        var errors = new ArrayList<String>();
        List<String> seeds = state.liveHosts().stream()
                .limit(properties.getCrawl().getMaxSeedHosts())
                .toList();

        for (String seed : seeds) {
            context.throwIfCancelled();
            MdcContext.setHost(seed);
            try {
                urls.addAll(crawler.crawl(seed));
            } catch (RunCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Crawl failed for {}: {}", seed, e.getMessage());
                errors.add("crawl " + seed + ": " + e.getMessage());
            } finally {
                MdcContext.clearHost();
            }
        }

        List<String> crawled = List.copyOf(urls);
        log.info("Crawled {} URL(s) from {} seed host(s)", crawled.size(), seeds.size());
        artifacts.writeCrawl(state.outputDir(), state.target(), crawled);
        return Map.of("crawledUrls", crawled, "errors", errors);
    }
}
