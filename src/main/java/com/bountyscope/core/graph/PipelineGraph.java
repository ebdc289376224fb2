package com.bountyscope.core.graph;

import com.bountyscope.core.model.ScanMode;
import com.bountyscope.core.nodes.CrawlNode;
import com.bountyscope.core.nodes.FinishNode;
import com.bountyscope.core.nodes.ProbeNode;
import com.bountyscope.core.nodes.ReconNode;
import com.bountyscope.core.nodes.ReportNode;
import com.bountyscope.core.nodes.ScanNode;
import com.bountyscope.core.nodes.ScopeCheckNode;
import com.bountyscope.core.nodes.TriageNode;
import com.bountyscope.core.state.PipelineState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} for one target.
 * <pre>
 *   START -> scope_check -> recon -> probe -> [passive-only] -> finish -> END
 *                                          -> crawl -> scan -> triage -> report -> finish -> END
 * </pre>
 * Every stage routes straight to {@code finish} once the state is {@code FAILED}.
 */
@Component
public class PipelineGraph {

    private static final Logger log = LoggerFactory.getLogger(PipelineGraph.class);

    static final String SCOPE_CHECK = "scope_check";
    static final String RECON = "recon";
    static final String PROBE = "probe";
    static final String CRAWL = "crawl";
    static final String SCAN = "scan";
    static final String TRIAGE = "triage";
    static final String REPORT = "report";
    static final String FINISH = "finish";

    private final CompiledGraph<PipelineState> compiledGraph;

    public PipelineGraph(ScopeCheckNode scopeCheckNode,
                         ReconNode reconNode,
                         ProbeNode probeNode,
                         CrawlNode crawlNode,
                         ScanNode scanNode,
                         TriageNode triageNode,
                         ReportNode reportNode,
                         FinishNode finishNode) throws Exception {

        var graph = new StateGraph<>(PipelineState.SCHEMA, PipelineState::new)
                .addNode(SCOPE_CHECK, node_async(scopeCheckNode::apply))
                .addNode(RECON, node_async(reconNode::apply))
                .addNode(PROBE, node_async(probeNode::apply))
                .addNode(CRAWL, node_async(crawlNode::apply))
                .addNode(SCAN, node_async(scanNode::apply))
                .addNode(TRIAGE, node_async(triageNode::apply))
                .addNode(REPORT, node_async(reportNode::apply))
                .addNode(FINISH, node_async(finishNode::apply))
                .addEdge(START, SCOPE_CHECK)
                .addConditionalEdges(SCOPE_CHECK, edge_async(s -> next(s, RECON)), routes(RECON))
                .addConditionalEdges(RECON, edge_async(s -> next(s, PROBE)), routes(PROBE))
                .addConditionalEdges(PROBE, edge_async(this::routeAfterProbe), routes(CRAWL))
                .addConditionalEdges(CRAWL, edge_async(s -> next(s, SCAN)), routes(SCAN))
                .addConditionalEdges(SCAN, edge_async(s -> next(s, TRIAGE)), routes(TRIAGE))
                .addConditionalEdges(TRIAGE, edge_async(s -> next(s, REPORT)), routes(REPORT))
                .addEdge(REPORT, FINISH)
                .addEdge(FINISH, END);

        this.compiledGraph = graph.compile();
        log.info("Pipeline graph compiled");
    }

    /** Passive runs stop after probing. */
    String routeAfterProbe(PipelineState state) {
        if (state.isFailed() || state.mode() == ScanMode.PASSIVE_ONLY) {
            return FINISH;
        }
        return CRAWL;
    }

    static String next(PipelineState state, String onSuccess) {
        return state.isFailed() ? FINISH : onSuccess;
    }

    private static Map<String, String> routes(String onSuccess) {
        return Map.of(onSuccess, onSuccess, FINISH, FINISH);
    }

    public CompiledGraph<PipelineState> getCompiledGraph() {
        return compiledGraph;
    }
}
