package com.bountyscope.core.health;

import com.bountyscope.core.graph.PipelineGraph;
import com.bountyscope.core.persistence.JdbcScanStore;
import com.bountyscope.core.persistence.ScanStore;
import com.bountyscope.core.policy.PolicyDecisionGate;
import com.bountyscope.core.triage.FindingClassifier;
import com.bountyscope.tools.ToolProperties;
import com.bountyscope.tools.ToolRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reports readiness of the pieces a run depends on. Missing external tools and a
 * disabled advisory service degrade a run but do not prevent it.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final PipelineGraph pipelineGraph;
    private final DataSource dataSource;
    private final ScanStore store;
    private final PolicyDecisionGate gate;
    private final FindingClassifier classifier;
    private final ToolRunner toolRunner;
    private final ToolProperties toolProperties;

    public HealthCheckService(
            @Autowired(required = false) PipelineGraph pipelineGraph,
            @Autowired(required = false) DataSource dataSource,
            ScanStore store,
            PolicyDecisionGate gate,
            FindingClassifier classifier,
            ToolRunner toolRunner,
            ToolProperties toolProperties) {
        this.pipelineGraph = pipelineGraph;
        this.dataSource = dataSource;
        this.store = store;
        this.gate = gate;
        this.classifier = classifier;
        this.toolRunner = toolRunner;
        this.toolProperties = toolProperties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGraph());
        results.add(checkDatabase());
        results.add(checkTool("subfinder", toolProperties.getSubfinderBinary()));
        results.add(checkTool("httpx", toolProperties.getHttpxBinary()));
        results.add(checkTool("nuclei", toolProperties.getNucleiBinary()));
        results.add(checkAdvisory());
        results.add(checkClassifier());
        return results;
    }

    HealthStatus checkGraph() {
        if (pipelineGraph != null) {
            return new HealthStatus("graph", HealthStatus.Status.UP, "Pipeline graph compiled", Map.of());
        }
        return new HealthStatus("graph", HealthStatus.Status.DOWN, "Pipeline graph not available", Map.of());
    }

    HealthStatus checkDatabase() {
        if (dataSource == null || !(store instanceof JdbcScanStore)) {
            return new HealthStatus("database", HealthStatus.Status.DEGRADED,
                    "Using in-memory store; results are not kept after exit",
                    Map.of("store", store.getClass().getSimpleName()));
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP, "Database connection valid",
                        Map.of("url", conn.getMetaData().getURL()));
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN, "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    HealthStatus checkTool(String name, String binary) {
        return toolRunner.locate(binary)
                .map(path -> new HealthStatus(name, HealthStatus.Status.UP, "Found at " + path,
                        Map.of("binary", binary)))
                .orElseGet(() -> new HealthStatus(name, HealthStatus.Status.DEGRADED,
                        "'" + binary + "' not found on PATH; stage will produce no results",
                        Map.of("binary", binary)));
    }

    HealthStatus checkAdvisory() {
        if (gate.isAdvisoryEnabled()) {
            return new HealthStatus("advisory", HealthStatus.Status.UP, "Advisory service configured", Map.of());
        }
        return new HealthStatus("advisory", HealthStatus.Status.DEGRADED,
                "Advisory service disabled; local rules and neutral scores only", Map.of());
    }

    HealthStatus checkClassifier() {
        if (classifier.isTrained()) {
            return new HealthStatus("classifier", HealthStatus.Status.UP, "Triage model loaded", Map.of());
        }
        return new HealthStatus("classifier", HealthStatus.Status.DEGRADED,
                "No triage model; local scores are neutral (run 'bountyscope train')", Map.of());
    }
}
