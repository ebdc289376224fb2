package com.bountyscope.core.health;

import com.bountyscope.core.graph.PipelineGraph;
import com.bountyscope.core.persistence.InMemoryScanStore;
import com.bountyscope.core.persistence.JdbcScanStore;
import com.bountyscope.core.policy.PolicyDecisionGate;
import com.bountyscope.core.triage.FindingClassifier;
import com.bountyscope.tools.ToolProperties;
import com.bountyscope.tools.ToolRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class HealthCheckServiceTest {

    private PolicyDecisionGate gate;
    private FindingClassifier classifier;
    private ToolRunner toolRunner;
    private ToolProperties toolProperties;

    @BeforeEach
    void setUp() {
        gate = mock(PolicyDecisionGate.class);
        classifier = mock(FindingClassifier.class);
        toolRunner = mock(ToolRunner.class);
        toolProperties = new ToolProperties();
        when(toolRunner.locate(anyString())).thenReturn(Optional.empty());
    }

    private static HealthStatus find(List<HealthStatus> results, String component) {
        return results.stream().filter(s -> component.equals(s.component())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("checkAll reports graph, database, tools, advisory and classifier")
    void checkAllReturnsAllComponents() {
        var service = new HealthCheckService(null, null, new InMemoryScanStore(), gate, classifier,
                toolRunner, toolProperties);

        var components = service.checkAll().stream().map(HealthStatus::component).toList();

        assertEquals(List.of("graph", "database", "subfinder", "httpx", "nuclei", "advisory", "classifier"),
                components);
    }

    @Test
    @DisplayName("missing graph is DOWN, optional pieces are DEGRADED")
    void bareInstallation() {
        var service = new HealthCheckService(null, null, new InMemoryScanStore(), gate, classifier,
                toolRunner, toolProperties);

        var results = service.checkAll();

        assertEquals(HealthStatus.Status.DOWN, find(results, "graph").status());
        assertEquals(HealthStatus.Status.DEGRADED, find(results, "database").status());
        assertEquals(HealthStatus.Status.DEGRADED, find(results, "nuclei").status());
        assertEquals(HealthStatus.Status.DEGRADED, find(results, "advisory").status());
        assertEquals(HealthStatus.Status.DEGRADED, find(results, "classifier").status());
    }

    @Test
    @DisplayName("available components are UP")
    void readyInstallation() {
        var dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:health-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        when(toolRunner.locate("nuclei")).thenReturn(Optional.of(Path.of("/usr/bin/nuclei")));
        when(gate.isAdvisoryEnabled()).thenReturn(true);
        when(classifier.isTrained()).thenReturn(true);
        var service = new HealthCheckService(mock(PipelineGraph.class), dataSource, new JdbcScanStore(dataSource),
                gate, classifier, toolRunner, toolProperties);

        var results = service.checkAll();

        assertEquals(HealthStatus.Status.UP, find(results, "graph").status());
        assertEquals(HealthStatus.Status.UP, find(results, "database").status());
        assertEquals(HealthStatus.Status.UP, find(results, "nuclei").status());
        assertEquals(HealthStatus.Status.UP, find(results, "advisory").status());
        assertEquals(HealthStatus.Status.UP, find(results, "classifier").status());
        assertEquals(HealthStatus.Status.DEGRADED, find(results, "httpx").status());
    }
}
