package com.bountyscope.core.nodes;

import com.bountyscope.core.engine.PipelineProperties;
import com.bountyscope.core.model.FindingRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactWriterTest {

    @TempDir
    Path runDir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("recon.json lists subdomains and live hosts")
    void writesRecon() throws Exception {
        var writer = new ArtifactWriter(new PipelineProperties());

        var path = writer.writeRecon(runDir.toString(), "example.com",
                List.of("a.example.com"), List.of("https://a.example.com")).orElseThrow();

        JsonNode json = mapper.readTree(path.toFile());
        assertEquals("example.com", json.get("target").asText());
        assertEquals("a.example.com", json.get("subdomains").get(0).asText());
        assertEquals("https://a.example.com", json.get("live_hosts").get(0).asText());
    }

    @Test
    @DisplayName("findings.json uses snake_case keys")
    void writesFindings() throws Exception {
        var writer = new ArtifactWriter(new PipelineProperties());
        var finding = new FindingRecord("example.com", "Open redirect", "low", "redirects anywhere",
                Map.of("param", "next"), "nuclei", "https://example.com/?next=x", "open-redirect");

        var path = writer.writeFindings(runDir.toString(), List.of(finding)).orElseThrow();

        JsonNode first = mapper.readTree(path.toFile()).get(0);
        assertEquals("Open redirect", first.get("name").asText());
        assertEquals("open-redirect", first.get("template_id").asText());
        assertEquals("next", first.get("evidence").get("param").asText());
        assertFalse(first.get("is_false_positive").asBoolean());
    }

    @Test
    @DisplayName("nothing is written when artifacts are disabled")
    void disabled() {
        var properties = new PipelineProperties();
        properties.setWriteArtifacts(false);

        assertTrue(new ArtifactWriter(properties).writeCrawl(runDir.toString(), "example.com", List.of()).isEmpty());
        assertFalse(Files.exists(runDir.resolve(ArtifactWriter.CRAWL_FILE)));
    }

    @Test
    @DisplayName("a write failure is reported as empty")
    void writeFailure() throws Exception {
        Path blocker = Files.writeString(runDir.resolve("not-a-dir"), "x");

        var result = new ArtifactWriter(new PipelineProperties())
                .writeCrawl(blocker.toString(), "example.com", List.of("https://example.com/"));

        assertTrue(result.isEmpty());
    }
}
