package com.bountyscope.core.nodes;

import com.bountyscope.core.engine.PipelineProperties;
import com.bountyscope.core.model.FindingRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes the JSON artifacts of a run ({@code recon.json}, {@code crawl.json},
 * {@code findings.json}) into the run's output directory.
 */
@Component
public class ArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

    static final String RECON_FILE = "recon.json";
    static final String CRAWL_FILE = "crawl.json";
    static final String FINDINGS_FILE = "findings.json";

    private final PipelineProperties properties;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public ArtifactWriter(PipelineProperties properties) {
        this.properties = properties;
    }

    public Optional<Path> writeRecon(String outputDir, String target, List<String> subdomains, List<String> liveHosts) {
        var body = new LinkedHashMap<String, Object>();
        body.put("target", target);
        body.put("subdomains", subdomains);
        body.put("live_hosts", liveHosts);
        return write(outputDir, RECON_FILE, body);
    }

    public Optional<Path> writeCrawl(String outputDir, String target, List<String> urls) {
        var body = new LinkedHashMap<String, Object>();
        body.put("target", target);
        body.put("urls", urls);
        return write(outputDir, CRAWL_FILE, body);
    }

    public Optional<Path> writeFindings(String outputDir, List<FindingRecord> findings) {
        return write(outputDir, FINDINGS_FILE, findings.stream().map(ArtifactWriter::toMap).toList());
    }

    static Map<String, Object> toMap(FindingRecord f) {
        var m = new LinkedHashMap<String, Object>();
        m.put("target", f.getTarget());
        m.put("name", f.getName());
        m.put("severity", f.getSeverity());
        m.put("severity_adjusted", f.getSeverityAdjusted());
        m.put("description", f.getDescription());
        m.put("scanner", f.getScannerKind());
        m.put("template_id", f.getTemplateId());
        m.put("matched_at", f.getMatchedAt());
        m.put("evidence", f.getEvidence());
        m.put("ml_score", f.getMlScore());
        m.put("llm_score", f.getLlmScore());
        m.put("final_score", f.getFinalScore());
        m.put("confidence", f.getConfidence());
        m.put("is_false_positive", f.isFalsePositive());
        m.put("explanation", f.getExplanation());
        m.put("discovered_at", f.getDiscoveredAt() != null ? f.getDiscoveredAt().toString() : null);
        return m;
    }

    /** Failures are logged and reported as empty; artifacts never fail a run. */
    private Optional<Path> write(String outputDir, String fileName, Object body) {
        if (!properties.isWriteArtifacts() || outputDir == null || outputDir.isBlank()) {
            return Optional.empty();
        }
        Path file = Path.of(outputDir).resolve(fileName);
        try {
            Files.createDirectories(file.getParent());
            mapper.writeValue(file.toFile(), body);
            log.debug("Wrote {}", file);
            return Optional.of(file);
        } catch (IOException e) {
            log.warn("Could not write {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
