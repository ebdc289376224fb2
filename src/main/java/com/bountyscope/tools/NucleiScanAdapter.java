package com.bountyscope.tools;

import com.bountyscope.core.model.ActionDescriptor;
import com.bountyscope.core.model.FindingRecord;
import com.bountyscope.core.model.ScanMode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Template scanning with {@code nuclei}. Each configured template becomes a separate
 * action so the policy gate can judge it on its own id.
 */
@Component
public class NucleiScanAdapter implements ScanAdapter {

    private static final Logger log = LoggerFactory.getLogger(NucleiScanAdapter.class);

    static final String KIND = "nuclei";

    private final ToolRunner runner;
    private final ToolProperties properties;
    private final ObjectMapper mapper = new ObjectMapper();

    public NucleiScanAdapter(ToolRunner runner, ToolProperties properties) {
        this.runner = runner;
        this.properties = properties;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public List<ActionDescriptor> plan(String host, ScanMode mode) {
        String severities = String.join(",", severitiesFor(mode));
        List<String> templates = properties.getNucleiTemplates();
        if (templates == null || templates.isEmpty()) {
            return List.of(new ActionDescriptor(KIND, host, "", severities));
        }
        return templates.stream()
                .map(template -> new ActionDescriptor(KIND, host, template, severities))
                .toList();
    }

    public List<String> severitiesFor(ScanMode mode) {
        return mode.allowsValidatedScanning() ? properties.getFullSeverities() : properties.getSafeSeverities();
    }

    @Override
    public List<FindingRecord> run(String target, ScanConstraints constraints) {
        var url = HostSanitizer.sanitizeUrl(target);
        if (url.isEmpty()) {
            log.warn("Invalid target URL for nuclei: {}", target);
            return List.of();
        }
        List<String> command = new ArrayList<>(List.of(
                properties.getNucleiBinary(),
                "-u", url.get(),
                "-silent",
                "-jsonl",
                "-rate-limit", String.valueOf(properties.getNucleiRateLimit()),
                "-timeout", String.valueOf(properties.getRequestTimeout().toSeconds()),
                "-retries", "1"));
        if (!constraints.severities().isEmpty()) {
            command.add("-severity");
            command.add(String.join(",", constraints.severities()));
        }
        if (!constraints.templateOrRuleId().isBlank()) {
            command.add("-t");
            command.add(constraints.templateOrRuleId());
        }
        log.info("Running nuclei on {} (template: {}, severity: {})", url.get(),
                constraints.templateOrRuleId().isBlank() ? "default" : constraints.templateOrRuleId(),
                String.join(",", constraints.severities()));
        try {
            var result = runner.run(command, constraints.timeout() != null ? constraints.timeout() : properties.getScanTimeout());
            if (result.timedOut()) {
                log.warn("nuclei scan timed out for {}; keeping partial output", url.get());
            }
            List<FindingRecord> findings = parseOutput(result.lines(), url.get());
            log.info("nuclei found {} potential issues on {}", findings.size(), url.get());
            return findings;
        } catch (ToolUnavailableException e) {
            log.warn("nuclei not found, skipping scan: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Parses nuclei JSON lines. Unparseable lines are skipped.
     */
    List<FindingRecord> parseOutput(List<String> lines, String target) {
        List<FindingRecord> findings = new ArrayList<>();
        for (String line : lines) {
            try {
                JsonNode data = mapper.readTree(line);
                if (data == null || !data.isObject()) {
                    continue;
                }
                JsonNode info = data.path("info");
                Map<String, Object> evidence = new LinkedHashMap<>();
                evidence.put("type", data.path("type").asText(""));
                evidence.put("matcher_name", data.path("matcher-name").asText(""));
                List<String> extracted = new ArrayList<>();
                data.path("extracted-results").forEach(n -> extracted.add(n.asText()));
                evidence.put("extracted_results", extracted);
                findings.add(new FindingRecord(
                        target,
                        info.path("name").asText("Unknown"),
                        info.path("severity").asText("unknown"),
                        info.path("description").asText(""),
                        evidence,
                        KIND,
                        data.path("matched-at").asText(target),
                        data.path("template-id").asText("")));
            } catch (JsonProcessingException e) {
                log.warn("Failed to parse nuclei output line: {}", line.length() > 100 ? line.substring(0, 100) : line);
            }
        }
        return findings;
    }
}
