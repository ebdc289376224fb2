package com.bountyscope.tools;

import com.bountyscope.core.model.ActionDescriptor;
import com.bountyscope.core.model.FindingRecord;
import com.bountyscope.core.model.ScanMode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Web server checks with {@code nikto}, limited to its read-only tuning classes.
 * Registered only when {@code bounty.tools.nikto-enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "bounty.tools", name = "nikto-enabled", havingValue = "true")
public class NiktoScanAdapter implements ScanAdapter {

    private static final Logger log = LoggerFactory.getLogger(NiktoScanAdapter.class);

    static final String KIND = "nikto";
    static final String SEVERITY = "low";

    /** Slack on top of nikto's own -maxtime before the process is killed. */
    private static final Duration KILL_MARGIN = Duration.ofSeconds(60);

    private final ToolRunner runner;
    private final ToolProperties properties;
    private final ObjectMapper mapper = new ObjectMapper();

    public NiktoScanAdapter(ToolRunner runner, ToolProperties properties) {
        this.runner = runner;
        this.properties = properties;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public List<ActionDescriptor> plan(String host, ScanMode mode) {
        return List.of(new ActionDescriptor(KIND, host, ruleId(), SEVERITY));
    }

    String ruleId() {
        return "nikto-tuning-" + properties.getNiktoTuning();
    }

    @Override
    public List<FindingRecord> run(String target, ScanConstraints constraints) {
        var url = HostSanitizer.sanitizeUrl(target);
        if (url.isEmpty()) {
            log.warn("Invalid target URL for nikto: {}", target);
            return List.of();
        }
        Duration maxTime = constraints.timeout() != null ? constraints.timeout() : properties.getNiktoMaxTime();
        Path output;
        try {
            output = Files.createTempFile("bountyscope-nikto-", ".json");
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create nikto output file: " + e.getMessage(), e);
        }
        try {
            List<String> command = List.of(
                    properties.getNiktoBinary(),
                    "-h", url.get(),
                    "-Format", "json",
                    "-output", output.toString(),
                    "-Tuning", properties.getNiktoTuning(),
                    "-timeout", String.valueOf(properties.getRequestTimeout().toSeconds()),
                    "-maxtime", maxTime.toSeconds() + "s",
                    "-nointeractive");
            log.info("Running nikto on {} (tuning {})", url.get(), properties.getNiktoTuning());
            var result = runner.run(command, maxTime.plus(KILL_MARGIN));
            if (result.timedOut()) {
                log.warn("nikto scan timed out for {}; keeping partial output", url.get());
            }
            List<FindingRecord> findings = parseOutput(Files.readString(output), url.get());
            log.info("nikto found {} potential issues on {}", findings.size(), url.get());
            return findings;
        } catch (ToolUnavailableException e) {
            log.warn("nikto not found, skipping scan: {}", e.getMessage());
            return List.of();
        } catch (IOException e) {
            log.warn("Failed to read nikto output for {}: {}", url.get(), e.getMessage());
            return List.of();
        } finally {
            deleteQuietly(output);
        }
    }

    /**
     * Parses a nikto JSON report. Nikto writes either one host object or an array of them,
     * each with a {@code vulnerabilities} list. Nikto reports no severity, so every item is low.
     */
    List<FindingRecord> parseOutput(String json, String target) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (IOException e) {
            log.warn("Failed to parse nikto output: {}", e.getMessage());
            return List.of();
        }
        List<JsonNode> hosts = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(hosts::add);
        } else if (root.isObject()) {
            hosts.add(root);
        }
        List<FindingRecord> findings = new ArrayList<>();
        for (JsonNode host : hosts) {
            for (JsonNode vuln : host.path("vulnerabilities")) {
                String message = vuln.path("msg").asText("");
                Map<String, Object> evidence = new LinkedHashMap<>();
                evidence.put("url", vuln.path("url").asText(""));
                evidence.put("method", vuln.path("method").asText(""));
                evidence.put("osvdb", vuln.path("OSVDB").asText(""));
                findings.add(new FindingRecord(
                        target,
                        message.isBlank() ? "Unknown" : message,
                        SEVERITY,
                        message,
                        evidence,
                        KIND,
                        matchedAt(target, vuln.path("url").asText("")),
                        vuln.path("id").asText("")));
            }
        }
        return findings;
    }

    private static String matchedAt(String target, String path) {
        if (path.isBlank()) {
            return target;
        }
        if (path.startsWith("http://") || path.startsWith("https://")) {
            return path;
        }
        String base = target.endsWith("/") ? target.substring(0, target.length() - 1) : target;
        return base + (path.startsWith("/") ? path : "/" + path);
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", file, e.getMessage());
        }
    }
}
