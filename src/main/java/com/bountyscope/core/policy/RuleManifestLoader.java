package com.bountyscope.core.policy;

import com.bountyscope.core.config.ConfigurationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

/**
 * Loads the policy rule manifest from JSON.
 * <p>
 * Format:
 * <pre>
 * {
 *   "blocked_patterns":    [{"id": "...", "pattern": "...", "default_action": "BLOCK", "notes": "..."}],
 *   "requires_validation": [{"id": "...", "pattern": "...", "notes": "..."}]
 * }
 * </pre>
 * A {@code default_action} of {@code REQUIRES_VALIDATION} inside {@code blocked_patterns}
 * demotes that entry to a validation rule.
 */
@Component
public class RuleManifestLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleManifestLoader.class);

    static final String BUNDLED_MANIFEST = "policy/blocked-manifest.json";

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Loads from {@code manifestPath} when set, otherwise from the bundled classpath manifest.
     *
     * @throws ConfigurationException if the manifest is missing, malformed or holds an invalid rule
     */
    public RuleManifest load(String manifestPath) {
        if (manifestPath == null || manifestPath.isBlank()) {
            return loadBundled();
        }
        Path path = Path.of(manifestPath);
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Policy manifest not found: " + manifestPath);
        }
        try (InputStream in = Files.newInputStream(path)) {
            RuleManifest manifest = parse(in, manifestPath);
            log.info("Loaded policy manifest from {}", manifestPath);
            return manifest;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read policy manifest " + manifestPath + ": " + e.getMessage(), e);
        }
    }

    public RuleManifest loadBundled() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(BUNDLED_MANIFEST)) {
            if (in == null) {
                throw new ConfigurationException("Bundled policy manifest missing from classpath: " + BUNDLED_MANIFEST);
            }
            return parse(in, BUNDLED_MANIFEST);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read bundled policy manifest: " + e.getMessage(), e);
        }
    }

    RuleManifest parse(InputStream in, String source) throws IOException {
        JsonNode root = mapper.readTree(in);
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Policy manifest " + source + " is not a JSON object");
        }
        List<ManifestRule> rules = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (JsonNode node : root.path("blocked_patterns")) {
            String declared = node.path("default_action").asText("BLOCK").toUpperCase(Locale.ROOT);
            RuleAction action = "REQUIRES_VALIDATION".equals(declared) ? RuleAction.REQUIRES_VALIDATION : RuleAction.BLOCK;
            rules.add(toRule(node, action, source, ids));
        }
        for (JsonNode node : root.path("requires_validation")) {
            rules.add(toRule(node, RuleAction.REQUIRES_VALIDATION, source, ids));
        }
        if (rules.isEmpty()) {
            log.warn("Policy manifest {} declares no rules; every action will be allowed", source);
        }
        log.debug("Policy manifest {}: {} rules", source, rules.size());
        return new RuleManifest(rules);
    }

    private ManifestRule toRule(JsonNode node, RuleAction action, String source, Set<String> ids) {
        String id = node.path("id").asText("");
        String regex = node.path("pattern").asText("");
        if (id.isBlank() || regex.isBlank()) {
            throw new ConfigurationException("Policy manifest " + source + " has a rule without id or pattern: " + node);
        }
        if (!ids.add(id)) {
            throw new ConfigurationException("Policy manifest " + source + " declares rule '" + id + "' twice");
        }
        try {
            return ManifestRule.of(id, regex, action, node.path("notes").asText(""));
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Policy manifest rule '" + id + "' has an invalid pattern: " + e.getMessage(), e);
        }
    }
}
