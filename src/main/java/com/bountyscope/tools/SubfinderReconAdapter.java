package com.bountyscope.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class SubfinderReconAdapter implements ReconAdapter {

    private static final Logger log = LoggerFactory.getLogger(SubfinderReconAdapter.class);

    private final ToolRunner runner;
    private final ToolProperties properties;

    public SubfinderReconAdapter(ToolRunner runner, ToolProperties properties) {
        this.runner = runner;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "subfinder";
    }

    @Override
    public List<String> enumerate(String domain) {
        try {
            var result = runner.run(List.of(properties.getSubfinderBinary(), "-d", domain, "-silent", "-all"),
                    properties.getReconTimeout());
            if (!result.succeeded()) {
                log.warn("subfinder did not complete for {} (exit {}, timed out: {})",
                        domain, result.exitCode(), result.timedOut());
            }
            List<String> found = result.lines().stream()
                    .map(HostSanitizer::sanitizeDomain)
                    .flatMap(Optional::stream)
                    .distinct()
                    .toList();
            log.info("subfinder found {} subdomains for {}", found.size(), domain);
            return found;
        } catch (ToolUnavailableException e) {
            log.warn("subfinder not found, skipping: {}", e.getMessage());
            return List.of();
        }
    }
}
