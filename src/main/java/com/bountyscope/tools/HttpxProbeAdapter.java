package com.bountyscope.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Probes hosts with {@code httpx}; each output line starts with the live URL.
 */
@Component
public class HttpxProbeAdapter implements ProbeAdapter {

    private static final Logger log = LoggerFactory.getLogger(HttpxProbeAdapter.class);

    private final ToolRunner runner;
    private final ToolProperties properties;

    public HttpxProbeAdapter(ToolRunner runner, ToolProperties properties) {
        this.runner = runner;
        this.properties = properties;
    }

    @Override
    public List<String> probe(List<String> hosts) {
        if (hosts.isEmpty()) {
            return List.of();
        }
        log.info("Probing {} hosts for HTTP services", hosts.size());
        Path hostList = null;
        try {
            hostList = Files.createTempFile("bountyscope-hosts-", ".txt");
            Files.write(hostList, hosts);
            var result = runner.run(List.of(
                    properties.getHttpxBinary(),
                    "-l", hostList.toString(),
                    "-silent",
                    "-threads", String.valueOf(properties.getHttpxThreads()),
                    "-timeout", String.valueOf(properties.getRequestTimeout().toSeconds()),
                    "-no-color",
                    "-status-code",
                    "-title"), properties.getProbeTimeout());
            List<String> live = parseOutput(result.lines());
            log.info("Found {} live HTTP services", live.size());
            return live;
        } catch (ToolUnavailableException e) {
            log.warn("httpx not found, skipping HTTP probing: {}", e.getMessage());
            return List.of();
        } catch (IOException e) {
            log.warn("httpx probing failed: {}", e.getMessage());
            return List.of();
        } finally {
            if (hostList != null) {
                try {
                    Files.deleteIfExists(hostList);
                } catch (IOException e) {
                    log.debug("Could not delete temp file {}", hostList);
                }
            }
        }
    }

    static List<String> parseOutput(List<String> lines) {
        List<String> live = new ArrayList<>();
        for (String line : lines) {
            String url = line.split("\\s+")[0];
            HostSanitizer.sanitizeUrl(url).filter(u -> !live.contains(u)).ifPresent(live::add);
        }
        return live;
    }
}
