package com.bountyscope.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "bounty.pipeline")
public class PipelineProperties {

    private String outputDir = "./outputs";
    private Duration runTimeout = Duration.ofMinutes(30);
    /** Scan limiter budget, shared by all scan workers of the process. */
    private int requestsPerMinute = 5;
    private int maxConcurrency = 4;
    private boolean writeArtifacts = true;
    private final Crawl crawl = new Crawl();

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public Duration getRunTimeout() {
        return runTimeout;
    }

    public void setRunTimeout(Duration runTimeout) {
        this.runTimeout = runTimeout;
    }

    public int getRequestsPerMinute() {
        return requestsPerMinute;
    }

    public void setRequestsPerMinute(int requestsPerMinute) {
        this.requestsPerMinute = requestsPerMinute;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public boolean isWriteArtifacts() {
        return writeArtifacts;
    }

    public void setWriteArtifacts(boolean writeArtifacts) {
        this.writeArtifacts = writeArtifacts;
    }

    public Crawl getCrawl() {
        return crawl;
    }

    public static class Crawl {

        private int maxSeedHosts = 5;

        public int getMaxSeedHosts() {
            return maxSeedHosts;
        }

        public void setMaxSeedHosts(int maxSeedHosts) {
            this.maxSeedHosts = maxSeedHosts;
        }
    }
}
