package com.bountyscope.tools;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "bounty.tools")
public class ToolProperties {

    private String subfinderBinary = "subfinder";
    private String httpxBinary = "httpx";
    private String nucleiBinary = "nuclei";
    private String niktoBinary = "nikto";

    /** Adds nikto as a second scanner; off by default. */
    private boolean niktoEnabled = false;
    /** Nikto -Tuning classes: interesting files, misconfiguration, information disclosure. */
    private String niktoTuning = "123";
    private Duration niktoMaxTime = Duration.ofMinutes(5);

    /** Per-request timeout handed to the external tools. */
    private Duration requestTimeout = Duration.ofSeconds(20);
    private Duration reconTimeout = Duration.ofSeconds(60);
    private Duration probeTimeout = Duration.ofSeconds(120);
    private Duration scanTimeout = Duration.ofSeconds(120);

    private int httpxThreads = 10;
    private int nucleiRateLimit = 5;
    /** Template ids or paths; each becomes its own policy-checked action. Empty runs nuclei's defaults. */
    private List<String> nucleiTemplates = new ArrayList<>();
    private List<String> safeSeverities = new ArrayList<>(List.of("low", "medium"));
    private List<String> fullSeverities = new ArrayList<>(List.of("low", "medium", "high", "critical"));

    private Duration crawlerDelay = Duration.ofMillis(500);
    private int crawlerMaxDepth = 3;
    private int crawlerMaxPages = 50;
    private int crawlerMaxLinksPerPage = 20;
    private String userAgent = "Mozilla/5.0 (Security Research Bot)";

    public String getSubfinderBinary() {
        return subfinderBinary;
    }

    public void setSubfinderBinary(String subfinderBinary) {
        this.subfinderBinary = subfinderBinary;
    }

    public String getHttpxBinary() {
        return httpxBinary;
    }

    public void setHttpxBinary(String httpxBinary) {
        this.httpxBinary = httpxBinary;
    }

    public String getNucleiBinary() {
        return nucleiBinary;
    }

    public void setNucleiBinary(String nucleiBinary) {
        this.nucleiBinary = nucleiBinary;
    }

    public String getNiktoBinary() {
        return niktoBinary;
    }

    public void setNiktoBinary(String niktoBinary) {
        this.niktoBinary = niktoBinary;
    }

    public boolean isNiktoEnabled() {
        return niktoEnabled;
    }

    public void setNiktoEnabled(boolean niktoEnabled) {
        this.niktoEnabled = niktoEnabled;
    }

    public String getNiktoTuning() {
        return niktoTuning;
    }

    public void setNiktoTuning(String niktoTuning) {
        this.niktoTuning = niktoTuning;
    }

    public Duration getNiktoMaxTime() {
        return niktoMaxTime;
    }

    public void setNiktoMaxTime(Duration niktoMaxTime) {
        this.niktoMaxTime = niktoMaxTime;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getReconTimeout() {
        return reconTimeout;
    }

    public void setReconTimeout(Duration reconTimeout) {
        this.reconTimeout = reconTimeout;
    }

    public Duration getProbeTimeout() {
        return probeTimeout;
    }

    public void setProbeTimeout(Duration probeTimeout) {
        this.probeTimeout = probeTimeout;
    }

    public Duration getScanTimeout() {
        return scanTimeout;
    }

    public void setScanTimeout(Duration scanTimeout) {
        this.scanTimeout = scanTimeout;
    }

    public int getHttpxThreads() {
        return httpxThreads;
    }

    public void setHttpxThreads(int httpxThreads) {
        this.httpxThreads = httpxThreads;
    }

    public int getNucleiRateLimit() {
        return nucleiRateLimit;
    }

    public void setNucleiRateLimit(int nucleiRateLimit) {
        this.nucleiRateLimit = nucleiRateLimit;
    }

    public List<String> getNucleiTemplates() {
        return nucleiTemplates;
    }

    public void setNucleiTemplates(List<String> nucleiTemplates) {
        this.nucleiTemplates = nucleiTemplates;
    }

    public List<String> getSafeSeverities() {
        return safeSeverities;
    }

    public void setSafeSeverities(List<String> safeSeverities) {
        this.safeSeverities = safeSeverities;
    }

    public List<String> getFullSeverities() {
        return fullSeverities;
    }

    public void setFullSeverities(List<String> fullSeverities) {
        this.fullSeverities = fullSeverities;
    }

    public Duration getCrawlerDelay() {
        return crawlerDelay;
    }

    public void setCrawlerDelay(Duration crawlerDelay) {
        this.crawlerDelay = crawlerDelay;
    }

    public int getCrawlerMaxDepth() {
        return crawlerMaxDepth;
    }

    public void setCrawlerMaxDepth(int crawlerMaxDepth) {
        this.crawlerMaxDepth = crawlerMaxDepth;
    }

    public int getCrawlerMaxPages() {
        return crawlerMaxPages;
    }

    public void setCrawlerMaxPages(int crawlerMaxPages) {
        this.crawlerMaxPages = crawlerMaxPages;
    }

    public int getCrawlerMaxLinksPerPage() {
        return crawlerMaxLinksPerPage;
    }

    public void setCrawlerMaxLinksPerPage(int crawlerMaxLinksPerPage) {
        this.crawlerMaxLinksPerPage = crawlerMaxLinksPerPage;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }
}
