package com.bountyscope.core.advisory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "bounty.advisory")
public class AdvisoryProperties {

    private boolean enabled = false;
    /** Also feeds {@code spring.ai.retry.*}, which retries inside the chat model. */
    private int maxAttempts = 3;
    private Duration initialBackoff = Duration.ofSeconds(2);
    private Duration maxBackoff = Duration.ofSeconds(10);
    /** Persist every prompt/response pair through the scan store. */
    private boolean storeResponses = true;
    private int requestsPerMinute = 30;
    private int maxConcurrency = 2;
    private int maxScopePatterns = 20;
    private int maxFieldLength = 500;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    public boolean isStoreResponses() {
        return storeResponses;
    }

    public void setStoreResponses(boolean storeResponses) {
        this.storeResponses = storeResponses;
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

    public int getMaxScopePatterns() {
        return maxScopePatterns;
    }

    public void setMaxScopePatterns(int maxScopePatterns) {
        this.maxScopePatterns = maxScopePatterns;
    }

    public int getMaxFieldLength() {
        return maxFieldLength;
    }

    public void setMaxFieldLength(int maxFieldLength) {
        this.maxFieldLength = maxFieldLength;
    }
}
