package com.bountyscope.core.model;

import com.bountyscope.core.config.ConfigurationException;

import java.io.Serializable;
import java.time.Duration;

/**
 * Throughput and concurrency ceiling for one rate-limited subsystem.
 */
public record RateBudget(int requestsPerMinute, int maxConcurrency) implements Serializable {

    static final int MAX_REQUESTS_PER_MINUTE = 100;
    static final int MAX_CONCURRENCY = 20;

    public RateBudget {
        if (requestsPerMinute < 1 || requestsPerMinute > MAX_REQUESTS_PER_MINUTE) {
            throw new ConfigurationException("requests-per-minute must be between 1 and "
                    + MAX_REQUESTS_PER_MINUTE + " (was " + requestsPerMinute + ")");
        }
        if (maxConcurrency < 1 || maxConcurrency > MAX_CONCURRENCY) {
            throw new ConfigurationException("max-concurrency must be between 1 and "
                    + MAX_CONCURRENCY + " (was " + maxConcurrency + ")");
        }
    }

    /** Minimum spacing between two successive grants. */
    public Duration interval() {
        return Duration.ofNanos(60_000_000_000L / requestsPerMinute);
    }
}
