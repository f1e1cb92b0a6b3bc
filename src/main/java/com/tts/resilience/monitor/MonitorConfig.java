package com.tts.resilience.monitor;

import java.time.Duration;

/**
 * Configuration for {@link PerformanceMonitor}.
 *
 * @param windowSize          number of most recent samples kept for aggregation
 * @param maxTrackedArtifacts maximum number of artifact ids with lifetime counters
 * @param artifactIdleExpiry  lifetime counters for an artifact unseen this long are dropped
 */
public record MonitorConfig(int windowSize, int maxTrackedArtifacts, Duration artifactIdleExpiry) {

    public MonitorConfig {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be > 0");
        }
        if (maxTrackedArtifacts <= 0) {
            throw new IllegalArgumentException("maxTrackedArtifacts must be > 0");
        }
        if (artifactIdleExpiry == null || artifactIdleExpiry.isNegative() || artifactIdleExpiry.isZero()) {
            throw new IllegalArgumentException("artifactIdleExpiry must be positive");
        }
    }

    /**
     * Default configuration: 1,000 samples, 500 artifacts, 1h idle expiry.
     */
    public static MonitorConfig defaults() {
        return new MonitorConfig(1_000, 500, Duration.ofHours(1));
    }
}
