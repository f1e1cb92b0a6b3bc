package com.tts.resilience.monitor;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One synthesis observation.
 *
 * @param timestamp      when the synthesis completed
 * @param latency        end-to-end latency
 * @param realTimeFactor synthesis time divided by produced audio duration (lower is better)
 * @param cacheHit       whether the response was served from cache
 * @param artifactId     the voice or model that produced it
 */
public record PerformanceSample(Instant timestamp, Duration latency, double realTimeFactor,
                                boolean cacheHit, String artifactId) {

    public PerformanceSample {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(latency, "latency");
        Objects.requireNonNull(artifactId, "artifactId");
        if (latency.isNegative()) {
            throw new IllegalArgumentException("latency must not be negative");
        }
        if (realTimeFactor < 0 || Double.isNaN(realTimeFactor)) {
            throw new IllegalArgumentException("realTimeFactor must be >= 0");
        }
    }

    public static PerformanceSample of(String artifactId, Duration latency, double realTimeFactor, boolean cacheHit) {
        return new PerformanceSample(Instant.now(), latency, realTimeFactor, cacheHit, artifactId);
    }
}
