package com.tts.resilience.monitor;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Read-only snapshot returned by {@link PerformanceMonitor#summary()}.
 *
 * @param generatedAt       when the snapshot was taken
 * @param uptime            time since the monitor was created or last reset
 * @param totalSamples      samples recorded since creation or reset, including those no longer in the window
 * @param windowSize        samples currently in the window
 * @param overall           aggregates over the window
 * @param perArtifact       aggregates over the window, per artifact id
 * @param lifetimeSamples   total samples per artifact id still being tracked
 * @param cacheRates        hit/miss counters per cache name
 */
public record PerformanceSummary(Instant generatedAt,
                                 Duration uptime,
                                 long totalSamples,
                                 int windowSize,
                                 LatencyStats overall,
                                 Map<String, LatencyStats> perArtifact,
                                 Map<String, Long> lifetimeSamples,
                                 Map<String, CacheRates> cacheRates) {

    public PerformanceSummary {
        perArtifact = Map.copyOf(perArtifact);
        lifetimeSamples = Map.copyOf(lifetimeSamples);
        cacheRates = Map.copyOf(cacheRates);
    }
}
