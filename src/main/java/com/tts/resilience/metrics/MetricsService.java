package com.tts.resilience.metrics;

import java.time.Duration;

/**
 * Interface for recording cache and resilience metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the core works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordCacheHit(String cacheName);

    void recordCacheMiss(String cacheName);

    void recordEvictions(String cacheName, int count);

    void recordLoad(String cacheName, Duration duration, boolean success);

    void recordRetry(String operation, int attempt);

    void recordCircuitTransition(String breakerName, String fromState, String toState);

    void recordWarmupTask(String cacheName, String outcome);

    void recordReload(String targetName, boolean success);

    void recordSynthesis(String artifactId, Duration latency, double realTimeFactor);
}
