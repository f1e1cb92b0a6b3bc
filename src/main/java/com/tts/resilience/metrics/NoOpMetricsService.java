package com.tts.resilience.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCacheHit(String cacheName) {
    }

    @Override
    public void recordCacheMiss(String cacheName) {
    }

    @Override
    public void recordEvictions(String cacheName, int count) {
    }

    @Override
    public void recordLoad(String cacheName, Duration duration, boolean success) {
    }

    @Override
    public void recordRetry(String operation, int attempt) {
    }

    @Override
    public void recordCircuitTransition(String breakerName, String fromState, String toState) {
    }

    @Override
    public void recordWarmupTask(String cacheName, String outcome) {
    }

    @Override
    public void recordReload(String targetName, boolean success) {
    }

    @Override
    public void recordSynthesis(String artifactId, Duration latency, double realTimeFactor) {
    }
}
