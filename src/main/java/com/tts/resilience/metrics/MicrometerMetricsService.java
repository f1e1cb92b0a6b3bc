package com.tts.resilience.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code tts.cache.hit} / {@code tts.cache.miss}: Counter (tag: cache)</li>
 *   <li>{@code tts.cache.evictions}: Counter (tag: cache)</li>
 *   <li>{@code tts.load.duration}: Timer (tags: cache, outcome)</li>
 *   <li>{@code tts.retry.attempts}: Counter (tag: operation)</li>
 *   <li>{@code tts.circuit.transitions}: Counter (tags: breaker, from, to)</li>
 *   <li>{@code tts.warmup.tasks}: Counter (tags: cache, outcome)</li>
 *   <li>{@code tts.reload}: Counter (tags: target, outcome)</li>
 *   <li>{@code tts.synthesis.latency}: Timer (tag: artifact)</li>
 *   <li>{@code tts.synthesis.rtf}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final DistributionSummary rtfSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.rtfSummary = DistributionSummary.builder("tts.synthesis.rtf")
                .description("Synthesis time divided by produced audio duration")
                .register(registry);
    }

    @Override
    public void recordCacheHit(String cacheName) {
        counter("tts.cache.hit", "Artifact cache hits", "cache", cacheName).increment();
    }

    @Override
    public void recordCacheMiss(String cacheName) {
        counter("tts.cache.miss", "Artifact cache misses", "cache", cacheName).increment();
    }

    @Override
    public void recordEvictions(String cacheName, int count) {
        if (count > 0) {
            counter("tts.cache.evictions", "Entries evicted by capacity bounds", "cache", cacheName)
                    .increment(count);
        }
    }

    @Override
    public void recordLoad(String cacheName, Duration duration, boolean success) {
        String outcome = success ? "success" : "failure";
        Timer timer = timerCache.computeIfAbsent("load:" + cacheName + ":" + outcome, k ->
                Timer.builder("tts.load.duration")
                        .description("Duration of artifact loads on cache miss")
                        .tag("cache", cacheName)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordRetry(String operation, int attempt) {
        counter("tts.retry.attempts", "Retried attempts after a retryable failure", "operation", operation)
                .increment();
    }

    @Override
    public void recordCircuitTransition(String breakerName, String fromState, String toState) {
        String key = "circuit:" + breakerName + ":" + fromState + ":" + toState;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("tts.circuit.transitions")
                        .description("Circuit breaker state transitions")
                        .tag("breaker", breakerName)
                        .tag("from", fromState)
                        .tag("to", toState)
                        .register(registry))
                .increment();
    }

    @Override
    public void recordWarmupTask(String cacheName, String outcome) {
        String key = "warmup:" + cacheName + ":" + outcome;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("tts.warmup.tasks")
                        .description("Warm-up tasks by outcome")
                        .tag("cache", cacheName)
                        .tag("outcome", outcome)
                        .register(registry))
                .increment();
    }

    @Override
    public void recordReload(String targetName, boolean success) {
        String outcome = success ? "success" : "failure";
        String key = "reload:" + targetName + ":" + outcome;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("tts.reload")
                        .description("Hot reload firings by outcome")
                        .tag("target", targetName)
                        .tag("outcome", outcome)
                        .register(registry))
                .increment();
    }

    @Override
    public void recordSynthesis(String artifactId, Duration latency, double realTimeFactor) {
        Timer timer = timerCache.computeIfAbsent("synthesis:" + artifactId, k ->
                Timer.builder("tts.synthesis.latency")
                        .description("End-to-end synthesis latency")
                        .tag("artifact", artifactId)
                        .register(registry));
        timer.record(latency);
        rtfSummary.record(realTimeFactor);
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
