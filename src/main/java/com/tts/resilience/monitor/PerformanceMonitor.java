package com.tts.resilience.monitor;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tts.resilience.metrics.MetricsService;
import com.tts.resilience.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rolling collector of synthesis samples and cache hit/miss counters.
 *
 * <p>The window is count-bounded: once it holds {@link MonitorConfig#windowSize()} samples,
 * each new sample drops the oldest. {@link #summary()} copies the window under the lock and
 * aggregates outside it, so readers never block writers for long.</p>
 *
 * <p>Lifetime per-artifact counters are held in a size-bounded Caffeine cache so a
 * stream of one-off artifact ids cannot grow the monitor without limit.</p>
 */
public class PerformanceMonitor {
    private static final Logger log = LoggerFactory.getLogger(PerformanceMonitor.class);

    private final MonitorConfig config;
    private final MetricsService metrics;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<PerformanceSample> window;
    private final Cache<String, AtomicLong> lifetimeSamples;
    private final ConcurrentMap<String, CacheCounters> cacheCounters = new ConcurrentHashMap<>();

    private long totalSamples;
    private Instant startedAt;

    public PerformanceMonitor() {
        this(MonitorConfig.defaults(), new NoOpMetricsService(), Clock.systemUTC());
    }

    public PerformanceMonitor(MonitorConfig config, MetricsService metrics) {
        this(config, metrics, Clock.systemUTC());
    }

    public PerformanceMonitor(MonitorConfig config, MetricsService metrics, Clock clock) {
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
        this.window = new ArrayDeque<>(Math.min(config.windowSize(), 4096));
        this.lifetimeSamples = Caffeine.newBuilder()
                .maximumSize(config.maxTrackedArtifacts())
                .expireAfterAccess(config.artifactIdleExpiry())
                .build();
        this.startedAt = clock.instant();
        log.info("PerformanceMonitor initialized: windowSize={}, maxTrackedArtifacts={}",
                config.windowSize(), config.maxTrackedArtifacts());
    }

    /**
     * Appends a sample to the rolling window.
     */
    public void record(PerformanceSample sample) {
        lock.lock();
        try {
            window.addLast(sample);
            while (window.size() > config.windowSize()) {
                window.pollFirst();
            }
            totalSamples++;
        } finally {
            lock.unlock();
        }
        lifetimeSamples.get(sample.artifactId(), id -> new AtomicLong()).incrementAndGet();
        metrics.recordSynthesis(sample.artifactId(), sample.latency(), sample.realTimeFactor());
    }

    public void recordCacheHit(String cacheName) {
        cacheCounters.computeIfAbsent(cacheName, n -> new CacheCounters()).hits.incrementAndGet();
    }

    public void recordCacheMiss(String cacheName) {
        cacheCounters.computeIfAbsent(cacheName, n -> new CacheCounters()).misses.incrementAndGet();
    }

    /**
     * Returns a consistent snapshot of the window and counters.
     */
    public PerformanceSummary summary() {
        List<PerformanceSample> snapshot;
        long total;
        Instant since;
        lock.lock();
        try {
            snapshot = new ArrayList<>(window);
            total = totalSamples;
            since = startedAt;
        } finally {
            lock.unlock();
        }

        Map<String, List<PerformanceSample>> byArtifact = new HashMap<>();
        for (PerformanceSample sample : snapshot) {
            byArtifact.computeIfAbsent(sample.artifactId(), id -> new ArrayList<>()).add(sample);
        }
        Map<String, LatencyStats> perArtifact = new HashMap<>();
        byArtifact.forEach((id, samples) -> perArtifact.put(id, LatencyStats.of(samples)));

        Map<String, Long> lifetime = new HashMap<>();
        lifetimeSamples.asMap().forEach((id, count) -> lifetime.put(id, count.get()));

        Map<String, CacheRates> rates = new HashMap<>();
        cacheCounters.forEach((name, c) -> rates.put(name, new CacheRates(c.hits.get(), c.misses.get())));

        Instant now = clock.instant();
        return new PerformanceSummary(now, Duration.between(since, now), total, snapshot.size(),
                LatencyStats.of(snapshot), perArtifact, lifetime, rates);
    }

    /**
     * Clears the window and all counters.
     */
    public void reset() {
        lock.lock();
        try {
            window.clear();
            totalSamples = 0;
            startedAt = clock.instant();
        } finally {
            lock.unlock();
        }
        lifetimeSamples.invalidateAll();
        cacheCounters.clear();
        log.info("PerformanceMonitor reset");
    }

    private static final class CacheCounters {
        final AtomicLong hits = new AtomicLong();
        final AtomicLong misses = new AtomicLong();
    }
}
