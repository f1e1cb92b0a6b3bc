package com.tts.resilience;

import com.tts.resilience.breaker.CircuitBreakerConfig;
import com.tts.resilience.breaker.CircuitBreakerRegistry;
import com.tts.resilience.cache.ArtifactLoader;
import com.tts.resilience.cache.CacheConfig;
import com.tts.resilience.cache.CacheManager;
import com.tts.resilience.cache.LoadedArtifact;
import com.tts.resilience.cache.ResilientLoader;
import com.tts.resilience.degradation.DegradationController;
import com.tts.resilience.health.CacheHealthCheck;
import com.tts.resilience.health.CircuitBreakerHealthCheck;
import com.tts.resilience.health.HealthCheckRegistry;
import com.tts.resilience.health.HealthConfig;
import com.tts.resilience.health.MemoryHealthCheck;
import com.tts.resilience.metrics.MetricsService;
import com.tts.resilience.metrics.NoOpMetricsService;
import com.tts.resilience.monitor.MonitorConfig;
import com.tts.resilience.monitor.PerformanceMonitor;
import com.tts.resilience.reload.FileChangeSource;
import com.tts.resilience.reload.HotReloadWatcher;
import com.tts.resilience.reload.WatchServiceChangeSource;
import com.tts.resilience.retry.RetryConfig;
import com.tts.resilience.retry.RetryPolicy;
import com.tts.resilience.retry.Sleeper;
import com.tts.resilience.tracing.NoOpTracingService;
import com.tts.resilience.tracing.TracingService;
import com.tts.resilience.warmup.WarmupConfig;
import com.tts.resilience.warmup.WarmupScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Composition root for the cache-and-resilience layer.
 *
 * <p>Build one instance at process start and pass it (or the components it exposes) to
 * every consumer. There is no static accessor; tests build their own instance.</p>
 *
 * <pre>
 * try (ResilienceCore core = ResilienceCore.builder()
 *         .cache("voices", CacheConfig.ofBytes(256L * 1024 * 1024))
 *         .build()) {
 *     core.start();
 *     LoadedArtifact voice = core.load("voices", "af_heart", voiceLoader);
 * }
 * </pre>
 */
public class ResilienceCore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResilienceCore.class);

    private final MetricsService metrics;
    private final TracingService tracing;
    private final PerformanceMonitor monitor;
    private final CacheManager cacheManager;
    private final CircuitBreakerRegistry breakers;
    private final RetryPolicy retryPolicy;
    private final HealthCheckRegistry health;
    private final DegradationController degradation;
    private final WarmupScheduler warmup;
    private final HotReloadWatcher watcher;

    private ResilienceCore(Builder builder) {
        this.metrics = builder.metrics;
        this.tracing = builder.tracing;
        this.monitor = new PerformanceMonitor(builder.monitorConfig, metrics, builder.clock);
        this.cacheManager = new CacheManager(monitor, metrics, tracing);
        builder.caches.forEach(cacheManager::register);
        this.breakers = new CircuitBreakerRegistry(builder.breakerDefaults, builder.breakerOverrides,
                metrics, builder.clock);
        this.retryPolicy = new RetryPolicy(builder.retryConfig, builder.sleeper, metrics);
        this.health = new HealthCheckRegistry(builder.healthConfig, builder.clock);
        this.degradation = new DegradationController(builder.clock);
        this.warmup = new WarmupScheduler(builder.warmupConfig, cacheManager, retryPolicy, breakers, metrics);
        this.watcher = new HotReloadWatcher(cacheManager, builder.changeSource, metrics, tracing, builder.clock);
        if (builder.defaultHealthChecks) {
            health.register(new MemoryHealthCheck());
            health.register(new CacheHealthCheck(cacheManager));
            health.register(new CircuitBreakerHealthCheck(breakers));
        }
        log.info("ResilienceCore built: caches={}, warmupConcurrency={}, healthChecks={}",
                cacheManager.cacheNames(), builder.warmupConfig.concurrency(), health.size());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the warm-up workers and the file watcher.
     */
    public void start() {
        warmup.start();
        watcher.start();
        log.info("ResilienceCore started");
    }

    /**
     * Cache-aside load on the serving path: single-flight through the cache manager, with the
     * loader wrapped in the shared retry policy and the breaker named after the cache.
     */
    public LoadedArtifact load(String cacheName, String key, ArtifactLoader loader) {
        return cacheManager.getOrLoad(cacheName, key, resilient(cacheName, loader));
    }

    /**
     * Wraps a loader as {@code retry(breaker(load))} using the breaker for {@code kind}.
     */
    public ResilientLoader resilient(String kind, ArtifactLoader loader) {
        return new ResilientLoader(kind, loader, retryPolicy, breakers.breaker(kind));
    }

    public MetricsService metrics() { return metrics; }
    public TracingService tracing() { return tracing; }
    public PerformanceMonitor monitor() { return monitor; }
    public CacheManager cacheManager() { return cacheManager; }
    public CircuitBreakerRegistry breakers() { return breakers; }
    public RetryPolicy retryPolicy() { return retryPolicy; }
    public HealthCheckRegistry health() { return health; }
    public DegradationController degradation() { return degradation; }
    public WarmupScheduler warmup() { return warmup; }
    public HotReloadWatcher watcher() { return watcher; }

    /**
     * Stops warm-up (cancelling its loads), the watcher and health probes, then cancels any
     * remaining in-flight loads.
     */
    @Override
    public void close() {
        warmup.shutdownNow();
        watcher.close();
        health.close();
        cacheManager.close();
        log.info("ResilienceCore closed");
    }

    public static class Builder {
        private MetricsService metrics = new NoOpMetricsService();
        private TracingService tracing = new NoOpTracingService();
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.THREAD;
        private final Map<String, CacheConfig> caches = new LinkedHashMap<>();
        private CircuitBreakerConfig breakerDefaults = CircuitBreakerConfig.defaults();
        private final Map<String, CircuitBreakerConfig> breakerOverrides = new LinkedHashMap<>();
        private RetryConfig retryConfig = RetryConfig.defaults();
        private WarmupConfig warmupConfig = WarmupConfig.defaults();
        private HealthConfig healthConfig = HealthConfig.defaults();
        private MonitorConfig monitorConfig = MonitorConfig.defaults();
        private FileChangeSource changeSource = new WatchServiceChangeSource();
        private boolean defaultHealthChecks = true;

        private Builder() {
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracing(TracingService tracing) {
            this.tracing = tracing;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder cache(String name, CacheConfig config) {
            if (caches.putIfAbsent(name, config) != null) {
                throw new IllegalArgumentException("Cache configured twice: " + name);
            }
            return this;
        }

        public Builder breakerDefaults(CircuitBreakerConfig config) {
            this.breakerDefaults = config;
            return this;
        }

        /**
         * Overrides the breaker configuration for one operation kind.
         */
        public Builder breaker(String kind, CircuitBreakerConfig config) {
            this.breakerOverrides.put(kind, config);
            return this;
        }

        public Builder retry(RetryConfig config) {
            this.retryConfig = config;
            return this;
        }

        public Builder warmup(WarmupConfig config) {
            this.warmupConfig = config;
            return this;
        }

        public Builder health(HealthConfig config) {
            this.healthConfig = config;
            return this;
        }

        public Builder monitor(MonitorConfig config) {
            this.monitorConfig = config;
            return this;
        }

        public Builder changeSource(FileChangeSource changeSource) {
            this.changeSource = changeSource;
            return this;
        }

        /**
         * Whether to register the memory, cache and breaker health checks. Default true.
         */
        public Builder defaultHealthChecks(boolean enabled) {
            this.defaultHealthChecks = enabled;
            return this;
        }

        public ResilienceCore build() {
            return new ResilienceCore(this);
        }
    }
}
