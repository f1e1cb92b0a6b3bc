package com.tts.resilience.cdi;

import com.tts.resilience.ResilienceCore;
import com.tts.resilience.breaker.CircuitBreakerConfig;
import com.tts.resilience.cache.CacheConfig;
import com.tts.resilience.cache.CacheManager;
import com.tts.resilience.degradation.DegradationController;
import com.tts.resilience.health.HealthCheckRegistry;
import com.tts.resilience.health.HealthConfig;
import com.tts.resilience.metrics.MicrometerMetricsService;
import com.tts.resilience.monitor.MonitorConfig;
import com.tts.resilience.monitor.PerformanceMonitor;
import com.tts.resilience.retry.RetryConfig;
import com.tts.resilience.warmup.WarmupConfig;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;

/**
 * CDI producer that wires the resilience core from MicroProfile Config properties.
 *
 * <p>Configuration is read once, when the core is produced:</p>
 * <pre>
 * tts-resilience:
 *   cache:
 *     voices:
 *       max-entries: 64
 *       max-bytes: 268435456
 *   breaker:
 *     failure-threshold: 5
 *     cooldown-seconds: 60
 *   retry:
 *     max-attempts: 3
 * </pre>
 *
 * <p>When a Micrometer {@link MeterRegistry} bean is available, metrics are recorded to it.
 * Produced beans are {@code @Singleton}: the core and its components are not proxyable.</p>
 */
@ApplicationScoped
public class ResilienceCoreProducer {

    private static final Logger log = LoggerFactory.getLogger(ResilienceCoreProducer.class);

    // ── Caches ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "tts-resilience.cache.voices.max-entries", defaultValue = "64")
    long voicesMaxEntries;

    @Inject
    @ConfigProperty(name = "tts-resilience.cache.voices.max-bytes", defaultValue = "268435456")
    long voicesMaxBytes;

    @Inject
    @ConfigProperty(name = "tts-resilience.cache.models.max-entries", defaultValue = "4")
    long modelsMaxEntries;

    @Inject
    @ConfigProperty(name = "tts-resilience.cache.models.max-bytes", defaultValue = "1073741824")
    long modelsMaxBytes;

    @Inject
    @ConfigProperty(name = "tts-resilience.cache.text.max-entries", defaultValue = "10000")
    long textMaxEntries;

    @Inject
    @ConfigProperty(name = "tts-resilience.cache.text.ttl-seconds", defaultValue = "3600")
    long textTtlSeconds;

    @Inject
    @ConfigProperty(name = "tts-resilience.cache.audio.max-bytes", defaultValue = "104857600")
    long audioMaxBytes;

    @Inject
    @ConfigProperty(name = "tts-resilience.cache.audio.ttl-seconds", defaultValue = "0")
    long audioTtlSeconds;

    @Inject
    @ConfigProperty(name = "tts-resilience.cache.audio.enabled", defaultValue = "true")
    boolean audioCacheEnabled;

    // ── Circuit breaker / retry ───────────────────────────────

    @Inject
    @ConfigProperty(name = "tts-resilience.breaker.failure-threshold", defaultValue = "5")
    int breakerFailureThreshold;

    @Inject
    @ConfigProperty(name = "tts-resilience.breaker.cooldown-seconds", defaultValue = "60")
    long breakerCooldownSeconds;

    @Inject
    @ConfigProperty(name = "tts-resilience.retry.max-attempts", defaultValue = "3")
    int retryMaxAttempts;

    @Inject
    @ConfigProperty(name = "tts-resilience.retry.base-delay-millis", defaultValue = "1000")
    long retryBaseDelayMillis;

    @Inject
    @ConfigProperty(name = "tts-resilience.retry.max-delay-millis", defaultValue = "60000")
    long retryMaxDelayMillis;

    @Inject
    @ConfigProperty(name = "tts-resilience.retry.jitter", defaultValue = "0.1")
    double retryJitter;

    // ── Warm-up / health / monitor ────────────────────────────

    @Inject
    @ConfigProperty(name = "tts-resilience.warmup.concurrency", defaultValue = "4")
    int warmupConcurrency;

    @Inject
    @ConfigProperty(name = "tts-resilience.warmup.queue-bound", defaultValue = "1000")
    int warmupQueueBound;

    @Inject
    @ConfigProperty(name = "tts-resilience.health.timeout-millis", defaultValue = "5000")
    long healthTimeoutMillis;

    @Inject
    @ConfigProperty(name = "tts-resilience.health.parallelism", defaultValue = "4")
    int healthParallelism;

    @Inject
    @ConfigProperty(name = "tts-resilience.health.min-interval-seconds", defaultValue = "0")
    long healthMinIntervalSeconds;

    @Inject
    @ConfigProperty(name = "tts-resilience.monitor.window-size", defaultValue = "1000")
    int monitorWindowSize;

    @Inject
    @ConfigProperty(name = "tts-resilience.start-on-produce", defaultValue = "true")
    boolean startOnProduce;

    @Inject
    Instance<MeterRegistry> meterRegistries;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @Singleton
    public ResilienceCore resilienceCore() {
        ResilienceCore.Builder builder = ResilienceCore.builder()
                .cache("voices", new CacheConfig(voicesMaxEntries, voicesMaxBytes, Duration.ZERO, true))
                .cache("models", new CacheConfig(modelsMaxEntries, modelsMaxBytes, Duration.ZERO, true))
                .cache("text", CacheConfig.ofEntries(textMaxEntries).withTtl(Duration.ofSeconds(textTtlSeconds)))
                .cache("audio", new CacheConfig(0, audioMaxBytes, Duration.ofSeconds(audioTtlSeconds),
                        audioCacheEnabled))
                .breakerDefaults(new CircuitBreakerConfig(breakerFailureThreshold,
                        Duration.ofSeconds(breakerCooldownSeconds)))
                .retry(new RetryConfig(retryMaxAttempts, Duration.ofMillis(retryBaseDelayMillis),
                        Duration.ofMillis(retryMaxDelayMillis), retryJitter, Set.of(RuntimeException.class)))
                .warmup(new WarmupConfig(warmupConcurrency, warmupQueueBound))
                .health(new HealthConfig(Duration.ofMillis(healthTimeoutMillis), healthParallelism,
                        Duration.ofSeconds(healthMinIntervalSeconds)))
                .monitor(new MonitorConfig(monitorWindowSize, MonitorConfig.defaults().maxTrackedArtifacts(),
                        MonitorConfig.defaults().artifactIdleExpiry()));

        if (meterRegistries != null && meterRegistries.isResolvable()) {
            builder.metrics(new MicrometerMetricsService(meterRegistries.get()));
            log.info("Micrometer metrics enabled");
        }

        ResilienceCore core = builder.build();
        if (startOnProduce) {
            core.start();
        }
        log.info("Produced ResilienceCore: breakerThreshold={} cooldown={}s retryAttempts={}",
                breakerFailureThreshold, breakerCooldownSeconds, retryMaxAttempts);
        return core;
    }

    public void closeCore(@Disposes ResilienceCore core) {
        log.info("Closing ResilienceCore");
        core.close();
    }

    @Produces
    @Singleton
    public CacheManager cacheManager(ResilienceCore core) {
        return core.cacheManager();
    }

    @Produces
    @Singleton
    public HealthCheckRegistry healthCheckRegistry(ResilienceCore core) {
        return core.health();
    }

    @Produces
    @Singleton
    public DegradationController degradationController(ResilienceCore core) {
        return core.degradation();
    }

    @Produces
    @Singleton
    public PerformanceMonitor performanceMonitor(ResilienceCore core) {
        return core.monitor();
    }
}
