package com.tts.resilience;

import com.tts.resilience.breaker.CircuitBreakerConfig;
import com.tts.resilience.breaker.CircuitOpenException;
import com.tts.resilience.breaker.CircuitState;
import com.tts.resilience.cache.CacheConfig;
import com.tts.resilience.cache.LoadException;
import com.tts.resilience.cache.LoadedArtifact;
import com.tts.resilience.health.HealthReport;
import com.tts.resilience.retry.RetryConfig;
import com.tts.resilience.warmup.WarmupTask;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResilienceCore Tests")
class ResilienceCoreTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private MutableClock clock;
    private ResilienceCore core;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        core = ResilienceCore.builder()
                .clock(clock)
                .sleeper(sleeps::add)
                .cache("voices", CacheConfig.ofEntries(10))
                .cache("models", CacheConfig.ofBytes(1024))
                .breaker("voices", new CircuitBreakerConfig(2, Duration.ofSeconds(30)))
                .retry(new RetryConfig(3, Duration.ofMillis(100), Duration.ofSeconds(1), 0.0,
                        Set.of(RuntimeException.class)))
                .build();
    }

    @AfterEach
    void tearDown() {
        core.close();
    }

    @Nested
    @DisplayName("Serving path")
    class ServingTests {

        @Test
        @DisplayName("Should load once and then serve from cache")
        void loadsOnce() {
            AtomicInteger calls = new AtomicInteger();

            LoadedArtifact first = core.load("voices", "af_heart", key -> {
                calls.incrementAndGet();
                return LoadedArtifact.of(new byte[32]);
            });
            LoadedArtifact second = core.load("voices", "af_heart", key -> {
                calls.incrementAndGet();
                return LoadedArtifact.of(new byte[32]);
            });

            assertSame(first, second);
            assertEquals(1, calls.get());
            assertEquals(1, core.monitor().summary().cacheRates().get("voices").hits());
        }

        @Test
        @DisplayName("Should retry transient failures with backoff")
        void retriesTransientFailures() {
            AtomicInteger calls = new AtomicInteger();

            LoadedArtifact artifact = core.load("models", "kokoro", key -> {
                if (calls.incrementAndGet() < 3) {
                    throw new LoadException("download interrupted");
                }
                return LoadedArtifact.of(new byte[64]);
            });

            assertEquals(64, artifact.sizeEstimate());
            assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
        }

        @Test
        @DisplayName("Should open the cache's breaker and stop retrying")
        void opensBreaker() {
            AtomicInteger calls = new AtomicInteger();

            assertThrows(CircuitOpenException.class, () -> core.load("voices", "bf_emma", key -> {
                calls.incrementAndGet();
                throw new LoadException("voice store offline");
            }));

            assertEquals(2, calls.get());
            assertEquals(CircuitState.OPEN, core.breakers().breaker("voices").getState());
            assertEquals(CircuitState.CLOSED, core.breakers().breaker("models").getState());
        }
    }

    @Nested
    @DisplayName("Wiring")
    class WiringTests {

        @Test
        @DisplayName("Should register the default health checks")
        void defaultHealthChecks() {
            assertEquals(List.of("memory", "caches", "circuitBreakers"), core.health().names());

            HealthReport report = core.health().runAll();
            assertEquals(3, report.checks().size());
        }

        @Test
        @DisplayName("An open breaker should degrade health")
        void openBreakerDegradesHealth() {
            assertThrows(CircuitOpenException.class, () -> core.load("voices", "bf_emma", key -> {
                throw new LoadException("voice store offline");
            }));

            assertTrue(core.health().run("circuitBreakers").isDegraded());
        }

        @Test
        @DisplayName("Should skip default health checks when asked")
        void noDefaultHealthChecks() {
            try (ResilienceCore bare = ResilienceCore.builder()
                    .cache("voices", CacheConfig.ofEntries(1))
                    .defaultHealthChecks(false)
                    .build()) {
                assertEquals(0, bare.health().size());
            }
        }

        @Test
        @DisplayName("Should reject a cache configured twice")
        void rejectsDuplicateCache() {
            assertThrows(IllegalArgumentException.class, () -> ResilienceCore.builder()
                    .cache("voices", CacheConfig.ofEntries(1))
                    .cache("voices", CacheConfig.ofEntries(2)));
        }

        @Test
        @DisplayName("Warm-up should run once started")
        void warmupRunsAfterStart() throws InterruptedException {
            core.start();
            core.warmup().schedule(WarmupTask.of("voices", "af_heart", key -> LoadedArtifact.of(new byte[8]), 10));

            assertTrue(core.warmup().awaitIdle(Duration.ofSeconds(10)));
            assertTrue(core.cacheManager().cache("voices").peek("af_heart").hit());
            assertTrue(core.watcher().isRunning());
        }

        @Test
        @DisplayName("Breaker listener should drive component degradation")
        void breakerDrivesDegradation() {
            core.breakers().addListener(core.degradation().breakerListener("voice-store"));

            assertThrows(CircuitOpenException.class, () -> core.load("voices", "bf_emma", key -> {
                throw new LoadException("voice store offline");
            }));

            assertFalse(core.degradation().isHealthy("voice-store"));
        }
    }
}
