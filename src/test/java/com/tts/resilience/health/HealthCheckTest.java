package com.tts.resilience.health;

import com.tts.resilience.MutableClock;
import com.tts.resilience.breaker.CircuitBreakerConfig;
import com.tts.resilience.breaker.CircuitBreakerRegistry;
import com.tts.resilience.cache.CacheConfig;
import com.tts.resilience.cache.CacheManager;
import com.tts.resilience.cache.LoadedArtifact;
import com.tts.resilience.metrics.NoOpMetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("up() should create UP status")
        void upFactory() {
            HealthStatus status = HealthStatus.up();
            assertTrue(status.isUp());
            assertTrue(status.isHealthy());
            assertFalse(status.isDown());
            assertEquals("OK", status.message());
        }

        @Test
        @DisplayName("degraded() should still count as healthy")
        void degradedIsHealthy() {
            HealthStatus status = HealthStatus.degraded("High memory usage");
            assertTrue(status.isDegraded());
            assertTrue(status.isHealthy());
            assertEquals("High memory usage", status.message());
        }

        @Test
        @DisplayName("timedOut() should be DOWN and flagged")
        void timedOutFactory() {
            HealthStatus status = HealthStatus.timedOut(Duration.ofSeconds(5));
            assertTrue(status.isDown());
            assertFalse(status.isHealthy());
            assertTrue(status.isTimedOut());
            assertTrue(status.message().contains("5000ms"));
        }

        @Test
        @DisplayName("withDetail() should preserve existing details and timestamp")
        void withDetailPreservesExisting() {
            Instant at = Instant.parse("2024-01-01T00:00:00Z");
            HealthStatus status = HealthStatus.up().withCheckedAt(at)
                    .withDetail("key1", "value1")
                    .withDetail("key2", 2L);

            assertEquals(2, status.details().size());
            assertEquals("value1", status.details().get("key1"));
            assertEquals(2L, status.details().get("key2"));
            assertEquals(at, status.checkedAt());
        }

        @Test
        @DisplayName("details should be immutable")
        void detailsImmutable() {
            HealthStatus status = HealthStatus.up().withDetail("key", "value");
            assertThrows(UnsupportedOperationException.class,
                    () -> status.details().put("another", "value"));
        }

        @Test
        @DisplayName("Report should take the worst status")
        void reportTakesWorst() {
            HealthReport degraded = HealthReport.of(Map.of(
                    "a", HealthStatus.up(), "b", HealthStatus.degraded("slow")), Instant.now());
            assertTrue(degraded.healthy());
            assertEquals(HealthStatus.Status.DEGRADED, degraded.status());

            HealthReport down = HealthReport.of(Map.of(
                    "a", HealthStatus.degraded("slow"), "b", HealthStatus.down("gone")), Instant.now());
            assertFalse(down.healthy());
            assertEquals(HealthStatus.Status.DOWN, down.status());

            HealthReport empty = HealthReport.of(Map.of(), Instant.now());
            assertTrue(empty.healthy());
            assertEquals(HealthStatus.Status.UP, empty.status());
        }
    }

    @Nested
    @DisplayName("MemoryHealthCheck")
    class MemoryHealthCheckTests {

        @Test
        @DisplayName("Should report heap details")
        void shouldReportHeap() {
            MemoryHealthCheck check = new MemoryHealthCheck();
            HealthStatus status = check.check();

            // In test conditions, heap should not be exhausted
            assertTrue(status.isUp() || status.isDegraded(),
                    "Expected UP or DEGRADED, got: " + status.status());
            assertEquals("memory", check.getName());
            assertTrue(status.details().containsKey("heapUsedMB"));
            assertTrue(status.details().containsKey("heapMaxMB"));
            assertTrue(status.details().containsKey("heapUsagePercent"));
        }

        @Test
        @DisplayName("Should classify usage against thresholds")
        void shouldClassifyUsage() {
            MemoryHealthCheck check = new MemoryHealthCheck(0.80, 0.90);
            assertTrue(check.classify(0.50).isUp());
            assertTrue(check.classify(0.85).isDegraded());
            assertTrue(check.classify(0.95).isDown());
        }

        @Test
        @DisplayName("Should reject inverted thresholds")
        void shouldRejectInvertedThresholds() {
            assertThrows(IllegalArgumentException.class, () -> new MemoryHealthCheck(0.9, 0.8));
        }
    }

    @Nested
    @DisplayName("ArtifactPathHealthCheck")
    class ArtifactPathTests {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("Should be UP when the model file exists")
        void modelFilePresent() throws IOException {
            Path model = Files.write(tempDir.resolve("kokoro.onnx"), new byte[]{1});
            HealthStatus status = ArtifactPathHealthCheck.modelFile("model", model).check();

            assertTrue(status.isUp());
            assertEquals(model.toString(), status.details().get("path"));
        }

        @Test
        @DisplayName("Should be DOWN when the model file is missing")
        void modelFileMissing() {
            HealthStatus status = ArtifactPathHealthCheck.modelFile("model", tempDir.resolve("missing.onnx")).check();
            assertTrue(status.isDown());
        }

        @Test
        @DisplayName("Should be DOWN for an empty voices directory")
        void emptyDirectory() throws IOException {
            Path voices = Files.createDirectory(tempDir.resolve("voices"));
            ArtifactPathHealthCheck check = ArtifactPathHealthCheck.nonEmptyDirectory("voices", voices);

            assertTrue(check.check().isDown());

            Files.write(voices.resolve("af_heart.bin"), new byte[]{1});
            HealthStatus status = check.check();
            assertTrue(status.isUp());
            assertEquals(1L, status.details().get("files"));
        }
    }

    @Nested
    @DisplayName("DiskSpaceHealthCheck")
    class DiskSpaceTests {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("Should be UP with no minimum")
        void upWithNoMinimum() {
            DiskSpaceHealthCheck check = new DiskSpaceHealthCheck(tempDir, 0);
            assertEquals("diskSpace", check.getName());
            assertTrue(check.check().isUp());
        }

        @Test
        @DisplayName("Should be DEGRADED or DOWN when the minimum cannot be met")
        void unhealthyWithHugeMinimum() {
            HealthStatus status = new DiskSpaceHealthCheck(tempDir, Long.MAX_VALUE).check();
            assertFalse(status.isUp());
        }
    }

    @Nested
    @DisplayName("CacheHealthCheck")
    class CacheHealthCheckTests {

        @Test
        @DisplayName("Should report per-cache details")
        void shouldReportDetails() {
            try (CacheManager manager = new CacheManager()) {
                manager.register("voices", CacheConfig.ofEntries(10));
                manager.getOrLoad("voices", "af_heart", key -> LoadedArtifact.of(new byte[16]));

                HealthStatus status = new CacheHealthCheck(manager).check();

                assertTrue(status.isUp());
                @SuppressWarnings("unchecked")
                Map<String, Object> voices = (Map<String, Object>) status.details().get("voices");
                assertEquals(1L, voices.get("entries"));
                assertEquals(16L, voices.get("sizeBytes"));
            }
        }

        @Test
        @DisplayName("Should be DEGRADED when hit rate is below the minimum")
        void degradedOnLowHitRate() {
            try (CacheManager manager = new CacheManager()) {
                manager.register("audio", CacheConfig.ofEntries(10));
                for (int i = 0; i < 4; i++) {
                    manager.getOrLoad("audio", "chunk-" + i, key -> LoadedArtifact.of(new byte[1]));
                }

                HealthStatus status = new CacheHealthCheck(manager, 0.5, 4).check();

                assertTrue(status.isDegraded());
                assertTrue(status.message().contains("audio"));
            }
        }
    }

    @Nested
    @DisplayName("CircuitBreakerHealthCheck")
    class CircuitBreakerHealthCheckTests {

        private CircuitBreakerRegistry registry() {
            return new CircuitBreakerRegistry(new CircuitBreakerConfig(1, Duration.ofSeconds(30)), Map.of(),
                    new NoOpMetricsService(), new MutableClock());
        }

        private void trip(CircuitBreakerRegistry registry, String kind) {
            assertThrows(IllegalStateException.class, () -> registry.breaker(kind).call(() -> {
                throw new IllegalStateException("down");
            }));
        }

        @Test
        @DisplayName("Should be UP when every circuit is closed")
        void upWhenClosed() {
            CircuitBreakerRegistry registry = registry();
            registry.breaker("voices");

            HealthStatus status = new CircuitBreakerHealthCheck(registry).check();
            assertTrue(status.isUp());
            assertEquals("CLOSED", status.details().get("voices"));
        }

        @Test
        @DisplayName("Should be DEGRADED when a non-critical circuit is open")
        void degradedWhenOpen() {
            CircuitBreakerRegistry registry = registry();
            trip(registry, "downloads");

            HealthStatus status = new CircuitBreakerHealthCheck(registry, Set.of("models")).check();
            assertTrue(status.isDegraded());
            assertEquals("OPEN", status.details().get("downloads"));
        }

        @Test
        @DisplayName("Should be DOWN when a critical circuit is open")
        void downWhenCriticalOpen() {
            CircuitBreakerRegistry registry = registry();
            trip(registry, "models");

            HealthStatus status = new CircuitBreakerHealthCheck(registry, Set.of("models")).check();
            assertTrue(status.isDown());
        }
    }
}
