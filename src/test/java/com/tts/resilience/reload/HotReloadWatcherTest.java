package com.tts.resilience.reload;

import com.tts.resilience.cache.CacheConfig;
import com.tts.resilience.cache.CacheManager;
import com.tts.resilience.cache.LoadedArtifact;
import com.tts.resilience.metrics.MicrometerMetricsService;
import com.tts.resilience.tracing.NoOpTracingService;
import com.tts.resilience.tracing.Span;
import com.tts.resilience.tracing.TracingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("HotReloadWatcher Tests")
class HotReloadWatcherTest {

    @TempDir
    Path tempDir;

    private CacheManager cacheManager;
    private FakeChangeSource changeSource;
    private SimpleMeterRegistry meters;
    private HotReloadWatcher watcher;
    private BlockingQueue<ReloadEvent> events;

    @BeforeEach
    void setUp() {
        cacheManager = new CacheManager();
        cacheManager.register("voices", CacheConfig.ofEntries(10));
        changeSource = new FakeChangeSource();
        meters = new SimpleMeterRegistry();
        watcher = new HotReloadWatcher(cacheManager, changeSource, new MicrometerMetricsService(meters),
                new NoOpTracingService(), Clock.systemUTC());
        events = new LinkedBlockingQueue<>();
    }

    @AfterEach
    void tearDown() {
        watcher.close();
        cacheManager.close();
    }

    private Path writeModel(String name, String content) throws IOException {
        return Files.write(tempDir.resolve(name), content.getBytes(StandardCharsets.UTF_8));
    }

    private ReloadTarget.Builder target(String name, Path path) {
        return ReloadTarget.builder(name, path).callback(events::add);
    }

    private void awaitState(String target, ReloadState expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (watcher.state(target) != expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(expected, watcher.state(target));
    }

    @Nested
    @DisplayName("Debounce")
    class DebounceTests {

        @Test
        @DisplayName("A burst of changes should fire once with the final file")
        void burstFiresOnce() throws Exception {
            Path model = writeModel("kokoro.onnx", "v1");
            watcher.register(target("model", model).debounce(Duration.ofMillis(500)).build());
            watcher.start();

            changeSource.emit(model);
            Thread.sleep(50);
            writeModel("kokoro.onnx", "version-2");
            changeSource.emit(model);
            Thread.sleep(50);
            writeModel("kokoro.onnx", "the-third-version");
            changeSource.emit(model);

            ReloadEvent event = events.poll(5, TimeUnit.SECONDS);
            assertNotNull(event, "reload did not fire");
            assertEquals("model", event.targetName());
            assertEquals(3, event.coalescedChanges());
            assertFalse(event.manual());
            assertTrue(event.pathState().exists());
            assertEquals("the-third-version".length(), event.pathState().sizeBytes());

            assertNull(events.poll(1, TimeUnit.SECONDS), "burst fired more than once");
            assertEquals(ReloadState.IDLE, watcher.state("model"));
        }

        @Test
        @DisplayName("A change should leave the target pending until the quiet period passes")
        void changeMakesTargetPending() throws Exception {
            Path model = writeModel("kokoro.onnx", "v1");
            watcher.register(target("model", model).debounce(Duration.ofSeconds(30)).build());
            watcher.start();

            changeSource.emit(model);

            awaitState("model", ReloadState.PENDING);
            assertTrue(events.isEmpty());
        }

        @Test
        @DisplayName("Files without a watched suffix should be ignored")
        void suffixFilter() throws Exception {
            Path voices = Files.createDirectory(tempDir.resolve("voices"));
            watcher.register(target("voices", voices).suffixes(".bin").debounce(Duration.ofMillis(100)).build());
            watcher.start();

            changeSource.emit(voices.resolve("notes.txt"));
            assertNull(events.poll(700, TimeUnit.MILLISECONDS));

            changeSource.emit(voices.resolve("af_heart.bin"));
            assertNotNull(events.poll(5, TimeUnit.SECONDS));
        }
    }

    @Nested
    @DisplayName("Firing")
    class FiringTests {

        @Test
        @DisplayName("Manual reload should invalidate cache keys and bypass the debounce")
        void manualReloadInvalidates() throws Exception {
            cacheManager.getOrLoad("voices", "af_heart", key -> LoadedArtifact.of(new byte[4]));
            cacheManager.getOrLoad("voices", "bf_emma", key -> LoadedArtifact.of(new byte[4]));
            Path voice = writeModel("af_heart.bin", "embedding");
            watcher.register(target("af_heart", voice).cache("voices", "af_heart")
                    .debounce(Duration.ofMillis(300)).build());
            watcher.start();
            changeSource.emit(voice);
            awaitState("af_heart", ReloadState.PENDING);

            assertTrue(watcher.manualReload("af_heart"));

            ReloadEvent event = events.poll(5, TimeUnit.SECONDS);
            assertNotNull(event);
            assertTrue(event.manual());
            assertEquals(1, event.invalidated());
            assertFalse(cacheManager.cache("voices").peek("af_heart").hit());
            assertTrue(cacheManager.cache("voices").peek("bf_emma").hit());

            assertNull(events.poll(800, TimeUnit.MILLISECONDS), "debounced firing should have been cancelled");
        }

        @Test
        @DisplayName("A target without keys should clear the whole cache")
        void clearsWholeCache() {
            cacheManager.getOrLoad("voices", "af_heart", key -> LoadedArtifact.of(new byte[4]));
            cacheManager.getOrLoad("voices", "bf_emma", key -> LoadedArtifact.of(new byte[4]));
            watcher.register(target("all-voices", tempDir).cache("voices").build());

            assertTrue(watcher.manualReload("all-voices"));

            assertEquals(0, cacheManager.stats("voices").entryCount());
            assertEquals(2, events.poll().invalidated());
        }

        @Test
        @DisplayName("A failing callback should be counted and not stop the watcher")
        void failingCallbackKeepsWatching() throws Exception {
            Path model = writeModel("kokoro.onnx", "v1");
            AtomicInteger calls = new AtomicInteger();
            watcher.register(ReloadTarget.builder("model", model)
                    .debounce(Duration.ofMillis(50))
                    .callback(event -> {
                        if (calls.incrementAndGet() == 1) {
                            throw new IOException("model file truncated");
                        }
                        events.add(event);
                    })
                    .build());
            watcher.start();

            assertFalse(watcher.manualReload("model"));
            assertEquals(ReloadState.IDLE, watcher.state("model"));

            changeSource.emit(model);
            assertNotNull(events.poll(5, TimeUnit.SECONDS));

            WatcherStatus.TargetStatus status = watcher.status().targets().get("model");
            assertEquals(1, status.failed());
            assertEquals(1, status.fired());
            assertEquals(1.0, meters.find("tts.reload").tag("outcome", "failure").counter().count());
            assertEquals(1.0, meters.find("tts.reload").tag("outcome", "success").counter().count());
        }

        @Test
        @DisplayName("A callback throwing an Error should leave the target idle and reloadable")
        void callbackErrorReturnsToIdle() throws Exception {
            Path model = writeModel("kokoro.onnx", "v1");
            AtomicInteger calls = new AtomicInteger();
            watcher.register(ReloadTarget.builder("model", model)
                    .callback(event -> {
                        if (calls.incrementAndGet() == 1) {
                            throw new LinkageError("onnxruntime native library mismatch");
                        }
                        events.add(event);
                    })
                    .build());

            assertFalse(watcher.manualReload("model"));
            assertEquals(ReloadState.IDLE, watcher.state("model"));

            assertTrue(watcher.manualReload("model"));
            assertEquals(1, events.size());
            WatcherStatus.TargetStatus status = watcher.status().targets().get("model");
            assertEquals(1, status.failed());
            assertEquals(1, status.fired());
        }

        @Test
        @DisplayName("Firing should trace the target path")
        void firingIsTraced() throws Exception {
            TracingService tracing = mock(TracingService.class);
            Span span = mock(Span.class);
            when(tracing.startSpan(eq("reload.fire"), anyMap())).thenReturn(span);
            Path model = writeModel("kokoro.onnx", "v1");
            try (HotReloadWatcher traced = new HotReloadWatcher(cacheManager, changeSource,
                    new MicrometerMetricsService(meters), tracing, Clock.systemUTC())) {
                traced.register(target("model", model).build());

                assertTrue(traced.manualReload("model"));

                verify(span).setAttribute("reload.path", model.toAbsolutePath().normalize().toString());
                verify(span).setAttribute("reload.changes", 0L);
                verify(span).markSuccess();
                verify(span).close();
            }
        }

        @Test
        @DisplayName("reloadAll should fire every target")
        void reloadAllFiresEveryTarget() throws IOException {
            watcher.register(target("model", writeModel("kokoro.onnx", "m")).build());
            watcher.register(target("config", writeModel("config.json", "{}")).build());

            Map<String, Boolean> results = watcher.reloadAll();

            assertEquals(Map.of("model", true, "config", true), results);
            assertEquals(2, events.size());
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("stop should close every subscription and start should reopen them")
        void stopClosesSubscriptions() throws IOException {
            watcher.register(target("model", writeModel("kokoro.onnx", "m")).build());
            watcher.register(target("voices", tempDir).build());
            watcher.start();
            assertEquals(2, changeSource.openCount());
            assertTrue(watcher.status().targets().get("model").watching());

            watcher.stop();

            assertFalse(watcher.isRunning());
            assertEquals(0, changeSource.openCount());
            assertFalse(watcher.status().targets().get("model").watching());

            watcher.start();
            assertEquals(2, changeSource.openCount());
        }

        @Test
        @DisplayName("Registering while running should start watching at once")
        void registerWhileRunning() throws IOException {
            watcher.start();
            watcher.register(target("model", writeModel("kokoro.onnx", "m")).build());

            assertEquals(1, changeSource.openCount());
        }

        @Test
        @DisplayName("unregister should release the subscription")
        void unregisterReleases() throws IOException {
            watcher.register(target("model", writeModel("kokoro.onnx", "m")).build());
            watcher.start();

            assertTrue(watcher.unregister("model"));
            assertFalse(watcher.unregister("model"));
            assertEquals(0, changeSource.openCount());
        }

        @Test
        @DisplayName("Should reject duplicate and unknown targets")
        void rejectsDuplicateAndUnknown() {
            watcher.register(target("model", tempDir).build());

            assertThrows(IllegalStateException.class, () -> watcher.register(target("model", tempDir).build()));
            assertThrows(IllegalArgumentException.class, () -> watcher.manualReload("missing"));
            assertThrows(IllegalArgumentException.class, () -> watcher.state("missing"));
        }

        @Test
        @DisplayName("An unwatchable path should fail registration while running")
        void unwatchablePath() {
            HotReloadWatcher real = new HotReloadWatcher(cacheManager);
            try {
                real.start();
                ReloadTarget target = ReloadTarget.builder("ghost", tempDir.resolve("no/such/dir/model.onnx")).build();
                assertThrows(ReloadException.class, () -> real.register(target));
                assertTrue(real.status().targets().isEmpty());
            } finally {
                real.close();
            }
        }
    }
}
