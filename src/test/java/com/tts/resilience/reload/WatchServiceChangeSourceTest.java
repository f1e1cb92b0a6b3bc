package com.tts.resilience.reload;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WatchServiceChangeSource Tests")
class WatchServiceChangeSourceTest {

    @TempDir
    Path tempDir;

    private final WatchServiceChangeSource source = new WatchServiceChangeSource();

    @Test
    @DisplayName("Should report changes to the watched file only")
    void reportsWatchedFileOnly() throws Exception {
        Path model = Files.write(tempDir.resolve("kokoro.onnx"), new byte[]{1});
        Path sibling = tempDir.resolve("other.onnx");

        try (ChangeSubscription subscription = source.subscribe(model)) {
            Files.write(sibling, new byte[]{2});
            Files.write(model, "updated".getBytes(StandardCharsets.UTF_8));

            FileChange change = null;
            long deadline = System.currentTimeMillis() + 20_000;
            while (change == null && System.currentTimeMillis() < deadline) {
                FileChange next = subscription.poll(Duration.ofMillis(500));
                if (next != null) {
                    assertNotEquals(sibling.toAbsolutePath().normalize(), next.path());
                    change = next;
                }
            }
            assertNotNull(change, "no change reported for " + model);
            assertEquals(model.toAbsolutePath().normalize(), change.path());
        }
    }

    @Test
    @DisplayName("Closing should end polling")
    void closeEndsPolling() throws Exception {
        ChangeSubscription subscription = source.subscribe(tempDir);
        assertTrue(subscription.isOpen());

        subscription.close();
        subscription.close();

        assertFalse(subscription.isOpen());
        assertNull(subscription.poll(Duration.ofMillis(100)));
    }

    @Test
    @DisplayName("Should refuse a path whose directory does not exist")
    void refusesMissingDirectory() {
        assertThrows(IOException.class, () -> source.subscribe(tempDir.resolve("missing/model.onnx")));
    }
}
