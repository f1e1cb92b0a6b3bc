package com.tts.resilience.reload;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;

/**
 * What a watched path looked like when a reload fired.
 *
 * @param path         the watched path
 * @param exists       whether it exists
 * @param sizeBytes    file size, or 0 for directories and missing paths
 * @param lastModified last modification time, or null if missing
 * @param observedAt   when the state was read
 */
public record PathState(Path path, boolean exists, long sizeBytes, Instant lastModified, Instant observedAt) {

    public static PathState observe(Path path, Clock clock) {
        Instant now = clock.instant();
        if (!Files.exists(path)) {
            return new PathState(path, false, 0, null, now);
        }
        try {
            long size = Files.isRegularFile(path) ? Files.size(path) : 0;
            return new PathState(path, true, size, Files.getLastModifiedTime(path).toInstant(), now);
        } catch (IOException e) {
            // removed between the exists check and the read
            return new PathState(path, false, 0, null, now);
        }
    }
}
