package com.tts.resilience.reload;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * One change notification from a {@link FileChangeSource}.
 */
public record FileChange(Path path, Instant timestamp, Kind kind) {

    public enum Kind { CREATED, MODIFIED, DELETED, OVERFLOW }

    public FileChange {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
    }

    public static FileChange modified(Path path) {
        return new FileChange(path, Instant.now(), Kind.MODIFIED);
    }
}
