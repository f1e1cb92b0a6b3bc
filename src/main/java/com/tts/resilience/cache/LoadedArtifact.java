package com.tts.resilience.cache;

import java.time.Instant;
import java.util.Objects;

/**
 * Artifact bytes as produced by an {@link ArtifactLoader}.
 *
 * @param data         the artifact payload (voice embedding, model blob, ...)
 * @param sizeEstimate estimated in-memory size in bytes, charged against the cache byte bound
 * @param loadedAt     when the loader produced the value
 */
public record LoadedArtifact(byte[] data, long sizeEstimate, Instant loadedAt) {

    public LoadedArtifact {
        Objects.requireNonNull(data, "data");
        if (sizeEstimate < 0) {
            throw new IllegalArgumentException("sizeEstimate must be >= 0");
        }
        loadedAt = loadedAt != null ? loadedAt : Instant.now();
    }

    /**
     * Wraps bytes, using their length as the size estimate.
     */
    public static LoadedArtifact of(byte[] data) {
        return new LoadedArtifact(data, data.length, Instant.now());
    }
}
