package com.tts.resilience.cache;

/**
 * Produces an artifact for a key on a cache miss.
 * Implementations read from disk, download, or compute; they may block.
 */
@FunctionalInterface
public interface ArtifactLoader {

    /**
     * Loads the artifact for a key.
     *
     * @throws LoadException if the artifact cannot be produced
     */
    LoadedArtifact load(String key);
}
