package com.tts.resilience.warmup;

import com.tts.resilience.cache.ArtifactLoader;

import java.util.Objects;

/**
 * A request to load one artifact into a cache ahead of demand.
 *
 * @param cacheName     the target cache
 * @param key           the artifact key
 * @param loader        produces the artifact
 * @param priority      higher runs first; equal priorities run in the order scheduled
 * @param estimatedCost rough relative cost, reported in logs only
 */
public record WarmupTask(String cacheName, String key, ArtifactLoader loader, int priority, long estimatedCost) {

    public WarmupTask {
        Objects.requireNonNull(cacheName, "cacheName");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(loader, "loader");
        if (estimatedCost < 0) {
            throw new IllegalArgumentException("estimatedCost must be >= 0");
        }
    }

    public static WarmupTask of(String cacheName, String key, ArtifactLoader loader, int priority) {
        return new WarmupTask(cacheName, key, loader, priority, 1);
    }

    public String id() {
        return cacheName + "/" + key;
    }
}
