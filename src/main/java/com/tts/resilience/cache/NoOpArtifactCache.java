package com.tts.resilience.cache;

import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cache used when caching is disabled for an artifact class. Stores nothing;
 * every lookup is a miss.
 */
public class NoOpArtifactCache<K, V> implements ArtifactCache<K, V> {

    private final String name;
    private final AtomicLong misses = new AtomicLong();

    public NoOpArtifactCache(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CacheLookup<V> get(K key) {
        misses.incrementAndGet();
        return CacheLookup.miss();
    }

    @Override
    public CacheLookup<V> peek(K key) {
        return CacheLookup.miss();
    }

    @Override
    public Set<K> put(K key, V value, long sizeBytes) {
        return Set.of();
    }

    @Override
    public boolean invalidate(K key) {
        return false;
    }

    @Override
    public void clear() {
        // nothing stored
    }

    @Override
    public int cleanupExpired() {
        return 0;
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(0, misses.get(), 0, 0, 0, 0);
    }
}
