package com.tts.resilience.cache;

import java.util.Set;

/**
 * A bounded, thread-safe store for one artifact class (voice embeddings, audio chunks,
 * text-processing results, model blobs).
 *
 * <p>Every operation is atomic with respect to other callers on the same instance.</p>
 */
public interface ArtifactCache<K, V> {

    /**
     * Returns the name this cache was registered under.
     */
    String name();

    /**
     * Looks up a key. A hit marks the entry most-recently-used.
     */
    CacheLookup<V> get(K key);

    /**
     * Looks up a key without counting a hit or miss and without changing recency. Used to
     * re-check the cache after winning a load race, and by status views.
     */
    CacheLookup<V> peek(K key);

    /**
     * Inserts or replaces a value, evicting least-recently-used entries until every
     * configured bound is satisfied.
     *
     * @param key       the key
     * @param value     the value
     * @param sizeBytes estimated size of the value in bytes
     * @return the keys evicted to make room, so callers can propagate invalidation
     */
    Set<K> put(K key, V value, long sizeBytes);

    /**
     * Removes a single entry.
     *
     * @return true if an entry was removed
     */
    boolean invalidate(K key);

    /**
     * Removes all entries.
     */
    void clear();

    /**
     * Removes entries whose time-to-live has elapsed.
     *
     * @return the number of entries removed
     */
    int cleanupExpired();

    /**
     * Returns cache statistics.
     */
    CacheStats stats();
}
