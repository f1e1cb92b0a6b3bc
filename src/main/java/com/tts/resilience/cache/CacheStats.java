package com.tts.resilience.cache;

/**
 * Point-in-time statistics for one artifact cache.
 *
 * @param hitCount      number of cache hits
 * @param missCount     number of cache misses (including expired entries)
 * @param evictionCount number of entries evicted to satisfy a capacity bound
 * @param sizeBytes     current total estimated size of all entries
 * @param entryCount    current number of entries
 * @param rejections    number of puts refused because the entry alone exceeds the byte bound
 */
public record CacheStats(long hitCount, long missCount, long evictionCount,
                         long sizeBytes, long entryCount, long rejections) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    /**
     * Returns empty stats.
     */
    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0, 0);
    }
}
