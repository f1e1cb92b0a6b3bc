package com.tts.resilience.monitor;

/**
 * Hit/miss counters observed for one cache.
 */
public record CacheRates(long hits, long misses) {

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
