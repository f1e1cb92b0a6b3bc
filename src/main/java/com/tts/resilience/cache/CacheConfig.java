package com.tts.resilience.cache;

import java.time.Duration;

/**
 * Capacity configuration for a single artifact cache.
 *
 * <p>A bound of {@code 0} means "not bounded on this dimension", but at least one of
 * {@code maxEntries} and {@code maxBytes} must be positive. When both are set, entries
 * are evicted while <em>either</em> bound is exceeded.</p>
 *
 * @param maxEntries maximum number of entries, or 0 for no count bound
 * @param maxBytes   maximum total estimated size in bytes, or 0 for no byte bound
 * @param ttl        time-to-live per entry, or {@link Duration#ZERO} for no expiry
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(long maxEntries, long maxBytes, Duration ttl, boolean enabled) {

    public CacheConfig {
        if (maxEntries < 0) {
            throw new IllegalArgumentException("maxEntries must be >= 0");
        }
        if (maxBytes < 0) {
            throw new IllegalArgumentException("maxBytes must be >= 0");
        }
        if (maxEntries == 0 && maxBytes == 0) {
            throw new IllegalArgumentException("at least one of maxEntries or maxBytes must be > 0");
        }
        ttl = ttl != null ? ttl : Duration.ZERO;
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative");
        }
    }

    /**
     * Default configuration: 1,000 entries, 100 MB, no expiry, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(1_000, 100L * 1024 * 1024, Duration.ZERO, true);
    }

    /**
     * Count-bounded cache with no byte budget.
     */
    public static CacheConfig ofEntries(long maxEntries) {
        return new CacheConfig(maxEntries, 0, Duration.ZERO, true);
    }

    /**
     * Byte-bounded cache with no entry count limit.
     */
    public static CacheConfig ofBytes(long maxBytes) {
        return new CacheConfig(0, maxBytes, Duration.ZERO, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, 0, Duration.ZERO, false);
    }

    public CacheConfig withTtl(Duration ttl) {
        return new CacheConfig(maxEntries, maxBytes, ttl, enabled);
    }

    public boolean expires() {
        return !ttl.isZero();
    }
}
