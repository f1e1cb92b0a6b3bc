package com.tts.resilience.cache;

import java.util.Optional;

/**
 * Result of a cache read. A miss is a normal outcome, not an error.
 *
 * @param value the cached value, {@code null} on a miss
 * @param hit   whether the key was present
 */
public record CacheLookup<V>(V value, boolean hit) {

    private static final CacheLookup<?> MISS = new CacheLookup<>(null, false);

    public static <V> CacheLookup<V> hit(V value) {
        return new CacheLookup<>(value, true);
    }

    @SuppressWarnings("unchecked")
    public static <V> CacheLookup<V> miss() {
        return (CacheLookup<V>) MISS;
    }

    public Optional<V> toOptional() {
        return hit ? Optional.ofNullable(value) : Optional.empty();
    }
}
