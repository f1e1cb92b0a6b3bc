package com.tts.resilience.cache;

/**
 * A single cached value with its bookkeeping. Owned and mutated only by the
 * {@link LruArtifactCache} that holds it, under that cache's lock.
 */
final class CacheEntry<K, V> {

    private final K key;
    private final V value;
    private final long sizeBytes;
    private final long sequence;
    private final long expiresAtMillis;
    private long lastAccessMillis;

    CacheEntry(K key, V value, long sizeBytes, long sequence, long nowMillis, long expiresAtMillis) {
        this.key = key;
        this.value = value;
        this.sizeBytes = sizeBytes;
        this.sequence = sequence;
        this.lastAccessMillis = nowMillis;
        this.expiresAtMillis = expiresAtMillis;
    }

    K key() { return key; }
    V value() { return value; }
    long sizeBytes() { return sizeBytes; }
    long sequence() { return sequence; }
    long lastAccessMillis() { return lastAccessMillis; }

    boolean isExpired(long nowMillis) {
        return expiresAtMillis > 0 && nowMillis >= expiresAtMillis;
    }

    void touch(long nowMillis) {
        this.lastAccessMillis = nowMillis;
    }
}
