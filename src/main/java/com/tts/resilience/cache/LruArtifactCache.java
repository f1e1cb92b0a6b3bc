package com.tts.resilience.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Strict least-recently-used cache bounded by entry count and/or total byte size.
 *
 * <p>Entries live in a {@link LinkedHashMap} kept in recency order: the head is always the
 * least-recently-used entry, so get, put and evict are O(1) amortized. Recency is a
 * total order (a hit moves the entry to the tail, an insert appends it), which means
 * two entries never tie; among entries never read, the earliest inserted is evicted first.
 * {@link #peek} leaves the order alone.</p>
 *
 * <p>All state is guarded by a single lock per instance. No method calls out to other
 * caches or user code while holding it.</p>
 */
public class LruArtifactCache<K, V> implements ArtifactCache<K, V> {
    private static final Logger log = LoggerFactory.getLogger(LruArtifactCache.class);

    private final String name;
    private final CacheConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<K, CacheEntry<K, V>> entries = new LinkedHashMap<>();

    private long sizeBytes;
    private long sequence;
    private long hits;
    private long misses;
    private long evictions;
    private long rejections;

    public LruArtifactCache(String name, CacheConfig config) {
        this(name, config, Clock.systemUTC());
    }

    public LruArtifactCache(String name, CacheConfig config, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        log.info("LruArtifactCache '{}' initialized: maxEntries={}, maxBytes={}, ttl={}",
                name, config.maxEntries(), config.maxBytes(), config.ttl());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CacheLookup<V> get(K key) {
        lock.lock();
        try {
            CacheEntry<K, V> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return CacheLookup.miss();
            }
            long now = clock.millis();
            if (entry.isExpired(now)) {
                removeEntry(key);
                misses++;
                log.debug("Cache '{}' entry expired: {}", name, key);
                return CacheLookup.miss();
            }
            entry.touch(now);
            // move to the tail
            entries.remove(key);
            entries.put(key, entry);
            hits++;
            return CacheLookup.hit(entry.value());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheLookup<V> peek(K key) {
        lock.lock();
        try {
            CacheEntry<K, V> entry = entries.get(key);
            long now = clock.millis();
            if (entry == null || entry.isExpired(now)) {
                return CacheLookup.miss();
            }
            return CacheLookup.hit(entry.value());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<K> put(K key, V value, long sizeBytes) {
        Objects.requireNonNull(key, "key");
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be >= 0");
        }
        if (config.maxBytes() > 0 && sizeBytes > config.maxBytes()) {
            lock.lock();
            try {
                rejections++;
            } finally {
                lock.unlock();
            }
            log.warn("Cache '{}' rejected {}: size {} exceeds byte bound {}",
                    name, key, sizeBytes, config.maxBytes());
            return Set.of();
        }

        lock.lock();
        try {
            long now = clock.millis();
            long expiresAt = config.expires() ? now + config.ttl().toMillis() : 0;
            CacheEntry<K, V> previous = entries.remove(key);
            if (previous != null) {
                this.sizeBytes -= previous.sizeBytes();
            }
            entries.put(key, new CacheEntry<>(key, value, sizeBytes, ++sequence, now, expiresAt));
            this.sizeBytes += sizeBytes;
            return evictWhileOverBounds();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean invalidate(K key) {
        lock.lock();
        try {
            return removeEntry(key) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            sizeBytes = 0;
        } finally {
            lock.unlock();
        }
        log.debug("Cache '{}' cleared", name);
    }

    @Override
    public int cleanupExpired() {
        if (!config.expires()) {
            return 0;
        }
        int removed = 0;
        lock.lock();
        try {
            long now = clock.millis();
            Iterator<CacheEntry<K, V>> it = entries.values().iterator();
            while (it.hasNext()) {
                CacheEntry<K, V> entry = it.next();
                if (entry.isExpired(now)) {
                    it.remove();
                    sizeBytes -= entry.sizeBytes();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.info("Cache '{}' removed {} expired entries", name, removed);
        }
        return removed;
    }

    @Override
    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(hits, misses, evictions, sizeBytes, entries.size(), rejections);
        } finally {
            lock.unlock();
        }
    }

    public CacheConfig config() {
        return config;
    }

    /**
     * Returns the current keys ordered from least- to most-recently used.
     */
    public List<K> keysInEvictionOrder() {
        lock.lock();
        try {
            return new ArrayList<>(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private Set<K> evictWhileOverBounds() {
        Set<K> evicted = new LinkedHashSet<>();
        long now = clock.millis();
        Iterator<Map.Entry<K, CacheEntry<K, V>>> it = entries.entrySet().iterator();
        while (overBounds() && it.hasNext()) {
            CacheEntry<K, V> lru = it.next().getValue();
            it.remove();
            sizeBytes -= lru.sizeBytes();
            evictions++;
            evicted.add(lru.key());
            log.trace("Cache '{}' evicting {} (seq={}, idleMs={})",
                    name, lru.key(), lru.sequence(), now - lru.lastAccessMillis());
        }
        if (!evicted.isEmpty()) {
            log.debug("Cache '{}' evicted {} entries: {}", name, evicted.size(), evicted);
        }
        return evicted;
    }

    private boolean overBounds() {
        boolean overCount = config.maxEntries() > 0 && entries.size() > config.maxEntries();
        boolean overBytes = config.maxBytes() > 0 && sizeBytes > config.maxBytes();
        return overCount || overBytes;
    }

    private CacheEntry<K, V> removeEntry(K key) {
        CacheEntry<K, V> removed = entries.remove(key);
        if (removed != null) {
            sizeBytes -= removed.sizeBytes();
        }
        return removed;
    }
}
