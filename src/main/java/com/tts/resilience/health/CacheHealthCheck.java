package com.tts.resilience.health;

import com.tts.resilience.cache.CacheManager;
import com.tts.resilience.cache.CacheStats;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reports per-cache occupancy and hit rate. DEGRADED when a cache that has seen at least
 * {@code minLookups} lookups hits less often than {@code minHitRate}.
 */
public class CacheHealthCheck implements HealthCheck {

    private final CacheManager cacheManager;
    private final double minHitRate;
    private final long minLookups;

    public CacheHealthCheck(CacheManager cacheManager) {
        this(cacheManager, 0.0, 100);
    }

    public CacheHealthCheck(CacheManager cacheManager, double minHitRate, long minLookups) {
        this.cacheManager = cacheManager;
        this.minHitRate = minHitRate;
        this.minLookups = minLookups;
    }

    @Override
    public String getName() {
        return "caches";
    }

    @Override
    public HealthStatus check() {
        Map<String, CacheStats> all = cacheManager.allStats();
        List<String> cold = new ArrayList<>();
        for (Map.Entry<String, CacheStats> entry : all.entrySet()) {
            CacheStats stats = entry.getValue();
            long lookups = stats.hitCount() + stats.missCount();
            if (lookups >= minLookups && stats.hitRate() < minHitRate) {
                cold.add(entry.getKey());
            }
        }
        HealthStatus status = cold.isEmpty()
                ? HealthStatus.up()
                : HealthStatus.degraded("Low hit rate: " + String.join(", ", cold));
        for (Map.Entry<String, CacheStats> entry : all.entrySet()) {
            CacheStats stats = entry.getValue();
            status = status.withDetail(entry.getKey(), Map.of(
                    "entries", stats.entryCount(),
                    "sizeBytes", stats.sizeBytes(),
                    "hitRate", Math.round(stats.hitRate() * 1000.0) / 1000.0,
                    "evictions", stats.evictionCount()));
        }
        return status;
    }
}
