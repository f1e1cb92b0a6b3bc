package com.tts.resilience.status;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tts.resilience.ResilienceCore;
import com.tts.resilience.cache.CacheStats;
import com.tts.resilience.health.HealthReport;
import com.tts.resilience.monitor.PerformanceSummary;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders the read-only status surfaces (health, cache stats, performance summary, breaker,
 * warm-up and watcher state) as JSON for monitoring endpoints. Instants and durations are
 * written as ISO-8601 strings.
 */
public final class StatusJson {

    private final ObjectMapper objectMapper;

    public StatusJson() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE);
    }

    public String health(HealthReport report) {
        return write(report);
    }

    public String performance(PerformanceSummary summary) {
        return write(summary);
    }

    public String caches(Map<String, CacheStats> stats) {
        return write(stats);
    }

    /**
     * Renders everything the core exposes in one document.
     */
    public String snapshot(ResilienceCore core) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("health", core.health().status());
        doc.put("caches", core.cacheManager().allStats());
        doc.put("circuitBreakers", core.breakers().snapshots());
        doc.put("components", core.degradation().snapshot());
        doc.put("warmup", core.warmup().stats());
        doc.put("reload", core.watcher().status());
        doc.put("performance", core.monitor().summary());
        return write(doc);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize status: " + e.getMessage(), e);
        }
    }
}
