package com.tts.resilience.health;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one health probe. UP and DEGRADED count as healthy; DOWN does not.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details, Instant checkedAt) {

    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
        checkedAt = checkedAt != null ? checkedAt : Instant.now();
    }

    public HealthStatus(Status status, String message, Map<String, Object> details) {
        this(status, message, details, null);
    }

    public static HealthStatus up() {
        return new HealthStatus(Status.UP, "OK", Map.of());
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, Map.of());
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, Map.of());
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, Map.of());
    }

    /**
     * Result for a probe that did not finish within its timeout.
     */
    public static HealthStatus timedOut(Duration timeout) {
        return down("Health check timed out after " + timeout.toMillis() + "ms")
                .withDetail("timedOut", true);
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> newDetails = new LinkedHashMap<>(this.details);
        newDetails.put(key, value);
        return new HealthStatus(this.status, this.message, newDetails, this.checkedAt);
    }

    public HealthStatus withCheckedAt(Instant at) {
        return new HealthStatus(status, message, details, at);
    }

    public boolean isHealthy() {
        return status != Status.DOWN;
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isTimedOut() {
        return Boolean.TRUE.equals(details.get("timedOut"));
    }
}
