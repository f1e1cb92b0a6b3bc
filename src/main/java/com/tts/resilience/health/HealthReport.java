package com.tts.resilience.health;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate health over the enabled checks.
 *
 * @param healthy     true iff no enabled check is DOWN
 * @param status      worst status among the enabled checks
 * @param checks      latest result per enabled check, in registration order
 * @param generatedAt when the report was assembled
 */
public record HealthReport(boolean healthy, HealthStatus.Status status,
                           Map<String, HealthStatus> checks, Instant generatedAt) {

    public HealthReport {
        checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
    }

    /**
     * Aggregates results: any DOWN makes the report DOWN, otherwise any DEGRADED makes it DEGRADED.
     */
    public static HealthReport of(Map<String, HealthStatus> checks, Instant generatedAt) {
        HealthStatus.Status worst = HealthStatus.Status.UP;
        for (HealthStatus result : checks.values()) {
            if (result.status().ordinal() > worst.ordinal()) {
                worst = result.status();
            }
        }
        return new HealthReport(worst != HealthStatus.Status.DOWN, worst, checks, generatedAt);
    }
}
