package com.tts.resilience.health;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;

/**
 * Health check for JVM heap usage. DEGRADED above the warning fraction,
 * DOWN above the critical fraction.
 */
public class MemoryHealthCheck implements HealthCheck {

    private final double degradedThreshold;
    private final double downThreshold;

    /**
     * Defaults: degraded at 80% heap, down at 90%.
     */
    public MemoryHealthCheck() {
        this(0.80, 0.90);
    }

    public MemoryHealthCheck(double degradedThreshold, double downThreshold) {
        if (degradedThreshold <= 0 || downThreshold > 1 || degradedThreshold > downThreshold) {
            throw new IllegalArgumentException("require 0 < degradedThreshold <= downThreshold <= 1");
        }
        this.degradedThreshold = degradedThreshold;
        this.downThreshold = downThreshold;
    }

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    public HealthStatus check() {
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        long max = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        double used = max > 0 ? (double) heap.getUsed() / max : 0.0;
        return classify(used)
                .withDetail("heapUsedMB", heap.getUsed() / (1024 * 1024))
                .withDetail("heapMaxMB", max / (1024 * 1024))
                .withDetail("heapUsagePercent", Math.round(used * 1000.0) / 10.0);
    }

    HealthStatus classify(double usedFraction) {
        String pct = String.format("%.1f%%", usedFraction * 100);
        if (usedFraction >= downThreshold) {
            return HealthStatus.down("Heap usage critical: " + pct);
        }
        if (usedFraction >= degradedThreshold) {
            return HealthStatus.degraded("Heap usage high: " + pct);
        }
        return HealthStatus.up();
    }
}
