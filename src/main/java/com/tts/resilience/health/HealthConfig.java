package com.tts.resilience.health;

import java.time.Duration;

/**
 * Health registry configuration.
 *
 * @param timeout            hard limit for a single probe run
 * @param parallelism        maximum number of probes {@code runAll} runs at once
 * @param defaultMinInterval a result younger than this is reused by {@code runAll};
 *                           {@link Duration#ZERO} always re-runs
 */
public record HealthConfig(Duration timeout, int parallelism, Duration defaultMinInterval) {

    public HealthConfig {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        defaultMinInterval = defaultMinInterval != null ? defaultMinInterval : Duration.ZERO;
        if (defaultMinInterval.isNegative()) {
            throw new IllegalArgumentException("defaultMinInterval must not be negative");
        }
    }

    public static HealthConfig defaults() {
        return new HealthConfig(Duration.ofSeconds(5), 4, Duration.ZERO);
    }

    public HealthConfig withTimeout(Duration timeout) {
        return new HealthConfig(timeout, parallelism, defaultMinInterval);
    }
}
