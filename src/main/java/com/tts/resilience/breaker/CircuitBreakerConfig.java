package com.tts.resilience.breaker;

import java.time.Duration;

/**
 * Configuration for one {@link CircuitBreaker}.
 *
 * @param failureThreshold consecutive failures that open the circuit
 * @param cooldown         how long the circuit stays open before a trial call is allowed
 */
public record CircuitBreakerConfig(int failureThreshold, Duration cooldown) {

    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be > 0");
        }
        if (cooldown == null || cooldown.isNegative() || cooldown.isZero()) {
            throw new IllegalArgumentException("cooldown must be positive");
        }
    }

    /**
     * Default configuration: 5 failures, 60s cooldown.
     */
    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(5, Duration.ofSeconds(60));
    }
}
