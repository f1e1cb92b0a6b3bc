package com.tts.resilience.retry;

import java.time.Duration;
import java.util.Set;

/**
 * Immutable retry configuration, shared by value.
 *
 * @param maxAttempts     total attempts including the first
 * @param baseDelay       delay after the first failure
 * @param maxDelay        upper bound for any single delay before jitter
 * @param jitterFraction  each delay is scaled by a random factor in {@code [1 - j, 1 + j]}
 * @param retryableErrors error types that trigger another attempt (subclasses included)
 */
public record RetryConfig(int maxAttempts, Duration baseDelay, Duration maxDelay,
                          double jitterFraction, Set<Class<? extends Throwable>> retryableErrors) {

    public RetryConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (jitterFraction < 0 || jitterFraction >= 1) {
            throw new IllegalArgumentException("jitterFraction must be in [0, 1)");
        }
        retryableErrors = Set.copyOf(retryableErrors);
    }

    /**
     * Default configuration: 3 attempts, 1s base, 60s cap, 10% jitter, any runtime exception.
     */
    public static RetryConfig defaults() {
        return new RetryConfig(3, Duration.ofSeconds(1), Duration.ofSeconds(60), 0.1,
                Set.of(RuntimeException.class));
    }

    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, baseDelay, maxDelay, jitterFraction, retryableErrors);
    }

    public RetryConfig withJitter(double jitterFraction) {
        return new RetryConfig(maxAttempts, baseDelay, maxDelay, jitterFraction, retryableErrors);
    }
}
