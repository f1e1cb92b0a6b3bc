package com.tts.resilience.breaker;

import com.tts.resilience.retry.Retryable;

import java.time.Duration;

/**
 * Thrown instead of invoking a guarded operation while its circuit is open
 * or while a half-open trial is already in flight.
 */
public class CircuitOpenException extends RuntimeException implements Retryable {

    private final String breakerName;
    private final Duration retryAfter;

    public CircuitOpenException(String breakerName, Duration retryAfter) {
        super("Circuit '" + breakerName + "' is open, retry after " + retryAfter.toMillis() + "ms");
        this.breakerName = breakerName;
        this.retryAfter = retryAfter;
    }

    public String getBreakerName() {
        return breakerName;
    }

    /**
     * Time left until a trial call will be admitted; zero while a trial is in flight.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    /**
     * Always false: retrying into an open circuit only burns the backoff budget.
     */
    @Override
    public boolean isRetryable() {
        return false;
    }
}
