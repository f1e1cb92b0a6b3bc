package com.tts.resilience.breaker;

import java.time.Instant;

/**
 * Read-only view of a breaker's state.
 *
 * @param name             breaker name (the guarded operation kind)
 * @param state            current state
 * @param failureCount     consecutive failures counted so far
 * @param failureThreshold failures that open the circuit
 * @param openUntil        end of the current cooldown, or {@code null} when not open
 */
public record CircuitBreakerSnapshot(String name, CircuitState state, int failureCount,
                                     int failureThreshold, Instant openUntil) {
}
