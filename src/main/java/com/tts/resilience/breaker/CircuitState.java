package com.tts.resilience.breaker;

/**
 * Circuit breaker states.
 */
public enum CircuitState {
    /** Calls pass through; consecutive failures are counted. */
    CLOSED,
    /** Calls fail fast until the cooldown elapses. */
    OPEN,
    /** One trial call is in flight; everyone else fails fast until it resolves. */
    HALF_OPEN
}
