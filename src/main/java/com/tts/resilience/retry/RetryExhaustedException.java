package com.tts.resilience.retry;

/**
 * Thrown when every allowed attempt failed with a retryable error.
 * The cause is the error from the final attempt.
 */
public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    public RetryExhaustedException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
