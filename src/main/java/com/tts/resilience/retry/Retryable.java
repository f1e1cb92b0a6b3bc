package com.tts.resilience.retry;

/**
 * Implemented by exceptions that know whether another attempt could succeed.
 * {@link RetryPolicy} never retries an error that reports {@code false}, even
 * when its class is in the configured retryable set.
 */
public interface Retryable {

    boolean isRetryable();
}
