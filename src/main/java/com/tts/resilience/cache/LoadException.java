package com.tts.resilience.cache;

import com.tts.resilience.retry.Retryable;

/**
 * Runtime exception thrown when an artifact loader fails.
 * A non-retryable failure (missing file, corrupt blob) is never retried by
 * {@link com.tts.resilience.retry.RetryPolicy}.
 */
public class LoadException extends RuntimeException implements Retryable {

    private final boolean retryable;

    public LoadException(String message) {
        this(message, true);
    }

    public LoadException(String message, Throwable cause) {
        this(message, cause, true);
    }

    public LoadException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public LoadException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }
}
