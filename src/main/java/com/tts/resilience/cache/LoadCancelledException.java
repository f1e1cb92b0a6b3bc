package com.tts.resilience.cache;

/**
 * Delivered to every waiter of an in-flight load that was cancelled.
 */
public class LoadCancelledException extends LoadException {

    public LoadCancelledException(String message) {
        super(message, false);
    }

    public LoadCancelledException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
