package com.tts.resilience.reload;

/**
 * Runtime exception for reload failures: a watch that cannot be established
 * or a callback that failed.
 */
public class ReloadException extends RuntimeException {

    public ReloadException(String message) {
        super(message);
    }

    public ReloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
