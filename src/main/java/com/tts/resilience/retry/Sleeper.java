package com.tts.resilience.retry;

import java.time.Duration;

/**
 * Pause between attempts. Replaced in tests to observe delays without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
