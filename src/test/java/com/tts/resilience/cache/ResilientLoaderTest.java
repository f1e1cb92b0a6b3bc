package com.tts.resilience.cache;

import com.tts.resilience.MutableClock;
import com.tts.resilience.breaker.CircuitBreaker;
import com.tts.resilience.breaker.CircuitBreakerConfig;
import com.tts.resilience.breaker.CircuitOpenException;
import com.tts.resilience.breaker.CircuitState;
import com.tts.resilience.metrics.NoOpMetricsService;
import com.tts.resilience.retry.RetryConfig;
import com.tts.resilience.retry.RetryExhaustedException;
import com.tts.resilience.retry.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResilientLoader Tests")
class ResilientLoaderTest {

    private MutableClock clock;
    private CircuitBreaker breaker;
    private RetryPolicy retryPolicy;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        breaker = new CircuitBreaker("voices", new CircuitBreakerConfig(2, Duration.ofSeconds(30)), clock);
        retryPolicy = new RetryPolicy(
                new RetryConfig(5, Duration.ofMillis(10), Duration.ofMillis(100), 0.0, Set.of(RuntimeException.class)),
                delay -> clock.advance(delay), new NoOpMetricsService());
    }

    @Test
    @DisplayName("Should recover from a transient failure")
    void shouldRecoverFromTransientFailure() {
        AtomicInteger calls = new AtomicInteger();
        ResilientLoader loader = new ResilientLoader("voices", key -> {
            if (calls.incrementAndGet() == 1) {
                throw new LoadException("disk busy");
            }
            return LoadedArtifact.of(new byte[]{1, 2, 3});
        }, retryPolicy, breaker);

        LoadedArtifact artifact = loader.load("af_heart");

        assertEquals(3, artifact.sizeEstimate());
        assertEquals(2, calls.get());
        assertEquals(CircuitState.CLOSED, breaker.getState());
    }

    @Test
    @DisplayName("Open circuit should end the retry loop at once")
    void openCircuitStopsRetrying() {
        AtomicInteger calls = new AtomicInteger();
        ResilientLoader loader = new ResilientLoader("voices", key -> {
            calls.incrementAndGet();
            throw new LoadException("network down");
        }, retryPolicy, breaker);

        assertThrows(CircuitOpenException.class, () -> loader.load("af_heart"));

        assertEquals(2, calls.get());
        assertEquals(CircuitState.OPEN, breaker.getState());
    }

    @Test
    @DisplayName("Non-retryable failure should not be retried")
    void nonRetryableFailure() {
        AtomicInteger calls = new AtomicInteger();
        ResilientLoader loader = new ResilientLoader("voices", key -> {
            calls.incrementAndGet();
            throw new LoadException("no such voice", false);
        }, retryPolicy, new CircuitBreaker("isolated", new CircuitBreakerConfig(10, Duration.ofSeconds(30)), clock));

        LoadException e = assertThrows(LoadException.class, () -> loader.load("zz_unknown"));

        assertFalse(e.isRetryable());
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Exhausted retries should surface the last failure")
    void exhaustedRetries() {
        CircuitBreaker tolerant = new CircuitBreaker("tolerant", new CircuitBreakerConfig(100, Duration.ofSeconds(30)), clock);
        ResilientLoader loader = new ResilientLoader("voices", key -> {
            throw new LoadException("still failing");
        }, retryPolicy, tolerant);

        RetryExhaustedException e = assertThrows(RetryExhaustedException.class, () -> loader.load("af_heart"));

        assertEquals(5, e.getAttempts());
        assertEquals("still failing", e.getCause().getMessage());
        assertEquals(5, tolerant.getFailureCount());
    }
}
