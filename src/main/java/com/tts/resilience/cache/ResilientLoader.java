package com.tts.resilience.cache;

import com.tts.resilience.breaker.CircuitBreaker;
import com.tts.resilience.retry.RetryPolicy;

import java.util.Objects;

/**
 * Wraps a loader as {@code retry(breaker(load))}: each attempt passes through the
 * breaker, and an open circuit ends the retry loop at once.
 */
public class ResilientLoader implements ArtifactLoader {

    private final String name;
    private final ArtifactLoader delegate;
    private final RetryPolicy retryPolicy;
    private final CircuitBreaker breaker;

    public ResilientLoader(String name, ArtifactLoader delegate,
                           RetryPolicy retryPolicy, CircuitBreaker breaker) {
        this.name = Objects.requireNonNull(name, "name");
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.breaker = Objects.requireNonNull(breaker, "breaker");
    }

    @Override
    public LoadedArtifact load(String key) {
        return retryPolicy.execute(name + ":" + key, () -> breaker.call(() -> delegate.load(key)));
    }

    public CircuitBreaker breaker() {
        return breaker;
    }
}
