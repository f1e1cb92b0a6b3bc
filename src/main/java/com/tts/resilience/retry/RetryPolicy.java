package com.tts.resilience.retry;

import com.tts.resilience.metrics.MetricsService;
import com.tts.resilience.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Bounded exponential-backoff retry around a fallible operation.
 *
 * <p>After failed attempt {@code n} the policy sleeps
 * {@code min(baseDelay * 2^(n-1), maxDelay)} scaled by a random jitter factor, then tries
 * again, up to {@code maxAttempts} attempts in total. Holds no per-call state, so one
 * instance can be shared by any number of callers.</p>
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final RetryConfig config;
    private final Sleeper sleeper;
    private final MetricsService metrics;

    public RetryPolicy(RetryConfig config) {
        this(config, Sleeper.THREAD, new NoOpMetricsService());
    }

    public RetryPolicy(RetryConfig config, Sleeper sleeper, MetricsService metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public <T> T execute(Supplier<T> operation) {
        return execute("operation", operation);
    }

    /**
     * Runs the operation, retrying retryable failures.
     *
     * @param operationName name used in logs and metrics
     * @throws RetryExhaustedException when every attempt failed with a retryable error
     * @throws RuntimeException        the original error, unchanged, when it is not retryable
     */
    public <T> T execute(String operationName, Supplier<T> operation) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                if (!isRetryable(e)) {
                    throw e;
                }
                last = e;
                if (attempt == config.maxAttempts()) {
                    break;
                }
                Duration delay = jittered(delayFor(attempt));
                log.warn("{} attempt {}/{} failed: {}; retrying in {}ms",
                        operationName, attempt, config.maxAttempts(), e.getMessage(), delay.toMillis());
                metrics.recordRetry(operationName, attempt + 1);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RetryExhaustedException(
                            operationName + " interrupted after " + attempt + " attempts", attempt, e);
                }
            }
        }
        log.error("{} failed after {} attempts: {}", operationName, config.maxAttempts(), last.getMessage());
        throw new RetryExhaustedException(
                operationName + " failed after " + config.maxAttempts() + " attempts", config.maxAttempts(), last);
    }

    /**
     * Returns the un-jittered delay that follows failed attempt {@code attempt} (1-based).
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        long baseMillis = config.baseDelay().toMillis();
        long maxMillis = config.maxDelay().toMillis();
        int shift = attempt - 1;
        if (shift >= 62 || baseMillis > (maxMillis >> shift)) {
            return config.maxDelay();
        }
        return Duration.ofMillis(Math.min(baseMillis << shift, maxMillis));
    }

    public boolean isRetryable(Throwable error) {
        if (error instanceof Retryable r && !r.isRetryable()) {
            return false;
        }
        for (Class<? extends Throwable> type : config.retryableErrors()) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }

    public RetryConfig getConfig() {
        return config;
    }

    private Duration jittered(Duration delay) {
        double jitter = config.jitterFraction();
        if (jitter == 0 || delay.isZero()) {
            return delay;
        }
        double factor = 1 + jitter * (2 * ThreadLocalRandom.current().nextDouble() - 1);
        return Duration.ofMillis(Math.round(delay.toMillis() * factor));
    }
}
