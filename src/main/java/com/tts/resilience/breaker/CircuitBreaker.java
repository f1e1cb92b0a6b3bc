package com.tts.resilience.breaker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fail-fast guard around one kind of unreliable operation (voice loads, model downloads, ...).
 *
 * <p>State machine:</p>
 * <ul>
 *   <li>CLOSED → OPEN after {@code failureThreshold} consecutive failures</li>
 *   <li>OPEN → HALF_OPEN when the first call arrives after the cooldown</li>
 *   <li>HALF_OPEN → CLOSED when the single trial call succeeds</li>
 *   <li>HALF_OPEN → OPEN, with a fresh cooldown, when the trial fails</li>
 * </ul>
 *
 * <p>State is mutated only under this breaker's lock; the guarded operation runs outside it.
 * Listeners are notified after the lock is released.</p>
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    /**
     * Observer of state transitions.
     */
    @FunctionalInterface
    public interface Listener {
        void onStateChange(String breakerName, CircuitState from, CircuitState to);
    }

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant openUntil;
    private boolean trialInFlight;

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs the operation if the circuit admits it.
     *
     * @throws CircuitOpenException if the circuit is open or a half-open trial is in flight;
     *                              the operation is not invoked
     */
    public <T> T call(Supplier<T> operation) {
        boolean trial = acquirePermission();
        T result;
        try {
            result = operation.get();
        } catch (RuntimeException | Error e) {
            onFailure(trial, e);
            throw e;
        }
        onSuccess(trial);
        return result;
    }

    /**
     * Runs an operation with no result.
     */
    public void run(Runnable operation) {
        call(() -> {
            operation.run();
            return null;
        });
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int getFailureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            return new CircuitBreakerSnapshot(name, state, failureCount, config.failureThreshold(),
                    state == CircuitState.OPEN ? openUntil : null);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forces the breaker back to CLOSED with a zero failure count.
     */
    public void reset() {
        CircuitState from;
        lock.lock();
        try {
            from = state;
            state = CircuitState.CLOSED;
            failureCount = 0;
            openUntil = null;
            trialInFlight = false;
        } finally {
            lock.unlock();
        }
        if (from != CircuitState.CLOSED) {
            log.info("Circuit '{}' reset: {} -> CLOSED", name, from);
            notifyListeners(from, CircuitState.CLOSED);
        }
    }

    public void addListener(Listener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    private boolean acquirePermission() {
        boolean transitioned = false;
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return false;
                case OPEN: {
                    Instant now = clock.instant();
                    if (now.isBefore(openUntil)) {
                        throw new CircuitOpenException(name, Duration.between(now, openUntil));
                    }
                    state = CircuitState.HALF_OPEN;
                    trialInFlight = true;
                    transitioned = true;
                    return true;
                }
                case HALF_OPEN:
                default:
                    if (trialInFlight) {
                        throw new CircuitOpenException(name, Duration.ZERO);
                    }
                    trialInFlight = true;
                    return true;
            }
        } finally {
            lock.unlock();
            if (transitioned) {
                log.info("Circuit '{}' OPEN -> HALF_OPEN, admitting trial call", name);
                notifyListeners(CircuitState.OPEN, CircuitState.HALF_OPEN);
            }
        }
    }

    private void onSuccess(boolean trial) {
        boolean closed = false;
        lock.lock();
        try {
            if (trial) {
                trialInFlight = false;
                state = CircuitState.CLOSED;
                failureCount = 0;
                openUntil = null;
                closed = true;
            } else if (state == CircuitState.CLOSED) {
                failureCount = 0;
            }
        } finally {
            lock.unlock();
        }
        if (closed) {
            log.info("Circuit '{}' HALF_OPEN -> CLOSED after successful trial", name);
            notifyListeners(CircuitState.HALF_OPEN, CircuitState.CLOSED);
        }
    }

    private void onFailure(boolean trial, Throwable error) {
        CircuitState from = null;
        int failures;
        lock.lock();
        try {
            failureCount++;
            failures = failureCount;
            if (trial) {
                trialInFlight = false;
                from = state;
                open();
            } else if (state == CircuitState.CLOSED && failureCount >= config.failureThreshold()) {
                from = state;
                open();
            }
        } finally {
            lock.unlock();
        }
        log.debug("Circuit '{}' recorded failure {}/{}: {}",
                name, failures, config.failureThreshold(), error.toString());
        if (from != null) {
            log.warn("Circuit '{}' {} -> OPEN after {} failures, cooling down for {}",
                    name, from, failures, config.cooldown());
            notifyListeners(from, CircuitState.OPEN);
        }
    }

    // Caller holds the lock.
    private void open() {
        state = CircuitState.OPEN;
        openUntil = clock.instant().plus(config.cooldown());
    }

    private void notifyListeners(CircuitState from, CircuitState to) {
        for (Listener listener : listeners) {
            try {
                listener.onStateChange(name, from, to);
            } catch (RuntimeException e) {
                log.warn("Circuit '{}' listener failed on {} -> {}: {}", name, from, to, e.getMessage());
            }
        }
    }
}
