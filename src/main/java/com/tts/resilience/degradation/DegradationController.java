package com.tts.resilience.degradation;

import com.tts.resilience.breaker.CircuitBreaker;
import com.tts.resilience.breaker.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Routes calls to a component's primary path while it is healthy and to its registered
 * fallback otherwise.
 *
 * <p>A primary failure marks the component failed; it stays failed until
 * {@link #markHealthy(String)} (directly, or through {@link #breakerListener(String)}).
 * Errors are never turned into default values: without a fallback the primary's exception
 * is rethrown unchanged.</p>
 *
 * <p>Unknown components are healthy.</p>
 */
public class DegradationController {
    private static final Logger log = LoggerFactory.getLogger(DegradationController.class);

    private final Clock clock;
    private final ConcurrentMap<String, Supplier<?>> fallbacks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ComponentState> states = new ConcurrentHashMap<>();

    public DegradationController() {
        this(Clock.systemUTC());
    }

    public DegradationController(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Registers (or replaces) the fallback for a component. The fallback's result must be
     * of the type the component's primary path returns.
     */
    public void registerFallback(String componentId, Supplier<?> fallback) {
        fallbacks.put(componentId, Objects.requireNonNull(fallback, "fallback"));
        state(componentId);
        log.info("Fallback registered for component '{}'", componentId);
    }

    public void markFailed(String componentId) {
        ComponentState state = state(componentId);
        synchronized (state) {
            state.failures++;
            if (state.healthy) {
                state.healthy = false;
                state.since = clock.instant();
                log.warn("Component '{}' marked failed", componentId);
            }
        }
    }

    public void markHealthy(String componentId) {
        ComponentState state = state(componentId);
        synchronized (state) {
            if (!state.healthy) {
                state.healthy = true;
                state.since = clock.instant();
                log.info("Component '{}' marked healthy", componentId);
            }
        }
    }

    public boolean isHealthy(String componentId) {
        ComponentState state = states.get(componentId);
        if (state == null) {
            return true;
        }
        synchronized (state) {
            return state.healthy;
        }
    }

    /**
     * Runs the primary while the component is healthy, else the fallback.
     *
     * @throws ComponentUnavailableException if the component is failed and has no fallback
     * @throws RuntimeException              the primary's own exception when it fails and
     *                                       there is no fallback
     */
    @SuppressWarnings("unchecked")
    public <T> T executeWithFallback(String componentId, Supplier<T> primary) {
        RuntimeException primaryError = null;
        if (isHealthy(componentId)) {
            try {
                return primary.get();
            } catch (RuntimeException e) {
                log.error("Primary path failed for component '{}': {}", componentId, e.toString());
                markFailed(componentId);
                primaryError = e;
            }
        }
        Supplier<?> fallback = fallbacks.get(componentId);
        if (fallback == null) {
            if (primaryError != null) {
                throw primaryError;
            }
            throw new ComponentUnavailableException(componentId);
        }
        log.info("Using fallback for component '{}'", componentId);
        return (T) fallback.get();
    }

    /**
     * Returns a breaker listener that marks the component failed when the breaker opens
     * and healthy when it closes again.
     */
    public CircuitBreaker.Listener breakerListener(String componentId) {
        return (breakerName, from, to) -> {
            if (to == CircuitState.OPEN) {
                markFailed(componentId);
            } else if (to == CircuitState.CLOSED) {
                markHealthy(componentId);
            }
        };
    }

    public List<ComponentHealth> snapshot() {
        return states.entrySet().stream()
                .map(e -> {
                    ComponentState s = e.getValue();
                    synchronized (s) {
                        return new ComponentHealth(e.getKey(), s.healthy, s.since, s.failures,
                                fallbacks.containsKey(e.getKey()));
                    }
                })
                .sorted(Comparator.comparing(ComponentHealth::componentId))
                .toList();
    }

    private ComponentState state(String componentId) {
        Objects.requireNonNull(componentId, "componentId");
        return states.computeIfAbsent(componentId, id -> new ComponentState(clock.instant()));
    }

    private static final class ComponentState {
        boolean healthy = true;
        Instant since;
        long failures;

        ComponentState(Instant since) {
            this.since = since;
        }
    }
}
