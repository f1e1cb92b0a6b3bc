package com.tts.resilience.breaker;

import com.tts.resilience.metrics.MetricsService;
import com.tts.resilience.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Holds one {@link CircuitBreaker} per guarded operation kind. Breakers are created
 * lazily on first use and never share state across kinds.
 */
public class CircuitBreakerRegistry {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final CircuitBreakerConfig defaultConfig;
    private final Map<String, CircuitBreakerConfig> perKindConfig;
    private final MetricsService metrics;
    private final Clock clock;
    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final List<CircuitBreaker.Listener> listeners = new CopyOnWriteArrayList<>();

    public CircuitBreakerRegistry() {
        this(CircuitBreakerConfig.defaults(), Map.of(), new NoOpMetricsService(), Clock.systemUTC());
    }

    public CircuitBreakerRegistry(CircuitBreakerConfig defaultConfig,
                                  Map<String, CircuitBreakerConfig> perKindConfig,
                                  MetricsService metrics,
                                  Clock clock) {
        this.defaultConfig = defaultConfig;
        this.perKindConfig = Map.copyOf(perKindConfig);
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Returns the breaker for an operation kind, creating it on first use.
     */
    public CircuitBreaker breaker(String kind) {
        return breakers.computeIfAbsent(kind, this::create);
    }

    /**
     * Registers a listener on every existing breaker and on breakers created later.
     */
    public void addListener(CircuitBreaker.Listener listener) {
        listeners.add(listener);
        breakers.values().forEach(b -> b.addListener(listener));
    }

    public List<CircuitBreakerSnapshot> snapshots() {
        return breakers.values().stream()
                .map(CircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitBreakerSnapshot::name))
                .toList();
    }

    private CircuitBreaker create(String kind) {
        CircuitBreakerConfig config = perKindConfig.getOrDefault(kind, defaultConfig);
        CircuitBreaker breaker = new CircuitBreaker(kind, config, clock);
        breaker.addListener((name, from, to) ->
                metrics.recordCircuitTransition(name, from.name(), to.name()));
        listeners.forEach(breaker::addListener);
        log.info("Circuit breaker created for '{}': threshold={}, cooldown={}",
                kind, config.failureThreshold(), config.cooldown());
        return breaker;
    }
}
