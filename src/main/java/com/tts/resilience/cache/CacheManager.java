package com.tts.resilience.cache;

import com.tts.resilience.logging.LogContext;
import com.tts.resilience.metrics.MetricsService;
import com.tts.resilience.metrics.NoOpMetricsService;
import com.tts.resilience.monitor.PerformanceMonitor;
import com.tts.resilience.tracing.NoOpTracingService;
import com.tts.resilience.tracing.Span;
import com.tts.resilience.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the named artifact caches and provides single-flight cache-aside loading.
 *
 * <p>At most one loader invocation is in flight per (cache, key). Concurrent requesters
 * for the same key wait on the in-flight load's future and receive the same value or the
 * same exception instance. Failures are never cached, so the next request loads again.</p>
 *
 * <p>A completed load is written to the cache before its flight is removed, so a request
 * arriving at any point sees either the flight or the cached value.</p>
 *
 * <p>A cancelled or invalidated flight is retired: its result is never written to the cache,
 * but it stays registered until its loader returns. Requests arriving meanwhile wait for it
 * to settle and then load afresh, so a key never has two loaders running.</p>
 */
public class CacheManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CacheManager.class);

    private final ConcurrentMap<String, ArtifactCache<String, LoadedArtifact>> caches = new ConcurrentHashMap<>();
    private final ConcurrentMap<FlightKey, Flight> inFlight = new ConcurrentHashMap<>();
    private final PerformanceMonitor monitor;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final ExecutorService asyncExecutor;

    public CacheManager() {
        this(new PerformanceMonitor(), new NoOpMetricsService(), new NoOpTracingService());
    }

    public CacheManager(PerformanceMonitor monitor, MetricsService metrics, TracingService tracing) {
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.tracing = Objects.requireNonNull(tracing, "tracing");
        AtomicInteger threadCount = new AtomicInteger();
        this.asyncExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "cache-load-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Creates and registers a cache. A disabled config registers a cache that stores nothing.
     *
     * @throws IllegalStateException if a cache with this name already exists
     */
    public ArtifactCache<String, LoadedArtifact> register(String name, CacheConfig config) {
        ArtifactCache<String, LoadedArtifact> cache = config.enabled()
                ? new LruArtifactCache<>(name, config)
                : new NoOpArtifactCache<>(name);
        return register(cache);
    }

    /**
     * Registers a cache built by the caller.
     *
     * @throws IllegalStateException if a cache with this name already exists
     */
    public ArtifactCache<String, LoadedArtifact> register(ArtifactCache<String, LoadedArtifact> cache) {
        if (caches.putIfAbsent(cache.name(), cache) != null) {
            throw new IllegalStateException("Cache already registered: " + cache.name());
        }
        log.info("Cache '{}' registered ({})", cache.name(), cache.getClass().getSimpleName());
        return cache;
    }

    /**
     * Returns a registered cache.
     *
     * @throws IllegalArgumentException if no cache has this name
     */
    public ArtifactCache<String, LoadedArtifact> cache(String name) {
        ArtifactCache<String, LoadedArtifact> cache = caches.get(name);
        if (cache == null) {
            throw new IllegalArgumentException("Unknown cache: " + name);
        }
        return cache;
    }

    public Set<String> cacheNames() {
        return new TreeSet<>(caches.keySet());
    }

    /**
     * Returns the cached artifact, or loads it on the calling thread. If a load for the same
     * key is already in flight, waits for it instead of invoking the loader. If that load
     * was cancelled or invalidated, waits for its loader to return and then loads afresh.
     *
     * @throws LoadCancelledException if the in-flight load was cancelled or the wait interrupted
     * @throws RuntimeException       whatever the loader (or its retry/breaker wrapping) threw
     */
    public LoadedArtifact getOrLoad(String cacheName, String key, ArtifactLoader loader) {
        ArtifactCache<String, LoadedArtifact> cache = cache(cacheName);
        FlightKey flightKey = new FlightKey(cacheName, key);
        while (true) {
            CacheLookup<LoadedArtifact> lookup = lookup(cache, key);
            if (lookup.hit()) {
                return lookup.value();
            }
            Flight flight = new Flight();
            Flight existing = inFlight.putIfAbsent(flightKey, flight);
            if (existing == null) {
                runLoad(cache, flightKey, loader, flight);
                return await(flight.result, flightKey);
            }
            if (existing.joinable()) {
                log.debug("Cache '{}' joining in-flight load of {}", cacheName, key);
                return await(existing.result, flightKey);
            }
            log.debug("Cache '{}' waiting for retired load of {} to return", cacheName, key);
            awaitSettled(existing, flightKey);
        }
    }

    /**
     * Asynchronous variant of {@link #getOrLoad}. A winning load runs on the manager's
     * load threads. The returned future is a copy: cancelling it does not affect other waiters.
     */
    public CompletableFuture<LoadedArtifact> getOrLoadAsync(String cacheName, String key, ArtifactLoader loader) {
        ArtifactCache<String, LoadedArtifact> cache = cache(cacheName);
        CacheLookup<LoadedArtifact> lookup = lookup(cache, key);
        if (lookup.hit()) {
            return CompletableFuture.completedFuture(lookup.value());
        }
        FlightKey flightKey = new FlightKey(cacheName, key);
        Flight flight = new Flight();
        Flight existing = inFlight.putIfAbsent(flightKey, flight);
        if (existing != null) {
            if (existing.joinable()) {
                return existing.result.copy();
            }
            return existing.settled.thenCompose(ignored -> getOrLoadAsync(cacheName, key, loader));
        }
        try {
            asyncExecutor.execute(() -> runLoad(cache, flightKey, loader, flight));
        } catch (RejectedExecutionException e) {
            inFlight.remove(flightKey, flight);
            flight.result.completeExceptionally(new LoadCancelledException("Cache manager is closed", e));
            flight.settled.complete(null);
        }
        return flight.result.copy();
    }

    /**
     * Removes keys from a cache, or every entry when {@code keys} is empty. Loads of those
     * keys still in flight are retired so their results are not cached.
     *
     * @return the number of entries removed
     */
    public int invalidateCascade(String cacheName, Collection<String> keys) {
        ArtifactCache<String, LoadedArtifact> cache = cache(cacheName);
        Set<String> targeted = new HashSet<>(keys);
        int retired = 0;
        for (Map.Entry<FlightKey, Flight> entry : inFlight.entrySet()) {
            FlightKey flightKey = entry.getKey();
            if (flightKey.cacheName().equals(cacheName)
                    && (targeted.isEmpty() || targeted.contains(flightKey.key()))) {
                entry.getValue().markStale();
                retired++;
            }
        }
        int removed;
        if (keys.isEmpty()) {
            removed = (int) cache.stats().entryCount();
            cache.clear();
        } else {
            removed = 0;
            for (String key : keys) {
                if (cache.invalidate(key)) {
                    removed++;
                }
            }
        }
        log.info("Cache '{}' invalidated {} entries and {} in-flight loads (requested: {})",
                cacheName, removed, retired, keys.isEmpty() ? "all" : keys.size());
        return removed;
    }

    /**
     * Cancels an in-flight load. Every waiter receives a {@link LoadCancelledException};
     * the loader's eventual result is discarded. The load stays in flight until its loader
     * returns.
     *
     * @return true if a load was in flight and had not already been cancelled or cached
     */
    public boolean cancel(String cacheName, String key) {
        FlightKey flightKey = new FlightKey(cacheName, key);
        Flight flight = inFlight.get(flightKey);
        if (flight == null || !flight.cancel(new LoadCancelledException("Load cancelled: " + flightKey))) {
            return false;
        }
        log.info("Cancelled in-flight load {}", flightKey);
        return true;
    }

    /**
     * Cancels every in-flight load.
     *
     * @return the number of loads cancelled
     */
    public int cancelAll() {
        int cancelled = 0;
        for (FlightKey flightKey : new ArrayList<>(inFlight.keySet())) {
            if (cancel(flightKey.cacheName(), flightKey.key())) {
                cancelled++;
            }
        }
        return cancelled;
    }

    /**
     * Whether a loader is running for the key, including a cancelled one that has not returned.
     */
    public boolean isInFlight(String cacheName, String key) {
        return inFlight.containsKey(new FlightKey(cacheName, key));
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public CacheStats stats(String cacheName) {
        return cache(cacheName).stats();
    }

    /**
     * Returns stats for every registered cache, keyed and ordered by cache name.
     */
    public Map<String, CacheStats> allStats() {
        Map<String, CacheStats> all = new TreeMap<>();
        caches.forEach((name, cache) -> all.put(name, cache.stats()));
        return all;
    }

    /**
     * Sweeps expired entries from every cache.
     *
     * @return the total number of entries removed
     */
    public int cleanupExpired() {
        int removed = 0;
        for (ArtifactCache<String, LoadedArtifact> cache : caches.values()) {
            removed += cache.cleanupExpired();
        }
        return removed;
    }

    public PerformanceMonitor monitor() {
        return monitor;
    }

    /**
     * Cancels in-flight loads and stops the async load threads.
     */
    @Override
    public void close() {
        int cancelled = cancelAll();
        asyncExecutor.shutdownNow();
        log.info("CacheManager closed, {} in-flight loads cancelled", cancelled);
    }

    private CacheLookup<LoadedArtifact> lookup(ArtifactCache<String, LoadedArtifact> cache, String key) {
        CacheLookup<LoadedArtifact> lookup = cache.get(key);
        if (lookup.hit()) {
            monitor.recordCacheHit(cache.name());
            metrics.recordCacheHit(cache.name());
            log.debug("Cache '{}' hit: {}", cache.name(), key);
        } else {
            monitor.recordCacheMiss(cache.name());
            metrics.recordCacheMiss(cache.name());
            log.debug("Cache '{}' miss: {}", cache.name(), key);
        }
        return lookup;
    }

    private void runLoad(ArtifactCache<String, LoadedArtifact> cache, FlightKey flightKey,
                         ArtifactLoader loader, Flight flight) {
        try {
            // another flight may have completed between our miss and winning the race
            CacheLookup<LoadedArtifact> recheck = cache.peek(flightKey.key());
            if (recheck.hit()) {
                inFlight.remove(flightKey, flight);
                flight.result.complete(recheck.value());
                return;
            }
            load(cache, flightKey, loader, flight);
        } finally {
            flight.settled.complete(null);
        }
    }

    private void load(ArtifactCache<String, LoadedArtifact> cache, FlightKey flightKey,
                      ArtifactLoader loader, Flight flight) {
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forLoad(cache.name(), flightKey.key());
             Span span = tracing.startSpan("cache.load",
                     Map.of("cache", cache.name(), "artifact.key", flightKey.key()))) {
            try {
                LoadedArtifact artifact = loader.load(flightKey.key());
                Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                metrics.recordLoad(cache.name(), elapsed, true);
                span.setAttribute("artifact.size", artifact.sizeEstimate());
                Set<String> evicted = flight.commit(cache, flightKey.key(), artifact);
                if (evicted == null) {
                    log.info("Load of {} was retired while running, result not cached", flightKey);
                } else {
                    if (!evicted.isEmpty()) {
                        metrics.recordEvictions(cache.name(), evicted.size());
                    }
                    log.debug("artifact.loaded sizeBytes={} durationMs={}", artifact.sizeEstimate(), elapsed.toMillis());
                }
                span.markSuccess();
                inFlight.remove(flightKey, flight);
                flight.result.complete(artifact);
            } catch (RuntimeException | Error e) {
                metrics.recordLoad(cache.name(), Duration.ofNanos(System.nanoTime() - start), false);
                span.recordFailure(e);
                log.warn("Load of {} failed: {}", flightKey, e.toString());
                inFlight.remove(flightKey, flight);
                flight.result.completeExceptionally(e);
            }
        }
    }

    private void awaitSettled(Flight flight, FlightKey flightKey) {
        try {
            flight.settled.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LoadCancelledException("Interrupted while waiting for " + flightKey, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Flight settlement failed for " + flightKey, e);
        }
    }

    private LoadedArtifact await(CompletableFuture<LoadedArtifact> flight, FlightKey flightKey) {
        try {
            return flight.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LoadCancelledException("Interrupted while waiting for " + flightKey, e);
        } catch (CancellationException e) {
            throw new LoadCancelledException("Load cancelled: " + flightKey, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new LoadException("Load of " + flightKey + " failed", cause);
        }
    }

    /**
     * One loader invocation and everyone waiting on it. {@code settled} completes when the
     * loader has returned, whatever happened to {@code result}.
     */
    static final class Flight {
        final CompletableFuture<LoadedArtifact> result = new CompletableFuture<>();
        final CompletableFuture<Void> settled = new CompletableFuture<>();
        private boolean cancelled;
        private boolean stale;
        private boolean committed;

        synchronized boolean joinable() {
            return !cancelled && !stale;
        }

        synchronized boolean cancel(LoadCancelledException cause) {
            if (cancelled || committed) {
                return false;
            }
            cancelled = true;
            result.completeExceptionally(cause);
            return true;
        }

        synchronized void markStale() {
            stale = true;
        }

        /**
         * Writes the loaded value unless the flight was retired first.
         *
         * @return the evicted keys, or null if the value was not written
         */
        synchronized Set<String> commit(ArtifactCache<String, LoadedArtifact> cache, String key,
                                        LoadedArtifact artifact) {
            if (cancelled || stale) {
                return null;
            }
            committed = true;
            return cache.put(key, artifact, artifact.sizeEstimate());
        }
    }

    /**
     * Identity of one in-flight load.
     */
    record FlightKey(String cacheName, String key) {
        FlightKey {
            Objects.requireNonNull(cacheName, "cacheName");
            Objects.requireNonNull(key, "key");
        }

        @Override
        public String toString() {
            return cacheName + "/" + key;
        }
    }
}
