package com.tts.resilience.reload;

import com.tts.resilience.cache.CacheManager;
import com.tts.resilience.logging.LogContext;
import com.tts.resilience.metrics.MetricsService;
import com.tts.resilience.metrics.NoOpMetricsService;
import com.tts.resilience.tracing.NoOpTracingService;
import com.tts.resilience.tracing.Span;
import com.tts.resilience.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Watches model and voice files and reloads them after a quiet period.
 *
 * <p>Each target moves IDLE → PENDING → FIRING → IDLE. A change while PENDING restarts the
 * target's single debounce timer, so a burst of changes fires once, after the last one.
 * Firing invalidates the target's cache keys and then runs its callback with the path as
 * observed at that moment.</p>
 *
 * <p>One consumer task per target reads its {@link ChangeSubscription}. A failing callback or
 * a failing poll is logged and the watcher keeps running. Subscriptions are closed on every
 * exit path of the consumer and again by {@link #stop()}.</p>
 */
public class HotReloadWatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HotReloadWatcher.class);

    private static final Duration POLL_INTERVAL = Duration.ofMillis(250);

    private final CacheManager cacheManager;
    private final FileChangeSource changeSource;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final Clock clock;
    private final ConcurrentMap<String, TargetRuntime> targets = new ConcurrentHashMap<>();
    private final ScheduledThreadPoolExecutor timers;
    private final ExecutorService consumers;
    private volatile boolean running;

    public HotReloadWatcher(CacheManager cacheManager) {
        this(cacheManager, new WatchServiceChangeSource(), new NoOpMetricsService(),
                new NoOpTracingService(), Clock.systemUTC());
    }

    public HotReloadWatcher(CacheManager cacheManager, FileChangeSource changeSource,
                            MetricsService metrics, TracingService tracing, Clock clock) {
        this.cacheManager = Objects.requireNonNull(cacheManager, "cacheManager");
        this.changeSource = Objects.requireNonNull(changeSource, "changeSource");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.tracing = Objects.requireNonNull(tracing, "tracing");
        this.clock = Objects.requireNonNull(clock, "clock");
        AtomicInteger timerCount = new AtomicInteger();
        this.timers = new ScheduledThreadPoolExecutor(2, r -> {
            Thread t = new Thread(r, "reload-debounce-" + timerCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.timers.setRemoveOnCancelPolicy(true);
        AtomicInteger consumerCount = new AtomicInteger();
        this.consumers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "reload-watch-" + consumerCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Adds a target. If the watcher is running, watching starts immediately.
     *
     * @throws IllegalStateException if a target with the same name exists
     * @throws ReloadException       if the path cannot be watched
     */
    public void register(ReloadTarget target) {
        TargetRuntime rt = new TargetRuntime(target);
        if (targets.putIfAbsent(target.getName(), rt) != null) {
            throw new IllegalStateException("Reload target already registered: " + target.getName());
        }
        log.info("Reload target '{}' registered: {} (debounce={})",
                target.getName(), target.getPath(), target.getDebounce());
        if (running) {
            try {
                startWatching(rt);
            } catch (ReloadException e) {
                targets.remove(target.getName(), rt);
                throw e;
            }
        }
    }

    /**
     * Removes a target, cancelling its pending timer and releasing its subscription.
     */
    public boolean unregister(String name) {
        TargetRuntime rt = targets.remove(name);
        if (rt == null) {
            return false;
        }
        rt.release();
        log.info("Reload target '{}' unregistered", name);
        return true;
    }

    /**
     * Opens a subscription and a consumer task for every registered target.
     *
     * @throws ReloadException if a path cannot be watched; targets already started stay watched
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        for (TargetRuntime rt : targets.values()) {
            startWatching(rt);
        }
        log.info("HotReloadWatcher started with {} targets", targets.size());
    }

    /**
     * Stops watching: cancels timers and consumers and closes every subscription.
     * Registrations are kept, so {@link #start()} may be called again.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        for (TargetRuntime rt : targets.values()) {
            rt.release();
        }
        log.info("HotReloadWatcher stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Fires a target now, bypassing (and cancelling) any pending debounce.
     *
     * @return true if invalidation and callback succeeded
     * @throws IllegalArgumentException if no target has this name
     */
    public boolean manualReload(String name) {
        TargetRuntime rt = targets.get(name);
        if (rt == null) {
            throw new IllegalArgumentException("Unknown reload target: " + name);
        }
        int coalesced;
        synchronized (rt) {
            rt.cancelTimer();
            coalesced = rt.pendingChanges;
            rt.pendingChanges = 0;
        }
        return fire(rt, coalesced, true);
    }

    /**
     * Fires every target manually.
     *
     * @return success per target name
     */
    public Map<String, Boolean> reloadAll() {
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (String name : new ArrayList<>(targets.keySet())) {
            try {
                results.put(name, manualReload(name));
            } catch (IllegalArgumentException e) {
                // unregistered concurrently
                log.debug("Reload target '{}' vanished during reloadAll", name);
            }
        }
        return results;
    }

    public ReloadState state(String name) {
        TargetRuntime rt = targets.get(name);
        if (rt == null) {
            throw new IllegalArgumentException("Unknown reload target: " + name);
        }
        synchronized (rt) {
            return rt.state;
        }
    }

    public WatcherStatus status() {
        Map<String, WatcherStatus.TargetStatus> statuses = new LinkedHashMap<>();
        List<TargetRuntime> sorted = new ArrayList<>(targets.values());
        sorted.sort((a, b) -> a.target.getName().compareTo(b.target.getName()));
        for (TargetRuntime rt : sorted) {
            synchronized (rt) {
                statuses.put(rt.target.getName(), new WatcherStatus.TargetStatus(rt.state,
                        rt.target.getPath(), rt.subscription != null && rt.subscription.isOpen(),
                        rt.fired, rt.failed, rt.lastFiredAt));
            }
        }
        return new WatcherStatus(running, statuses);
    }

    /**
     * Stops watching and shuts down the watcher's threads. The watcher cannot be restarted.
     */
    @Override
    public void close() {
        stop();
        timers.shutdownNow();
        consumers.shutdownNow();
    }

    /**
     * Handles one change notification for a target: IDLE or PENDING becomes PENDING with a
     * fresh timer; the previous timer, if any, is cancelled.
     */
    void onChange(TargetRuntime rt, FileChange change) {
        int pending;
        synchronized (rt) {
            pending = ++rt.pendingChanges;
            rt.cancelTimer();
            long generation = ++rt.generation;
            rt.timer = timers.schedule(() -> fireFromTimer(rt, generation),
                    rt.target.getDebounce().toNanos(), TimeUnit.NANOSECONDS);
            if (rt.state == ReloadState.IDLE) {
                rt.state = ReloadState.PENDING;
            }
        }
        log.debug("Reload target '{}' change {} {} (pending={})",
                rt.target.getName(), change.kind(), change.path(), pending);
    }

    private void startWatching(TargetRuntime rt) {
        ChangeSubscription subscription;
        try {
            subscription = changeSource.subscribe(rt.target.getPath());
        } catch (IOException e) {
            throw new ReloadException("Cannot watch " + rt.target.getPath() + " for target '"
                    + rt.target.getName() + "'", e);
        }
        synchronized (rt) {
            rt.subscription = subscription;
            rt.consumer = consumers.submit(() -> consume(rt, subscription));
        }
    }

    private void consume(TargetRuntime rt, ChangeSubscription subscription) {
        try (subscription) {
            while (running && subscription.isOpen() && !Thread.currentThread().isInterrupted()) {
                FileChange change;
                try {
                    change = subscription.poll(POLL_INTERVAL);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (RuntimeException e) {
                    log.warn("Reload target '{}' poll failed: {}", rt.target.getName(), e.toString());
                    continue;
                }
                if (change != null && (change.kind() == FileChange.Kind.OVERFLOW
                        || rt.target.accepts(change.path()))) {
                    onChange(rt, change);
                }
            }
        } finally {
            log.debug("Reload target '{}' stopped watching", rt.target.getName());
        }
    }

    private void fireFromTimer(TargetRuntime rt, long generation) {
        int coalesced;
        synchronized (rt) {
            if (generation != rt.generation || rt.timer == null) {
                return;
            }
            rt.timer = null;
            coalesced = rt.pendingChanges;
            rt.pendingChanges = 0;
        }
        fire(rt, coalesced, false);
    }

    private boolean fire(TargetRuntime rt, int coalesced, boolean manual) {
        ReloadTarget target = rt.target;
        rt.fireLock.lock();
        try (LogContext ctx = LogContext.forReload(target.getName());
             Span span = tracing.startSpan("reload.fire", Map.of(
                     "reload.target", target.getName(), "reload.manual", String.valueOf(manual)))) {
            span.setAttribute("reload.path", target.getPath().toString());
            span.setAttribute("reload.changes", coalesced);
            Instant firedAt = clock.instant();
            synchronized (rt) {
                rt.state = ReloadState.FIRING;
                rt.lastFiredAt = firedAt;
            }
            boolean success;
            try {
                int invalidated = target.getCacheName() == null ? 0
                        : cacheManager.invalidateCascade(target.getCacheName(), target.getInvalidationKeys());
                ReloadEvent event = new ReloadEvent(target.getName(),
                        PathState.observe(target.getPath(), clock), coalesced, manual, invalidated, firedAt);
                target.getCallback().onReload(event);
                success = true;
                span.markSuccess();
                log.info("Reload target '{}' fired (manual={}, changes={}, invalidated={})",
                        target.getName(), manual, coalesced, invalidated);
            } catch (Exception | Error e) {
                success = false;
                span.recordFailure(e);
                log.warn("Reload target '{}' failed: {}", target.getName(), e.toString(), e);
            }
            metrics.recordReload(target.getName(), success);
            synchronized (rt) {
                if (success) {
                    rt.fired++;
                } else {
                    rt.failed++;
                }
                rt.state = rt.timer != null ? ReloadState.PENDING : ReloadState.IDLE;
            }
            return success;
        } finally {
            rt.fireLock.unlock();
        }
    }

    /**
     * Mutable per-target state; guarded by the instance monitor except {@link #fireLock},
     * which serializes firings of one target.
     */
    static final class TargetRuntime {
        final ReloadTarget target;
        final ReentrantLock fireLock = new ReentrantLock();
        ReloadState state = ReloadState.IDLE;
        ScheduledFuture<?> timer;
        long generation;
        int pendingChanges;
        ChangeSubscription subscription;
        Future<?> consumer;
        long fired;
        long failed;
        Instant lastFiredAt;

        TargetRuntime(ReloadTarget target) {
            this.target = target;
        }

        // Caller holds the monitor.
        void cancelTimer() {
            if (timer != null) {
                timer.cancel(false);
                timer = null;
            }
        }

        synchronized void release() {
            cancelTimer();
            pendingChanges = 0;
            if (state == ReloadState.PENDING) {
                state = ReloadState.IDLE;
            }
            if (consumer != null) {
                consumer.cancel(true);
                consumer = null;
            }
            if (subscription != null) {
                subscription.close();
                subscription = null;
            }
        }
    }
}
