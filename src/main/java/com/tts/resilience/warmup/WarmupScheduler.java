package com.tts.resilience.warmup;

import com.tts.resilience.breaker.CircuitBreakerRegistry;
import com.tts.resilience.cache.CacheManager;
import com.tts.resilience.cache.LoadCancelledException;
import com.tts.resilience.cache.ResilientLoader;
import com.tts.resilience.logging.LogContext;
import com.tts.resilience.metrics.MetricsService;
import com.tts.resilience.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Best-effort background loader that fills caches ahead of demand.
 *
 * <p>Pending tasks are ordered by priority (higher first), then by the order they were
 * scheduled. {@link #schedule(WarmupTask)} never blocks: when the queue exceeds its bound
 * the lowest-priority pending task is dropped and logged, which may be the task just
 * offered.</p>
 *
 * <p>Each worker loads through {@link CacheManager#getOrLoad} with the task's loader wrapped
 * in the shared retry policy and the breaker for the task's cache, so a flaky loader opens
 * its breaker instead of holding every worker in backoff.</p>
 */
public class WarmupScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WarmupScheduler.class);

    private static final Comparator<QueuedTask> ORDER =
            Comparator.comparingInt((QueuedTask q) -> q.task.priority()).reversed()
                    .thenComparingLong(q -> q.sequence);

    private enum RunState { NEW, RUNNING, DRAINING, STOPPED }

    private final WarmupConfig config;
    private final CacheManager cacheManager;
    private final RetryPolicy retryPolicy;
    private final CircuitBreakerRegistry breakers;
    private final MetricsService metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition idle = lock.newCondition();
    private final TreeSet<QueuedTask> queue = new TreeSet<>(ORDER);
    private final Set<String> pendingIds = new HashSet<>();
    private final Set<WarmupTask> running = Collections.newSetFromMap(new IdentityHashMap<>());

    private ExecutorService workers;
    private RunState runState = RunState.NEW;
    private long sequence;
    private long scheduled;
    private long completed;
    private long failed;
    private long dropped;
    private long duplicates;

    public WarmupScheduler(WarmupConfig config, CacheManager cacheManager, RetryPolicy retryPolicy,
                           CircuitBreakerRegistry breakers, MetricsService metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.cacheManager = Objects.requireNonNull(cacheManager, "cacheManager");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.breakers = Objects.requireNonNull(breakers, "breakers");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Starts the worker threads. Tasks scheduled before this call wait in the queue.
     */
    public void start() {
        lock.lock();
        try {
            if (runState != RunState.NEW) {
                throw new IllegalStateException("WarmupScheduler already started");
            }
            runState = RunState.RUNNING;
            AtomicInteger count = new AtomicInteger();
            workers = Executors.newFixedThreadPool(config.concurrency(), r -> {
                Thread t = new Thread(r, "warmup-worker-" + count.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            for (int i = 0; i < config.concurrency(); i++) {
                workers.execute(this::workerLoop);
            }
        } finally {
            lock.unlock();
        }
        log.info("WarmupScheduler started: concurrency={}, queueBound={}", config.concurrency(), config.queueBound());
    }

    /**
     * Enqueues a task without blocking.
     *
     * @return true if the task is pending; false if it was dropped, duplicated a pending
     * task, or the scheduler is shutting down
     */
    public boolean schedule(WarmupTask task) {
        Objects.requireNonNull(task, "task");
        QueuedTask victim = null;
        lock.lock();
        try {
            if (runState == RunState.DRAINING || runState == RunState.STOPPED) {
                log.warn("Warm-up task {} rejected: scheduler is shut down", task.id());
                return false;
            }
            if (!pendingIds.add(task.id())) {
                duplicates++;
                log.debug("Warm-up task {} already pending", task.id());
                return false;
            }
            QueuedTask queued = new QueuedTask(task, ++sequence);
            queue.add(queued);
            scheduled++;
            if (queue.size() > config.queueBound()) {
                victim = queue.pollLast();
                pendingIds.remove(victim.task.id());
                dropped++;
            }
            notEmpty.signal();
            if (victim == queued) {
                victim = null;
                logDropped(task);
                return false;
            }
        } finally {
            lock.unlock();
        }
        if (victim != null) {
            logDropped(victim.task);
        }
        return true;
    }

    /**
     * Schedules each task in turn.
     *
     * @return the number of tasks left pending
     */
    public int scheduleAll(Collection<WarmupTask> tasks) {
        int accepted = 0;
        for (WarmupTask task : tasks) {
            if (schedule(task)) {
                accepted++;
            }
        }
        return accepted;
    }

    public WarmupStats stats() {
        lock.lock();
        try {
            return new WarmupStats(scheduled, completed, failed, dropped, duplicates, queue.size(), running.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until the queue is empty and no task is running.
     *
     * @return true if idle was reached before the timeout
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (!queue.isEmpty() || !running.isEmpty()) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = idle.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops accepting tasks; workers finish everything already queued, then exit.
     */
    public void shutdown() {
        lock.lock();
        try {
            if (runState == RunState.STOPPED || runState == RunState.DRAINING) {
                return;
            }
            runState = workers == null ? RunState.STOPPED : RunState.DRAINING;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
        if (workers != null) {
            workers.shutdown();
        }
        log.info("WarmupScheduler shutting down, draining {} pending tasks", stats().pending());
    }

    /**
     * Discards pending tasks, cancels the loads workers are running (their single-flight
     * waiters receive a {@link LoadCancelledException}) and interrupts the workers.
     *
     * @return the number of pending tasks discarded
     */
    public int shutdownNow() {
        int discarded;
        Set<WarmupTask> inFlight;
        lock.lock();
        try {
            runState = RunState.STOPPED;
            discarded = queue.size();
            dropped += discarded;
            queue.clear();
            pendingIds.clear();
            inFlight = new HashSet<>(running);
            notEmpty.signalAll();
            idle.signalAll();
        } finally {
            lock.unlock();
        }
        for (WarmupTask task : inFlight) {
            cacheManager.cancel(task.cacheName(), task.key());
        }
        if (workers != null) {
            workers.shutdownNow();
        }
        log.info("WarmupScheduler stopped: {} pending tasks discarded, {} running loads cancelled",
                discarded, inFlight.size());
        return discarded;
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return workers == null || workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        shutdownNow();
    }

    private void workerLoop() {
        while (true) {
            WarmupTask task = take();
            if (task == null) {
                return;
            }
            try {
                execute(task);
            } finally {
                finish(task);
            }
        }
    }

    private WarmupTask take() {
        lock.lock();
        try {
            while (queue.isEmpty()) {
                if (runState != RunState.RUNNING) {
                    return null;
                }
                notEmpty.await();
            }
            if (runState == RunState.STOPPED) {
                return null;
            }
            WarmupTask task = queue.pollFirst().task;
            pendingIds.remove(task.id());
            running.add(task);
            return task;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } finally {
            lock.unlock();
        }
    }

    private void execute(WarmupTask task) {
        try (LogContext ctx = LogContext.forWarmup(task.id(), task.cacheName())) {
            long start = System.nanoTime();
            try {
                ResilientLoader loader = new ResilientLoader("warmup:" + task.cacheName(), task.loader(),
                        retryPolicy, breakers.breaker(task.cacheName()));
                cacheManager.getOrLoad(task.cacheName(), task.key(), loader);
                record(task, true);
                log.debug("Warmed {} (priority={}, cost={}) in {}ms", task.id(), task.priority(),
                        task.estimatedCost(), Duration.ofNanos(System.nanoTime() - start).toMillis());
            } catch (LoadCancelledException e) {
                record(task, false);
                metrics.recordWarmupTask(task.cacheName(), "cancelled");
                log.info("Warm-up of {} cancelled", task.id());
            } catch (RuntimeException e) {
                record(task, false);
                metrics.recordWarmupTask(task.cacheName(), "failed");
                log.warn("Warm-up of {} failed: {}", task.id(), e.toString());
            }
        }
    }

    private void record(WarmupTask task, boolean success) {
        lock.lock();
        try {
            if (success) {
                completed++;
            } else {
                failed++;
            }
        } finally {
            lock.unlock();
        }
        if (success) {
            metrics.recordWarmupTask(task.cacheName(), "completed");
        }
    }

    private void finish(WarmupTask task) {
        lock.lock();
        try {
            running.remove(task);
            if (queue.isEmpty() && running.isEmpty()) {
                idle.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    private void logDropped(WarmupTask task) {
        metrics.recordWarmupTask(task.cacheName(), "dropped");
        log.warn("Warm-up queue full ({}), dropped {} (priority={})",
                config.queueBound(), task.id(), task.priority());
    }

    private static final class QueuedTask {
        final WarmupTask task;
        final long sequence;

        QueuedTask(WarmupTask task, long sequence) {
            this.task = task;
            this.sequence = sequence;
        }
    }
}
