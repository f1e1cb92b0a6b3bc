package com.tts.resilience.health;

import com.tts.resilience.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry of health checks that can be queried for aggregate system health.
 *
 * <p>Every probe runs on a probe thread under {@link HealthConfig#timeout()}; a probe that
 * does not finish in time is interrupted and reported DOWN with {@code timedOut=true}, so a
 * hung dependency never stalls the caller. {@link #runAll()} runs at most
 * {@link HealthConfig#parallelism()} probes at once, on a probe pool of the same size.</p>
 *
 * <p>A probe that ignores the interrupt keeps its thread. Until it returns, its check is not
 * started again and every run reports it DOWN with {@code timedOut=true} and
 * {@code stillRunning=true}.</p>
 *
 * <p>Aggregation:</p>
 * <ul>
 *   <li>Only enabled checks count; disabling a check keeps its registration</li>
 *   <li>Any DOWN check → overall status is DOWN (unhealthy)</li>
 *   <li>Any DEGRADED check (and none DOWN) → overall status is DEGRADED (still healthy)</li>
 *   <li>All UP → overall status is UP</li>
 * </ul>
 */
public class HealthCheckRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final HealthConfig config;
    private final Clock clock;
    private final Map<String, Registration> checks = new LinkedHashMap<>();
    private final ExecutorService probeExecutor;
    private final ExecutorService runAllExecutor;

    public HealthCheckRegistry() {
        this(HealthConfig.defaults(), Clock.systemUTC());
    }

    public HealthCheckRegistry(HealthConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.probeExecutor = Executors.newFixedThreadPool(config.parallelism(), daemonThreads("health-probe-"));
        this.runAllExecutor = Executors.newFixedThreadPool(config.parallelism(), daemonThreads("health-runner-"));
    }

    public void register(HealthCheck check) {
        register(check, true, config.defaultMinInterval());
    }

    /**
     * Registers a check.
     *
     * @param minInterval {@link #runAll()} reuses a result younger than this
     * @throws IllegalStateException if a check with the same name is already registered
     */
    public void register(HealthCheck check, boolean enabled, Duration minInterval) {
        Objects.requireNonNull(check, "check");
        synchronized (checks) {
            if (checks.containsKey(check.getName())) {
                throw new IllegalStateException("Health check already registered: " + check.getName());
            }
            checks.put(check.getName(), new Registration(check, enabled, minInterval));
        }
        log.info("Health check '{}' registered (enabled={}, minInterval={})", check.getName(), enabled, minInterval);
    }

    public boolean unregister(String name) {
        synchronized (checks) {
            return checks.remove(name) != null;
        }
    }

    public void enable(String name) {
        registration(name).enabled = true;
        log.info("Health check '{}' enabled", name);
    }

    public void disable(String name) {
        registration(name).enabled = false;
        log.info("Health check '{}' disabled", name);
    }

    public boolean isEnabled(String name) {
        return registration(name).enabled;
    }

    /**
     * Runs one check now, regardless of whether it is enabled, under the hard timeout.
     */
    public HealthStatus run(String name) {
        Registration reg = registration(name);
        HealthStatus result = execute(reg);
        reg.record(result);
        return result;
    }

    /**
     * Runs every enabled check with bounded parallelism and returns the aggregate.
     * A check whose previous result is younger than its minimum interval is not re-run.
     */
    public HealthReport runAll() {
        List<Registration> enabled = enabledRegistrations();
        Map<String, Future<HealthStatus>> pending = new LinkedHashMap<>();
        Map<String, HealthStatus> results = new LinkedHashMap<>();
        Instant now = clock.instant();
        for (Registration reg : enabled) {
            HealthStatus cached = reg.freshResult(now);
            if (cached != null) {
                results.put(reg.check.getName(), cached);
                continue;
            }
            try {
                pending.put(reg.check.getName(), runAllExecutor.submit(() -> {
                    HealthStatus result = execute(reg);
                    reg.record(result);
                    return result;
                }));
            } catch (RejectedExecutionException e) {
                results.put(reg.check.getName(), HealthStatus.down("Health registry is closed"));
            }
        }
        for (Map.Entry<String, Future<HealthStatus>> entry : pending.entrySet()) {
            results.put(entry.getKey(), awaitRunner(entry.getKey(), entry.getValue()));
        }

        // keep registration order in the report
        Map<String, HealthStatus> ordered = new LinkedHashMap<>();
        for (Registration reg : enabled) {
            ordered.put(reg.check.getName(), results.get(reg.check.getName()));
        }
        HealthReport report = HealthReport.of(ordered, clock.instant());
        if (!report.healthy()) {
            log.warn("Health aggregate is {}: {}", report.status(), unhealthyNames(report));
        }
        return report;
    }

    /**
     * Aggregates the last known result of every enabled check without running anything.
     * Checks that have never run are left out and do not affect the aggregate.
     */
    public HealthReport status() {
        Map<String, HealthStatus> results = new LinkedHashMap<>();
        for (Registration reg : enabledRegistrations()) {
            HealthStatus last = reg.lastResult;
            if (last != null) {
                results.put(reg.check.getName(), last);
            }
        }
        return HealthReport.of(results, clock.instant());
    }

    /**
     * Returns the number of registered health checks.
     */
    public int size() {
        synchronized (checks) {
            return checks.size();
        }
    }

    public List<String> names() {
        synchronized (checks) {
            return List.copyOf(checks.keySet());
        }
    }

    /**
     * Interrupts running probes and stops the probe threads.
     */
    @Override
    public void close() {
        runAllExecutor.shutdownNow();
        probeExecutor.shutdownNow();
        log.info("HealthCheckRegistry closed");
    }

    private HealthStatus execute(Registration reg) {
        HealthCheck check = reg.check;
        try (LogContext ctx = LogContext.forHealthCheck(check.getName())) {
            if (!reg.probing.compareAndSet(false, true)) {
                log.warn("Health check '{}' is still running from an earlier timed-out run", check.getName());
                return stamp(HealthStatus.timedOut(config.timeout()).withDetail("stillRunning", true));
            }
            AtomicBoolean claimed = new AtomicBoolean();
            Future<HealthStatus> future;
            try {
                future = probeExecutor.submit(() -> {
                    if (!claimed.compareAndSet(false, true)) {
                        return null;
                    }
                    try {
                        return check.check();
                    } finally {
                        reg.probing.set(false);
                    }
                });
            } catch (RejectedExecutionException e) {
                reg.probing.set(false);
                return stamp(HealthStatus.down("Health registry is closed"));
            }
            try {
                HealthStatus result = future.get(config.timeout().toMillis(), TimeUnit.MILLISECONDS);
                if (result == null) {
                    return stamp(HealthStatus.down("Health check returned no status"));
                }
                log.debug("Health check '{}' -> {}", check.getName(), result.status());
                return stamp(result);
            } catch (TimeoutException e) {
                abandon(reg, future, claimed);
                log.warn("Health check '{}' timed out after {}ms", check.getName(), config.timeout().toMillis());
                return stamp(HealthStatus.timedOut(config.timeout()));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                log.warn("Health check '{}' threw: {}", check.getName(), cause.toString());
                return stamp(HealthStatus.down("Health check failed: " + cause.getMessage())
                        .withDetail("error", cause.getClass().getSimpleName()));
            } catch (InterruptedException e) {
                abandon(reg, future, claimed);
                Thread.currentThread().interrupt();
                return stamp(HealthStatus.down("Health check interrupted"));
            }
        }
    }

    /**
     * Interrupts a probe. One that never started is released here; a started one releases
     * its check when it returns.
     */
    private static void abandon(Registration reg, Future<HealthStatus> future, AtomicBoolean claimed) {
        future.cancel(true);
        if (claimed.compareAndSet(false, true)) {
            reg.probing.set(false);
        }
    }

    private HealthStatus awaitRunner(String name, Future<HealthStatus> runner) {
        try {
            return runner.get();
        } catch (ExecutionException e) {
            return stamp(HealthStatus.down("Health check failed: " + e.getCause().getMessage()));
        } catch (InterruptedException e) {
            runner.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for health check '{}'", name);
            return stamp(HealthStatus.down("Health check interrupted"));
        }
    }

    private HealthStatus stamp(HealthStatus status) {
        return status.withCheckedAt(clock.instant());
    }

    private List<Registration> enabledRegistrations() {
        List<Registration> enabled = new ArrayList<>();
        synchronized (checks) {
            for (Registration reg : checks.values()) {
                if (reg.enabled) {
                    enabled.add(reg);
                }
            }
        }
        return enabled;
    }

    private Registration registration(String name) {
        synchronized (checks) {
            Registration reg = checks.get(name);
            if (reg == null) {
                throw new IllegalArgumentException("Unknown health check: " + name);
            }
            return reg;
        }
    }

    private static List<String> unhealthyNames(HealthReport report) {
        List<String> names = new ArrayList<>();
        report.checks().forEach((name, result) -> {
            if (!result.isHealthy()) {
                names.add(name);
            }
        });
        return names;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger count = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class Registration {
        final HealthCheck check;
        final Duration minInterval;
        volatile boolean enabled;
        volatile HealthStatus lastResult;
        final AtomicBoolean probing = new AtomicBoolean();

        Registration(HealthCheck check, boolean enabled, Duration minInterval) {
            this.check = check;
            this.enabled = enabled;
            this.minInterval = minInterval != null ? minInterval : Duration.ZERO;
        }

        void record(HealthStatus result) {
            lastResult = result;
        }

        HealthStatus freshResult(Instant now) {
            HealthStatus last = lastResult;
            if (last == null || minInterval.isZero()) {
                return null;
            }
            return Duration.between(last.checkedAt(), now).compareTo(minInterval) < 0 ? last : null;
        }
    }
}
