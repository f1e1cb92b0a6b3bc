package com.tts.resilience.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forLoad("voices", "af_heart")) {
 *     log.info("artifact.loaded sizeBytes={}", size);
 * }
 * </pre>
 *
 * <p>MDC is thread-local: open the context on the thread that does the logging.</p>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forLoad(String cacheName, String key) {
        LogContext ctx = new LogContext();
        ctx.put("cache", cacheName);
        ctx.put("artifactKey", key);
        ctx.put("operation", "load");
        return ctx;
    }

    public static LogContext forWarmup(String taskId, String cacheName) {
        LogContext ctx = new LogContext();
        ctx.put("warmupTaskId", taskId);
        ctx.put("cache", cacheName);
        ctx.put("operation", "warmup");
        return ctx;
    }

    public static LogContext forReload(String targetName) {
        LogContext ctx = new LogContext();
        ctx.put("reloadTarget", targetName);
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("operation", "reload");
        return ctx;
    }

    public static LogContext forHealthCheck(String checkName) {
        LogContext ctx = new LogContext();
        ctx.put("healthCheck", checkName);
        ctx.put("operation", "health");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
