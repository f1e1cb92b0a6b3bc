package com.tts.resilience.tracing;

import java.util.Map;

/**
 * Entry point for tracing loads and reloads. {@link NoOpTracingService} is the default,
 * so nothing requires a tracing backend on the classpath.
 */
public interface TracingService {

    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }
}
