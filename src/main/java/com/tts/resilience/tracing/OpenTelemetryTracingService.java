package com.tts.resilience.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * OpenTelemetry-backed {@link TracingService}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new OTelSpan(builder.startSpan());
    }

    private static final class OTelSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        private OTelSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void markSuccess() {
            delegate.setStatus(StatusCode.OK);
        }

        @Override
        public void recordFailure(Throwable t) {
            delegate.recordException(t);
            delegate.setStatus(StatusCode.ERROR, t.getClass().getSimpleName());
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
