package com.tts.resilience.tracing;

import java.util.Map;

/**
 * Tracing disabled: every span is the same inert instance.
 */
public class NoOpTracingService implements TracingService {

    private static final Span NO_OP_SPAN = new Span() {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void markSuccess() {
        }

        @Override
        public void recordFailure(Throwable t) {
        }

        @Override
        public void close() {
        }
    };

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return NO_OP_SPAN;
    }
}
