package com.tts.resilience.tracing;

/**
 * A traced unit of work (an artifact load, a reload firing).
 * Ends when closed, so it fits try-with-resources:
 *
 * <pre>
 * try (Span span = tracing.startSpan("artifact.load", Map.of("cache", "voices"))) {
 *     LoadedArtifact artifact = loader.load(key);
 *     span.markSuccess();
 * } catch (LoadException e) {
 *     span.recordFailure(e);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void markSuccess();

    void recordFailure(Throwable t);

    @Override
    void close();
}
