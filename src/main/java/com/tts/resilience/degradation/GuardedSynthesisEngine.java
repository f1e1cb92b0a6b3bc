package com.tts.resilience.degradation;

import com.tts.resilience.monitor.PerformanceMonitor;
import com.tts.resilience.monitor.PerformanceSample;

import java.time.Duration;
import java.util.Objects;

/**
 * A {@link SynthesisEngine} that sends each request through a {@link DegradationController}
 * (primary engine, else fallback engine) and records a performance sample per call.
 */
public class GuardedSynthesisEngine implements SynthesisEngine {

    private final String componentId;
    private final SynthesisEngine primary;
    private final DegradationController controller;
    private final PerformanceMonitor monitor;
    private final ThreadLocal<SynthesisRequest> current = new ThreadLocal<>();

    public GuardedSynthesisEngine(String componentId, SynthesisEngine primary, SynthesisEngine fallback,
                                  DegradationController controller, PerformanceMonitor monitor) {
        this.componentId = Objects.requireNonNull(componentId, "componentId");
        this.primary = Objects.requireNonNull(primary, "primary");
        this.controller = Objects.requireNonNull(controller, "controller");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        if (fallback != null) {
            controller.registerFallback(componentId, () -> fallback.synthesize(current.get()));
        }
    }

    @Override
    public SynthesisResult synthesize(SynthesisRequest request) {
        long start = System.nanoTime();
        current.set(request);
        SynthesisResult result;
        try {
            result = controller.executeWithFallback(componentId, () -> primary.synthesize(request));
        } finally {
            current.remove();
        }
        Duration latency = Duration.ofNanos(System.nanoTime() - start);
        monitor.record(PerformanceSample.of(request.voice(), latency,
                realTimeFactor(latency, result.audioDuration()), result.cacheHit()));
        return result;
    }

    static double realTimeFactor(Duration latency, Duration audioDuration) {
        if (audioDuration.isZero() || audioDuration.isNegative()) {
            return 0.0;
        }
        return (double) latency.toNanos() / audioDuration.toNanos();
    }
}
