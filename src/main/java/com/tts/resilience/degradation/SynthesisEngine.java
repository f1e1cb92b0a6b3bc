package com.tts.resilience.degradation;

/**
 * The speech engine call this core guards. Implemented outside this library: a full-feature
 * neural engine as the primary path, a reduced-feature or cached-response engine as the fallback.
 */
@FunctionalInterface
public interface SynthesisEngine {

    SynthesisResult synthesize(SynthesisRequest request);
}
