package com.tts.resilience.degradation;

import java.util.Objects;

/**
 * Input to a synthesis engine.
 *
 * @param text  text to speak (already normalized)
 * @param voice voice id, also used as the artifact id in performance samples
 * @param speed speaking rate multiplier
 */
public record SynthesisRequest(String text, String voice, double speed) {

    public SynthesisRequest {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(voice, "voice");
        if (speed <= 0) {
            throw new IllegalArgumentException("speed must be > 0");
        }
    }

    public static SynthesisRequest of(String text, String voice) {
        return new SynthesisRequest(text, voice, 1.0);
    }
}
