package com.tts.resilience.degradation;

import java.time.Duration;
import java.util.Objects;

/**
 * Output of a synthesis engine.
 *
 * @param audio         encoded audio
 * @param audioDuration playback length of the audio
 * @param cacheHit      whether the audio was served from a cache
 */
public record SynthesisResult(byte[] audio, Duration audioDuration, boolean cacheHit) {

    public SynthesisResult {
        Objects.requireNonNull(audio, "audio");
        Objects.requireNonNull(audioDuration, "audioDuration");
    }
}
