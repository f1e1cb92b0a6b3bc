package com.tts.resilience.degradation;

import java.time.Instant;

/**
 * Point-in-time view of one degradable component.
 *
 * @param componentId  the component
 * @param healthy      whether the primary path is currently used
 * @param since        when the component last changed state
 * @param failureCount number of times the component has been marked failed
 * @param hasFallback  whether a fallback is registered
 */
public record ComponentHealth(String componentId, boolean healthy, Instant since,
                              long failureCount, boolean hasFallback) {
}
