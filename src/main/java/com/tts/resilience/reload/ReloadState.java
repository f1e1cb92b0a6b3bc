package com.tts.resilience.reload;

/**
 * Per-target debounce state: IDLE → PENDING (timer running) → FIRING → IDLE.
 */
public enum ReloadState {
    IDLE,
    PENDING,
    FIRING
}
