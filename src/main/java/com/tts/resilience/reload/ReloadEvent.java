package com.tts.resilience.reload;

import java.time.Instant;

/**
 * Passed to a {@link ReloadCallback} when a target fires.
 *
 * @param targetName       the target
 * @param pathState        the watched path as observed at firing time
 * @param coalescedChanges change notifications collapsed into this firing (0 for a manual reload
 *                         with nothing pending)
 * @param manual           whether {@code manualReload} triggered it
 * @param invalidated      cache entries invalidated before the callback ran
 * @param firedAt          when the firing started
 */
public record ReloadEvent(String targetName, PathState pathState, int coalescedChanges,
                          boolean manual, int invalidated, Instant firedAt) {
}
