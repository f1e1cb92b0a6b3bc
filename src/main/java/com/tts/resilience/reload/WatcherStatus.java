package com.tts.resilience.reload;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of the watcher and each registered target.
 */
public record WatcherStatus(boolean running, Map<String, TargetStatus> targets) {

    public WatcherStatus {
        targets = Collections.unmodifiableMap(new LinkedHashMap<>(targets));
    }

    /**
     * @param state       current debounce state
     * @param path        watched path
     * @param watching    whether a change subscription is open
     * @param fired       successful firings
     * @param failed      firings whose invalidation or callback threw
     * @param lastFiredAt start of the latest firing, or null
     */
    public record TargetStatus(ReloadState state, Path path, boolean watching,
                               long fired, long failed, Instant lastFiredAt) {
    }
}
