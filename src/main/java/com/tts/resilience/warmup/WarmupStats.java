package com.tts.resilience.warmup;

/**
 * Warm-up counters since the scheduler was created.
 *
 * @param scheduled  tasks accepted into the queue
 * @param completed  tasks whose artifact is now cached
 * @param failed     tasks whose load failed or was cancelled
 * @param dropped    tasks dropped on queue overflow or discarded by {@code shutdownNow}
 * @param duplicates tasks ignored because the same cache/key was already pending
 * @param pending    tasks currently queued
 * @param active     tasks currently running
 */
public record WarmupStats(long scheduled, long completed, long failed, long dropped,
                          long duplicates, int pending, int active) {
}
