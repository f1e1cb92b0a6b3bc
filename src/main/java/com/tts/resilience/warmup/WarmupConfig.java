package com.tts.resilience.warmup;

/**
 * Warm-up scheduler configuration.
 *
 * @param concurrency number of worker threads
 * @param queueBound  maximum pending tasks; beyond it the lowest-priority tasks are dropped
 */
public record WarmupConfig(int concurrency, int queueBound) {

    public WarmupConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        if (queueBound <= 0) {
            throw new IllegalArgumentException("queueBound must be > 0");
        }
    }

    /**
     * Default configuration: 4 workers, 1,000 pending tasks.
     */
    public static WarmupConfig defaults() {
        return new WarmupConfig(4, 1_000);
    }
}
