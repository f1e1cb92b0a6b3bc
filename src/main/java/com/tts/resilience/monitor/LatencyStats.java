package com.tts.resilience.monitor;

import java.util.Arrays;
import java.util.Collection;

/**
 * Aggregates over a set of samples. Percentiles use the nearest-rank method.
 *
 * @param count         number of samples
 * @param meanMillis    mean latency
 * @param p50Millis     median latency
 * @param p95Millis     95th percentile latency
 * @param p99Millis     99th percentile latency
 * @param maxMillis     maximum latency
 * @param meanRtf       mean real-time factor
 * @param cacheHitRatio fraction of samples served from cache
 */
public record LatencyStats(long count, double meanMillis, double p50Millis, double p95Millis,
                           double p99Millis, double maxMillis, double meanRtf, double cacheHitRatio) {

    public static LatencyStats empty() {
        return new LatencyStats(0, 0, 0, 0, 0, 0, 0, 0);
    }

    public static LatencyStats of(Collection<PerformanceSample> samples) {
        if (samples.isEmpty()) {
            return empty();
        }
        double[] latencies = new double[samples.size()];
        double latencySum = 0;
        double rtfSum = 0;
        long hits = 0;
        int i = 0;
        for (PerformanceSample sample : samples) {
            double ms = sample.latency().toNanos() / 1_000_000.0;
            latencies[i++] = ms;
            latencySum += ms;
            rtfSum += sample.realTimeFactor();
            if (sample.cacheHit()) {
                hits++;
            }
        }
        Arrays.sort(latencies);
        int n = latencies.length;
        return new LatencyStats(
                n,
                latencySum / n,
                percentile(latencies, 50),
                percentile(latencies, 95),
                percentile(latencies, 99),
                latencies[n - 1],
                rtfSum / n,
                (double) hits / n);
    }

    private static double percentile(double[] sorted, int p) {
        int rank = (int) Math.ceil(p / 100.0 * sorted.length);
        return sorted[Math.max(0, rank - 1)];
    }
}
