package com.codingbridge.common;

import org.HdrHistogram.Histogram;
import org.slf4j.Logger;

import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe latency tracking using HdrHistogram.
 * Record millis; report percentiles periodically.
 */
public final class LatencyStats {

    private final Histogram histogram;
    private final LongAdder count = new LongAdder();
    private final String name;

    public LatencyStats(String name) {
        this.name = name;
        // max 1 hour, 3 sig figs
        this.histogram = new Histogram(3_600_000L, 3);
    }

    public synchronized void record(long latencyMillis) {
        histogram.recordValue(Math.min(Math.max(latencyMillis, 0), histogram.getHighestTrackableValue()));
        count.increment();
    }

    public long count() {
        return count.sum();
    }

    public synchronized long percentile(double p) {
        return histogram.getValueAtPercentile(p);
    }

    public synchronized String summary() {
        return String.format("%s count=%d p50=%dms p90=%dms p99=%dms max=%dms",
                name, count.sum(),
                histogram.getValueAtPercentile(50),
                histogram.getValueAtPercentile(90),
                histogram.getValueAtPercentile(99),
                histogram.getMaxValue());
    }

    public synchronized void logAndReset(Logger log) {
        if (count.sum() == 0) return;
        log.info("[metrics] {}", summary());
        count.reset();
        histogram.reset();
    }
}
