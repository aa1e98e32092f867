package com.orderbook.common;

import org.HdrHistogram.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Latency tracking using HdrHistogram.
 * Record nanos; report percentiles on demand. Not thread-safe, like the book it measures.
 */
public final class LatencyStats {

    private static final Logger log = LoggerFactory.getLogger(LatencyStats.class);

    private final Histogram histogram;
    private final String name;

    public LatencyStats(String name) {
        this.name = name;
        // max 10 seconds, 3 sig figs
        this.histogram = new Histogram(10_000_000_000L, 3);
    }

    public void record(long latencyNanos) {
        // clock skew can yield a negative delta; clamp into the trackable range
        histogram.recordValue(Math.min(Math.max(latencyNanos, 0L), histogram.getHighestTrackableValue()));
    }

    public long count() {
        return histogram.getTotalCount();
    }

    public long percentileNanos(double percentile) {
        return histogram.getValueAtPercentile(percentile);
    }

    public long maxNanos() {
        return histogram.getMaxValue();
    }

    public void logAndReset() {
        long total = histogram.getTotalCount();
        if (total == 0) return;
        log.info("{} count={} p50={}µs p99={}µs p999={}µs max={}µs",
                name, total,
                micros(histogram.getValueAtPercentile(50)),
                micros(histogram.getValueAtPercentile(99)),
                micros(histogram.getValueAtPercentile(99.9)),
                micros(histogram.getMaxValue()));
        histogram.reset();
    }

    public String name() { return name; }

    private static String micros(long nanos) {
        return String.format("%.1f", nanos / 1_000.0);
    }
}
