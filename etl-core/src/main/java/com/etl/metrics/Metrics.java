package com.etl.metrics;

import java.util.Objects;

/**
 * Process-wide recorder that every {@link com.etl.core.Pipeline} reports its runs and records to.
 * Swap it with {@link #setRecorder} to send the counters to another Micrometer registry.
 */
public final class Metrics {
    private static volatile MetricsRecorder recorder = new SimpleMetricsRecorder();

    private Metrics() {}

    public static MetricsRecorder recorder() {
        return recorder;
    }

    public static void setRecorder(MetricsRecorder r) {
        recorder = Objects.requireNonNull(r, "recorder");
    }
}
