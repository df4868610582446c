package com.etl.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public final class SimpleMetricsRecorder implements MetricsRecorder {
    private final MeterRegistry registry;

    public SimpleMetricsRecorder() {
        this.registry = new SimpleMeterRegistry();
    }

    public SimpleMetricsRecorder(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onRecordRead(String pipeline) {
        counter(pipeline, "records.read").increment();
    }

    @Override
    public void onRecordFiltered(String pipeline) {
        counter(pipeline, "records.filtered").increment();
    }

    @Override
    public void onRecordWritten(String pipeline) {
        counter(pipeline, "records.written").increment();
    }

    @Override
    public void onWriteRejected(String pipeline) {
        counter(pipeline, "records.rejected").increment();
    }

    @Override
    public void onRunComplete(String pipeline, long records, long nanos) {
        Timer.builder(metric(pipeline, "run.duration"))
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void onRunError(String pipeline, Throwable t) {
        counter(pipeline, "run.errors").increment();
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    private Counter counter(String pipeline, String name) {
        return Counter.builder(metric(pipeline, name)).register(registry);
    }

    private static String metric(String pipeline, String name) {
        return "etl.pipeline." + pipeline + "." + name;
    }
}
