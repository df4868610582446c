package com.etl.metrics;

import io.micrometer.core.instrument.MeterRegistry;

public interface MetricsRecorder {
    void onRecordRead(String pipeline);
    void onRecordFiltered(String pipeline);
    void onRecordWritten(String pipeline);
    void onWriteRejected(String pipeline);
    void onRunComplete(String pipeline, long records, long nanos);
    void onRunError(String pipeline, Throwable t);
    MeterRegistry registry();
}
