package com.etl.metrics;

import com.etl.core.Locator;
import com.etl.core.Pipeline;
import com.etl.core.input.MemoryInput;
import com.etl.core.output.CallbackOutput;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SimpleMetricsRecorderTest {

  @TempDir Path work;

  @AfterEach
  void restoreDefault() {
    Metrics.setRecorder(new SimpleMetricsRecorder());
  }

  @Test
  void countsReadFilteredWrittenAndRejected() {
    SimpleMetricsRecorder recorder = new SimpleMetricsRecorder();
    Metrics.setRecorder(recorder);

    Pipeline.builder("metered")
        .workIn(work)
        .input(new MemoryInput(List.of(Map.of("n", 1), Map.of("n", 2), Map.of("n", 3), Map.of("n", 4))))
        .onRecord((p, r) -> p.count() != 1)
        .mapping("n", Locator.key("n"))
        .output(new CallbackOutput((p, r) -> !r.get("n").equals(2)))
        .build()
        .process();

    MeterRegistry registry = recorder.registry();
    assertEquals(4.0, registry.get("etl.pipeline.metered.records.read").counter().count());
    assertEquals(1.0, registry.get("etl.pipeline.metered.records.filtered").counter().count());
    assertEquals(2.0, registry.get("etl.pipeline.metered.records.written").counter().count());
    assertEquals(1.0, registry.get("etl.pipeline.metered.records.rejected").counter().count());
    assertEquals(1, registry.get("etl.pipeline.metered.run.duration").timer().count());
  }
}
