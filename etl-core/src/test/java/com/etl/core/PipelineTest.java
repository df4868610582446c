package com.etl.core;

import com.etl.core.input.MemoryInput;
import com.etl.core.output.CallbackOutput;
import com.etl.core.output.MemoryOutput;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PipelineTest {

  @TempDir Path work;

  private static Map<Object, Object> row(Object... keyValues) {
    Map<Object, Object> row = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) row.put(keyValues[i], keyValues[i + 1]);
    return row;
  }

  /** Input and output that log their lifecycle calls into one list. */
  private static final class Tracing implements Input, Output {
    final List<String> calls = new ArrayList<>();
    final List<Object> records;
    boolean failOpen;

    Tracing(List<Object> records) { this.records = records; }

    @Override public void configure(Pipeline p) { calls.add("input.configure"); }
    @Override public void run(Pipeline p) { calls.add("input.run"); records.forEach(p::record); }
    @Override public void finish(Pipeline p) { calls.add("input.finish"); }
    @Override public void open(Pipeline p) throws IOException {
      calls.add("output.open");
      if (failOpen) throw new IOException("cannot open");
    }
    @Override public boolean write(Pipeline p, Map<String, Object> r) { calls.add("output.write"); return true; }
    @Override public void close(Pipeline p) { calls.add("output.close"); }
  }

  @Test
  void endToEndMapsRecordsInInputOrder() {
    MemoryOutput out = new MemoryOutput();
    Pipeline p = Pipeline.builder("e2e")
        .workIn(work)
        .input(new MemoryInput(List.of(row(1, "Field1", 2, "Field2"), row(1, "Field6", 2, "Field7"))))
        .mapping("un", Locator.key(1))
        .mapping("deux", Locator.key(2))
        .constant("tag", "X")
        .output(out)
        .build()
        .process();

    assertEquals(List.of(
        Map.of("un", "Field1", "deux", "Field2", "tag", "X"),
        Map.of("un", "Field6", "deux", "Field7", "tag", "X")), out.records());
    assertEquals(2, p.count());
    assertEquals(Pipeline.State.FINISHED, p.state());
  }

  @Test
  void multiplicityOfMatches() {
    MemoryOutput out = new MemoryOutput();
    Pipeline.builder("multi")
        .workIn(work)
        .input(new MemoryInput(List.of(row("a1", "x", "a2", "y", "a3", "z", "b1", "only"))))
        .mapping("none", Locator.pattern("^c"))
        .mapping("one", Locator.pattern("^b"))
        .mapping("three", Locator.pattern("^a"))
        .mapping("piped", Locator.pattern("^a"), "|")
        .output(out)
        .build()
        .process();

    Map<String, Object> written = out.records().get(0);
    assertTrue(written.containsKey("none"));
    assertNull(written.get("none"));
    assertEquals("only", written.get("one"));
    assertEquals("x; y; z", written.get("three"));
    assertEquals("x|y|z", written.get("piped"));
  }

  @Test
  void joinDropsMissingValues() {
    List<Object> values = new ArrayList<>();
    values.add("a");
    values.add(null);
    values.add("b");
    assertEquals("a; b", RecordTransformer.combine(values, "; "));
    assertNull(RecordTransformer.combine(new ArrayList<>(java.util.Arrays.asList(null, null)), "; "));
    assertNull(RecordTransformer.combine(List.of(), "; "));
    assertEquals(7, RecordTransformer.combine(List.of(7), "; "));
  }

  @Test
  void mappingOverridesConstant() {
    MemoryOutput out = new MemoryOutput();
    Pipeline.builder("override")
        .workIn(work)
        .input(new MemoryInput(List.of(row("v", 2))))
        .constant("X", 1)
        .mapping("X", Locator.key("v"))
        .output(out)
        .build()
        .process();
    assertEquals(2, out.records().get(0).get("X"));
  }

  @Test
  void constantsAloneAreAValidMapping() {
    MemoryOutput out = new MemoryOutput();
    Pipeline.builder("constants")
        .workIn(work)
        .input(new MemoryInput(List.of(row("a", 1))))
        .constant("kind", "fixed")
        .output(out)
        .build()
        .process();
    assertEquals(List.of(Map.of("kind", "fixed")), out.records());
  }

  @Test
  void filterDropsRecordsButTheyAreCounted() {
    MemoryOutput out = new MemoryOutput();
    Pipeline p = Pipeline.builder("filter")
        .workIn(work)
        .input(new MemoryInput(List.of(row("n", 1), row("n", 2))))
        .onRecord((pipeline, record) -> pipeline.count() != 1)
        .mapping("n", Locator.key("n"))
        .output(out)
        .build()
        .process();

    assertEquals(List.of(Map.of("n", 2)), out.records());
    assertEquals(2, p.count());
  }

  @Test
  void filterMayEditTheRecord() {
    MemoryOutput out = new MemoryOutput();
    Pipeline.builder("edit")
        .workIn(work)
        .input(new MemoryInput(List.of(row("n", "a"))))
        .onRecord((pipeline, record) -> {
          @SuppressWarnings("unchecked")
          Map<Object, Object> map = (Map<Object, Object>) record;
          map.put("n", "edited");
          return true;
        })
        .mapping("n", Locator.key("n"))
        .output(out)
        .build()
        .process();
    assertEquals("edited", out.records().get(0).get("n"));
  }

  @Test
  void rejectedWritesDoNotAbort() {
    List<Object> seen = new ArrayList<>();
    Pipeline p = Pipeline.builder("reject")
        .workIn(work)
        .input(new MemoryInput(List.of(row("n", 1), row("n", 2), row("n", 3))))
        .mapping("n", Locator.key("n"))
        .output(new CallbackOutput((pipeline, record) -> {
          seen.add(record.get("n"));
          return !record.get("n").equals(2);
        }))
        .build()
        .process();
    assertEquals(List.of(1, 2, 3), seen);
    assertEquals(3, p.count());
  }

  @Test
  void nestedStringsAreTrimmedBeforeTheFilterSeesThem() {
    List<Object> seenByFilter = new ArrayList<>();
    Pipeline.builder("trim")
        .workIn(work)
        .input(new MemoryInput(List.of(row("outer", row("inner", "  x  ")))))
        .onRecord((pipeline, record) -> seenByFilter.add(((Map<?, ?>) ((Map<?, ?>) record).get("outer")).get("inner")))
        .mapping("v", Locator.path("/outer/inner"))
        .output(new MemoryOutput())
        .build()
        .process();
    assertEquals(List.of("x"), seenByFilter);
  }

  @Test
  void trimmingCanBeTurnedOff() {
    MemoryOutput out = new MemoryOutput();
    Pipeline.builder("raw")
        .trimWhitespace(false)
        .workIn(work)
        .input(new MemoryInput(List.of(row("v", " x "))))
        .mapping("v", Locator.key("v"))
        .output(out)
        .build()
        .process();
    assertEquals(" x ", out.records().get(0).get("v"));
  }

  @Test
  void validationMessagesInOrder() {
    Pipeline p = new Pipeline("invalid");
    assertEquals("The working folder was not set", p.validate().reason());
    p.workIn(work);
    assertEquals("The \"input\" object was not set", p.validate().reason());
    p.input(new MemoryInput(List.of()));
    assertEquals("The \"output\" object was not set", p.validate().reason());
    p.output(new MemoryOutput());
    assertEquals("The mapping was not set", p.validate().reason());
    p.mapping("a", Locator.key("a"));
    assertTrue(p.validate().valid());
  }

  @Test
  void invalidPipelineOpensNothing() {
    Tracing tracing = new Tracing(List.of());
    Pipeline p = Pipeline.builder("invalid").workIn(work).input(tracing).output(tracing).build();

    InvalidPipelineException e = assertThrows(InvalidPipelineException.class, p::process);
    assertEquals("The mapping was not set", e.getMessage());
    assertEquals(List.of(), tracing.calls);
  }

  @Test
  void lifecycleOrderAndStatusEvents() {
    Tracing tracing = new Tracing(List.of(row("a", 1)));
    RecordingListener listener = new RecordingListener();
    Pipeline.builder("lifecycle")
        .statusListener(listener)
        .workIn(work)
        .input(tracing)
        .output(tracing)
        .mapping("a", Locator.key("a"))
        .build()
        .process();

    assertEquals(List.of("input.configure", "output.open", "input.run", "output.write", "output.close", "input.finish"),
        tracing.calls);
    assertEquals(List.of("START", "STATUS", "END"), listener.events);
  }

  @Test
  void failureClosesWhatWasOpenedAndPropagates() {
    Tracing tracing = new Tracing(List.of(row("a", 1), row("a", 2)));
    RecordingListener listener = new RecordingListener();
    Pipeline p = Pipeline.builder("failing")
        .statusListener(listener)
        .workIn(work)
        .input(tracing)
        .output(tracing)
        .mapping("a", Locator.rule("boom", (pipeline, record) -> {
          if (pipeline.count() == 2) throw new IllegalStateException("bad record");
          return 1;
        }))
        .build();

    PipelineException e = assertThrows(PipelineException.class, p::process);
    assertEquals(2, e.recordNumber());
    assertTrue(e.getMessage().contains("'failing'"));
    assertTrue(e.getMessage().contains("#2"));
    assertInstanceOf(IllegalStateException.class, e.getCause());
    assertEquals(List.of("input.configure", "output.open", "input.run", "output.write", "output.close", "input.finish"),
        tracing.calls);
    assertEquals("ERROR:" + e.getMessage(), listener.events.get(listener.events.size() - 1));
    assertEquals(Pipeline.State.FINISHED, p.state());
  }

  @Test
  void errorsStillCloseOutputAndFinishInput() {
    Tracing tracing = new Tracing(List.of(row("a", 1)));
    Pipeline p = Pipeline.builder("overflow")
        .workIn(work)
        .input(tracing)
        .output(tracing)
        .mapping("a", Locator.rule("deep", (pipeline, record) -> {
          throw new StackOverflowError();
        }))
        .statusListener(new RecordingListener())
        .build();

    assertThrows(StackOverflowError.class, p::process);
    assertEquals(List.of("input.configure", "output.open", "input.run", "output.close", "input.finish"), tracing.calls);
    assertEquals(Pipeline.State.FINISHED, p.state());
    assertThrows(IllegalStateException.class, () -> p.record(row("a", 2)));
  }

  @Test
  void openFailureFinishesInputButSkipsClose() {
    Tracing tracing = new Tracing(List.of(row("a", 1)));
    tracing.failOpen = true;
    Pipeline p = Pipeline.builder("open")
        .workIn(work)
        .input(tracing)
        .output(tracing)
        .mapping("a", Locator.key("a"))
        .statusListener(new RecordingListener())
        .build();

    PipelineException e = assertThrows(PipelineException.class, p::process);
    assertInstanceOf(IOException.class, e.getCause());
    assertEquals(List.of("input.configure", "output.open", "input.finish"), tracing.calls);
  }

  @Test
  void stateMachine() {
    Pipeline p = new Pipeline("states");
    assertEquals(Pipeline.State.UNCONFIGURED, p.state());
    p.workIn(work).input(new MemoryInput(List.of(row("a", 1)))).output(new MemoryOutput()).mapping("a", Locator.key("a"));
    assertEquals(Pipeline.State.CONFIGURED, p.state());

    p.process();
    assertEquals(Pipeline.State.FINISHED, p.state());
    assertThrows(IllegalStateException.class, p::process);

    p.constant("again", true);
    assertEquals(Pipeline.State.CONFIGURED, p.state());
    p.process();
    assertEquals(1, p.count());
  }

  @Test
  void reconfiguringWhileRunningFails() {
    List<Throwable> errors = new ArrayList<>();
    Pipeline.builder("reentrant")
        .workIn(work)
        .input(new MemoryInput(List.of(row("a", 1))))
        .onRecord((pipeline, record) -> {
          errors.add(assertThrows(IllegalStateException.class, () -> pipeline.constant("x", 1)));
          errors.add(assertThrows(IllegalStateException.class, pipeline::process));
          return true;
        })
        .mapping("a", Locator.key("a"))
        .output(new MemoryOutput())
        .build()
        .process();
    assertEquals(2, errors.size());
  }

  @Test
  void recordOutsideOfRunFails() {
    assertThrows(IllegalStateException.class, () -> new Pipeline("idle").record(Map.of()));
  }

  @Test
  void inputAliasesAreResetBetweenRuns() {
    MemoryInput input = new MemoryInput(List.of(row(1, "v"))).alias("Header", 1);
    MemoryOutput out = new MemoryOutput();
    Pipeline p = Pipeline.builder("aliases")
        .workIn(work).input(input).output(out).mapping("h", Locator.key("Header")).build();

    p.process();
    p.constant("rerun", true).process();
    assertEquals(1, p.aliases().count("Header"));
    assertEquals("v", out.records().get(0).get("h"));
  }

  @Test
  void inputAliasesMatchHeaderStyleNames() {
    MemoryInput input = new MemoryInput(List.of(
        row(1, "Field1", 2, "Field2", 3, "Field3", 4, "Field4"),
        row(1, "Field6", 2, "Field7", 3, "Field8", 4, "Field9")))
        .alias("Header1", 1).alias("Header2", 2).alias("Header3", 3).alias("Header4", 4);
    MemoryOutput out = new MemoryOutput();
    Pipeline.builder("headers")
        .workIn(work)
        .input(input)
        .mapping("first", Locator.key("Header1"))
        .mapping("rest", Locator.pattern("Header[34]"), ",")
        .output(out)
        .build()
        .process();

    assertEquals(Map.of("first", "Field1", "rest", "Field3,Field4"), out.records().get(0));
    assertEquals(Map.of("first", "Field6", "rest", "Field8,Field9"), out.records().get(1));
  }

  @Test
  void componentsByNameAndClass() {
    ComponentRegistry registry = ComponentRegistry.withDefaults();
    Pipeline p = Pipeline.builder("named")
        .registry(registry)
        .workIn(work)
        .input("Memory", Map.of("records", List.of(row("a", 1))))
        .output("+" + MemoryOutput.class.getName(), Map.of("sessionKey", "written"))
        .mapping("a", Locator.key("a"))
        .build()
        .process();

    assertEquals(List.of(Map.of("a", 1)), p.session().get("written"));
    IllegalArgumentException unknown = assertThrows(IllegalArgumentException.class, () -> p.chain().input("Nope").build());
    assertEquals("Unknown input: Nope", unknown.getMessage());
    assertThrows(IllegalArgumentException.class, () -> registry.createOutput("+java.lang.String", Map.of()));
  }

  @Test
  void workInAndDataInSearchDirectories() throws IOException {
    Files.createDirectories(work.resolve("Export-2024/Nested/DATA"));
    Files.createDirectories(work.resolve("Export-2024/Zdata"));

    Pipeline p = new Pipeline("dirs").workIn(work, "export-*");
    assertEquals(work.resolve("Export-2024").toAbsolutePath().normalize(), p.workIn());
    assertEquals(p.workIn(), p.dataIn());

    p.dataIn("data");
    assertEquals(p.workIn().resolve("Nested/DATA"), p.dataIn());
    p.dataIn("");
    assertEquals(p.workIn(), p.dataIn());

    assertThrows(IllegalArgumentException.class, () -> p.dataIn("missing"));
    assertThrows(IllegalStateException.class, () -> new Pipeline("no-work").dataIn("x"));
  }

  @Test
  void statusMessagesFromCollaborators() {
    RecordingListener listener = new RecordingListener();
    Pipeline p = Pipeline.builder("info").statusListener(listener).build();
    p.status(StatusType.INFO, "hello");
    assertEquals(List.of("INFO:hello"), listener.events);
  }
}
