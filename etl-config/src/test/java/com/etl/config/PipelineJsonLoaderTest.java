package com.etl.config;

import com.etl.core.ComponentRegistry;
import com.etl.core.FieldMapping;
import com.etl.core.Locator;
import com.etl.core.Pipeline;
import com.etl.io.StandardComponents;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PipelineJsonLoaderTest {

  @TempDir Path work;

  private static InputStream json(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  private static ComponentRegistry registry() {
    return StandardComponents.registry()
        .registerRule("fullName", (p, r) -> p.get(Locator.key("first"), r) + " " + p.get(Locator.key("last"), r))
        .registerFilter("skipFirst", (p, r) -> p.count() > 1);
  }

  @Test
  void loadsEveryMappingForm() throws IOException {
    Pipeline p = PipelineJsonLoader.load(json("""
        {
          "pipeline": "forms",
          "workIn": "%s",
          "input": "Memory",
          "output": {"type": "Memory", "sessionKey": "out"},
          "mapping": {
            "byName": "Name",
            "byIndex": 2,
            "byKey": {"key": "k"},
            "byPath": {"path": "/a/b"},
            "byPattern": {"pattern": "^phone", "flags": "i", "separator": "/"},
            "byRule": {"rule": "fullName"},
            "joined": [{"pattern": "x"}, "+"]
          },
          "constants": {"kind": "test"},
          "trimWhitespace": false
        }
        """.formatted(work.toString().replace("\\", "\\\\"))), registry());

    assertEquals("forms", p.name());
    assertEquals(work.toAbsolutePath().normalize(), p.workIn());
    assertFalse(p.trimWhitespace());
    assertEquals(Map.of("kind", "test"), p.constants());

    Map<String, FieldMapping> mapping = p.mapping();
    assertEquals(List.of("byName", "byIndex", "byKey", "byPath", "byPattern", "byRule", "joined"),
        List.copyOf(mapping.keySet()));
    assertEquals(Locator.key("Name"), mapping.get("byName").locator());
    assertEquals(Locator.key(2), mapping.get("byIndex").locator());
    assertEquals(Locator.key("k"), mapping.get("byKey").locator());
    assertEquals(Locator.path("/a/b"), mapping.get("byPath").locator());
    assertEquals("/", mapping.get("byPattern").separator());
    assertEquals(FieldMapping.DEFAULT_SEPARATOR, mapping.get("byPath").separator());
    assertEquals("+", mapping.get("joined").separator());
    assertInstanceOf(Locator.RuleLocator.class, mapping.get("byRule").locator());
    assertEquals(Pipeline.State.CONFIGURED, p.state());
  }

  @Test
  void processRunsTheFirstStage() throws IOException {
    Path definition = work.resolve("patients.json");
    Files.createDirectories(work.resolve("export"));
    Files.writeString(work.resolve("export/patients.csv"), "First,Last,Phone\nHomer,Simpson,555\nMarge,Simpson,556\n");
    Files.writeString(definition, """
        {
          "pipeline": "patients",
          "workIn": ".",
          "dataIn": "export",
          "input": {"type": "DelimitedText", "iname": "*.csv"},
          "aliases": {"first": "First", "last": {"key": "Last"}},
          "mapping": {"Name": {"rule": "fullName"}, "Phone": "C"},
          "onRecord": "skipFirst",
          "output": {"type": "JsonLines", "file": "out.jsonl"}
        }
        """);

    Pipeline p = PipelineJsonLoader.process(definition, registry());
    assertEquals(2, p.count());

    List<String> lines = Files.readAllLines(work.resolve("out.jsonl"));
    assertEquals(1, lines.size());
    assertEquals(Map.of("Name", "Marge Simpson", "Phone", "556"), new ObjectMapper().readValue(lines.get(0), Map.class));
  }

  @Test
  void chainedStagesShareTheSession() throws IOException {
    Files.writeString(work.resolve("first.csv"), "id\n1\n2\n");
    Files.writeString(work.resolve("second.json"), "[{\"id\": 3}]");

    Path definition = work.resolve("chain.json");
    Files.writeString(definition, """
        {
          "pipeline": "first",
          "workIn": ".",
          "session": {"batch": "b-1"},
          "input": {"type": "DelimitedText", "file": "first.csv"},
          "mapping": {"id": "id"},
          "output": {"type": "JsonLines", "file": "all.jsonl", "sessionKey": "target"},
          "chain": [
            {
              "pipeline": "second",
              "input": {"type": "JsonFiles", "iname": "second.json"},
              "mapping": {"id": "id"},
              "output": {"type": "Memory", "sessionKey": "seen"}
            }
          ]
        }
        """);

    Pipeline last = PipelineJsonLoader.process(definition, registry());
    assertEquals("second", last.name());
    assertEquals("b-1", last.session().get("batch"));
    assertEquals(work.resolve("all.jsonl").toAbsolutePath(), last.session().get("target"));
    assertEquals(List.of(Map.of("id", 3)), last.session().get("seen"));
    assertEquals(2, Files.readAllLines(work.resolve("all.jsonl")).size());
  }

  @Test
  void workInSearchesBelowARoot() throws IOException {
    Files.createDirectories(work.resolve("Export-2024"));
    Pipeline p = PipelineJsonLoader.load(json("""
        {"pipeline": "search", "workIn": {"root": "%s", "iname": "export-*"}}
        """.formatted(work.toString().replace("\\", "\\\\"))), registry());
    assertEquals(work.resolve("Export-2024").toAbsolutePath().normalize(), p.workIn());
  }

  @Test
  void definitionErrorsAreReportedBeforeAnythingRuns() {
    IOException missingName = assertThrows(IOException.class,
        () -> PipelineJsonLoader.parse(json("{\"input\": \"Memory\"}"), registry()));
    assertEquals("Missing required field: pipeline", missingName.getMessage());

    IOException unknownInput = assertThrows(IOException.class,
        () -> PipelineJsonLoader.parse(json("{\"pipeline\": \"x\", \"input\": \"Excel\"}"), registry()));
    assertTrue(unknownInput.getMessage().contains("unknown input 'Excel'"));

    IOException unknownRule = assertThrows(IOException.class, () -> PipelineJsonLoader.parse(json("""
        {"pipeline": "x", "chain": [{"mapping": {"a": {"rule": "nope"}}}]}
        """), registry()));
    assertTrue(unknownRule.getMessage().startsWith("stage 2.mapping.a"));

    assertThrows(IOException.class, () -> PipelineJsonLoader.parse(json("{\"pipeline\": \"x\", \"bogus\": 1}"), registry()));
    assertThrows(IOException.class, () -> PipelineJsonLoader.parse(json("""
        {"pipeline": "x", "mapping": {"a": {"key": "k", "path": "/k"}}}
        """), registry()));
    assertThrows(IOException.class, () -> PipelineJsonLoader.parse(json("""
        {"pipeline": "x", "mapping": {"a": {"pattern": "(", "flags": "i"}}}
        """), registry()));
    assertThrows(IOException.class, () -> PipelineJsonLoader.parse(json("{\"pipeline\": \"x\", \"chain\": {}}"), registry()));
    assertThrows(IOException.class, () -> PipelineJsonLoader.parse(json("[1, 2]"), registry()));
    assertThrows(IOException.class, () -> PipelineJsonLoader.parse(json("{\"pipeline\": "), registry()));
  }
}
