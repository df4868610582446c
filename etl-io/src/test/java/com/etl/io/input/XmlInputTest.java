package com.etl.io.input;

import com.etl.core.Locator;
import com.etl.core.Pipeline;
import com.etl.core.output.MemoryOutput;
import com.etl.io.StandardComponents;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class XmlInputTest {

  @TempDir Path work;

  private static final String PATIENTS = """
      <export>
        <patient id="1">
          <name>Homer</name>
          <phone>555-1234</phone>
          <phone>555-9876</phone>
        </patient>
        <patient id="2">
          <name>  Marge  </name>
          <address><city>Springfield</city></address>
        </patient>
      </export>
      """;

  @Test
  void everySelectedElementIsARecord() throws IOException {
    Files.writeString(work.resolve("patients.xml"), PATIENTS);
    MemoryOutput out = new MemoryOutput();
    Pipeline.builder("xml")
        .registry(StandardComponents.registry())
        .workIn(work)
        .input("Xml", Map.of("root", "/export/patient"))
        .mapping("id", Locator.key("@id"))
        .mapping("name", Locator.key("name"))
        .mapping("phones", Locator.path("/phone/*"))
        .mapping("city", Locator.path("//city"))
        .output(out)
        .build()
        .process();

    assertEquals(2, out.records().size());
    Map<String, Object> homer = out.records().get(0);
    assertEquals("1", homer.get("id"));
    assertEquals("Homer", homer.get("name"));
    assertEquals("555-1234; 555-9876", homer.get("phones"));
    assertNull(homer.get("city"));

    Map<String, Object> marge = out.records().get(1);
    assertEquals("Marge", marge.get("name"));
    assertEquals("Springfield", marge.get("city"));
  }

  @Test
  void unmatchedRootFailsTheRun() throws IOException {
    Files.writeString(work.resolve("patients.xml"), PATIENTS);
    Pipeline p = Pipeline.builder("xml")
        .registry(StandardComponents.registry())
        .workIn(work)
        .input("Xml", Map.of("root", "/export/doctor"))
        .mapping("id", Locator.key("@id"))
        .output(new MemoryOutput())
        .build();
    RuntimeException e = assertThrows(RuntimeException.class, p::process);
    assertTrue(e.getMessage().contains("/export/doctor"));
  }

  @Test
  void rootIsRequired() {
    assertThrows(IllegalArgumentException.class, () -> new XmlInput(Map.of()));
  }

  @Test
  void treeShape() throws IOException {
    Path file = work.resolve("t.xml");
    Files.writeString(file, "<r a=\"x\">text<c>1</c><c>2</c><d b=\"y\"/></r>");
    Map<String, Object> tree = XmlTrees.toRecord(XmlTrees.parse(file).getDocumentElement());
    assertEquals(Map.of("@a", "x", "c", List.of("1", "2"), "d", Map.of("@b", "y"), "#text", "text"), tree);
  }
}
