package com.etl.io.input;

import com.etl.core.Options;
import com.etl.core.Pipeline;
import org.w3c.dom.Element;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * One XML file; every element selected by the {@code root} XPath is a record (see {@link XmlTrees}
 * for the record shape).
 */
public final class XmlInput extends FileInput {
  private final String root;
  private List<Element> elements = List.of();

  public XmlInput(Map<String, Object> options) {
    super(options, "*.xml");
    this.root = Options.required(options, "root", String.class);
  }

  @Override
  protected void open(Pipeline pipeline, Path file) throws IOException {
    elements = XmlTrees.select(XmlTrees.parse(file), root);
    if (elements.isEmpty()) throw new IOException("Cannot find " + root + " in " + file);
  }

  @Override
  public void run(Pipeline pipeline) {
    for (Element element : elements) pipeline.record(XmlTrees.toRecord(element));
  }

  @Override
  public void finish(Pipeline pipeline) {
    elements = List.of();
  }
}
