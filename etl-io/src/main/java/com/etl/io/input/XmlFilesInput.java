package com.etl.io.input;

import com.etl.core.Options;
import com.etl.core.Pipeline;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Every matching XML file (default {@code *.xml}) is one record: the document element, or the
 * first element the optional {@code root} XPath selects.
 */
public final class XmlFilesInput extends FileListInput {
  private final String root;

  public XmlFilesInput(Map<String, Object> options) {
    super(options, "*.xml");
    this.root = Options.string(options, "root", null);
  }

  @Override
  protected void read(Pipeline pipeline, Path file) throws IOException {
    Document doc = XmlTrees.parse(file);
    Element element = doc.getDocumentElement();
    if (root != null) {
      List<Element> selected = XmlTrees.select(doc, root);
      if (selected.isEmpty()) throw new IOException("Cannot find " + root + " in " + file);
      element = selected.get(0);
    }
    pipeline.record(XmlTrees.toRecord(element));
  }
}
