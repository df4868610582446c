package com.etl.io.input;

import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DOM elements as record trees.
 *
 * <p>Attributes become {@code @name} keys, child elements become keys by tag name (a list when the
 * tag repeats), and non-blank text mixed with children is kept under {@code #text}. A child with
 * neither attributes nor children is just its text.
 */
public final class XmlTrees {
  public static final String TEXT = "#text";

  private XmlTrees() {}

  public static Document parse(Path file) throws IOException {
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setExpandEntityReferences(false);
      Document doc = factory.newDocumentBuilder().parse(file.toFile());
      doc.getDocumentElement().normalize();
      return doc;
    } catch (ParserConfigurationException | SAXException e) {
      throw new IOException("Unable to parse the XML in '" + file + "': " + e.getMessage(), e);
    }
  }

  /** Elements selected by an XPath expression, in document order. */
  public static List<Element> select(Document doc, String xpath) throws IOException {
    NodeList nodes;
    try {
      nodes = (NodeList) XPathFactory.newInstance().newXPath().evaluate(xpath, doc, XPathConstants.NODESET);
    } catch (XPathExpressionException e) {
      throw new IOException("Bad XPath '" + xpath + "': " + e.getMessage(), e);
    }
    List<Element> elements = new ArrayList<>(nodes.getLength());
    for (int i = 0; i < nodes.getLength(); i++) {
      if (nodes.item(i) instanceof Element element) elements.add(element);
    }
    return elements;
  }

  /** Always a map, so records can be addressed by key even when the element is a leaf. */
  public static Map<String, Object> toRecord(Element element) {
    Map<String, Object> tree = new LinkedHashMap<>();
    NamedNodeMap attributes = element.getAttributes();
    for (int i = 0; i < attributes.getLength(); i++) {
      Attr attr = (Attr) attributes.item(i);
      tree.put("@" + attr.getName(), attr.getValue());
    }

    StringBuilder text = new StringBuilder();
    NodeList children = element.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      if (child instanceof Element e) {
        add(tree, e.getTagName(), toTree(e));
      } else if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE) {
        text.append(child.getNodeValue());
      }
    }
    if (!text.toString().isBlank()) tree.put(TEXT, text.toString());
    return tree;
  }

  static Object toTree(Element element) {
    if (!element.hasAttributes() && !hasElementChildren(element)) return element.getTextContent();
    return toRecord(element);
  }

  @SuppressWarnings("unchecked")
  private static void add(Map<String, Object> tree, String name, Object value) {
    Object existing = tree.get(name);
    if (existing == null && !tree.containsKey(name)) {
      tree.put(name, value);
    } else if (existing instanceof List) {
      ((List<Object>) existing).add(value);
    } else {
      List<Object> list = new ArrayList<>();
      list.add(existing);
      list.add(value);
      tree.put(name, list);
    }
  }

  private static boolean hasElementChildren(Element element) {
    NodeList children = element.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      if (children.item(i) instanceof Element) return true;
    }
    return false;
  }
}
