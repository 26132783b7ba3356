package com.gentoro.docgen.xml;

import com.gentoro.docgen.exception.SerializationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * Parsing and navigation helpers over the DOM of a documentation fragment.
 *
 * <p>Documentation comments are untrusted input, so DOCTYPE declarations and external entities
 * are rejected.
 */
public final class XmlFragments {
  private XmlFragments() {}

  public static Element parse(String xml) {
    if (xml == null || xml.isBlank()) {
      throw new SerializationException("Documentation fragment is empty");
    }
    try {
      DocumentBuilder builder = newFactory().newDocumentBuilder();
      Document document = builder.parse(new InputSource(new StringReader(xml)));
      return document.getDocumentElement();
    } catch (ParserConfigurationException | SAXException | IOException e) {
      throw new SerializationException("Failed to parse documentation fragment", e);
    }
  }

  private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
    DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(false);
    factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
    factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
    factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
    factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
    factory.setXIncludeAware(false);
    factory.setExpandEntityReferences(false);
    return factory;
  }

  /** All child elements of {@code parent}, in document order. */
  public static List<Element> children(Element parent) {
    List<Element> result = new ArrayList<>();
    NodeList nodes = parent.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      Node node = nodes.item(i);
      if (node.getNodeType() == Node.ELEMENT_NODE) {
        result.add((Element) node);
      }
    }
    return result;
  }

  /** Direct child elements with the given tag name, in document order. */
  public static List<Element> children(Element parent, String tagName) {
    return children(parent).stream().filter(e -> tagName.equals(e.getTagName())).toList();
  }

  public static Optional<Element> firstChild(Element parent, String tagName) {
    return children(parent).stream().filter(e -> tagName.equals(e.getTagName())).findFirst();
  }

  /** Every element below {@code parent} with the given tag name, in document order. */
  public static List<Element> descendants(Element parent, String tagName) {
    List<Element> result = new ArrayList<>();
    NodeList nodes = parent.getElementsByTagName(tagName);
    for (int i = 0; i < nodes.getLength(); i++) {
      result.add((Element) nodes.item(i));
    }
    return result;
  }

  /** Attribute value, or {@code null} when the attribute is absent. */
  public static String attribute(Element element, String name) {
    return element.hasAttribute(name) ? element.getAttribute(name) : null;
  }

  /** Concatenated text of the element and its descendants; never {@code null}. */
  public static String text(Element element) {
    String content = element.getTextContent();
    return content == null ? "" : content;
  }
}
