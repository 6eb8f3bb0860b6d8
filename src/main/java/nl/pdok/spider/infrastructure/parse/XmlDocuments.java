package nl.pdok.spider.infrastructure.parse;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import javax.xml.XMLConstants;
import javax.xml.namespace.NamespaceContext;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import nl.pdok.spider.logging.Logs;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * <strong>What:</strong> DOM parsing and navigation helpers for catalogue and capability documents.
 * <p><strong>Why:</strong> Readers extract fields tolerantly; every helper returns the empty string or an empty list
 * when a node is missing instead of failing.</p>
 * <p><strong>Security:</strong> External entities and external DTDs are never loaded.</p>
 * <p><strong>Thread-safety:</strong> Stateless; a new parser and XPath instance is created per call because
 * neither is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class XmlDocuments {
  private static final int SNIPPET_BYTES = 256;

  private XmlDocuments() {
    // Utility
  }

  /**
   * Parses an XML document with namespace awareness.
   *
   * @param xml document text
   * @return parsed document
   * @throws DocumentParseException when the text is not well-formed XML
   */
  public static Document parse(String xml) throws DocumentParseException {
    Objects.requireNonNull(xml, "xml");
    try {
      DocumentBuilder builder = newFactory().newDocumentBuilder();
      builder.setErrorHandler(new DefaultHandler());
      return builder.parse(new InputSource(new StringReader(xml)));
    } catch (SAXException ex) {
      throw new DocumentParseException(
          "Malformed XML document: " + ex.getMessage() + " [" + Logs.truncate(xml, SNIPPET_BYTES) + "]", ex);
    } catch (ParserConfigurationException | IOException ex) {
      throw new DocumentParseException("Unable to parse XML document", ex);
    }
  }

  /**
   * Creates an XPath instance that resolves the given prefix bindings.
   *
   * @param namespaces prefix to namespace URI bindings
   * @return new XPath instance
   */
  public static XPath xpath(Map<String, String> namespaces) {
    XPath xpath = XPathFactory.newInstance().newXPath();
    xpath.setNamespaceContext(new MapNamespaceContext(Map.copyOf(namespaces)));
    return xpath;
  }

  /**
   * Evaluates an expression to the trimmed string value of its first node.
   *
   * @param xpath configured XPath
   * @param expression XPath expression
   * @param context context node
   * @return trimmed text, or empty when nothing matches
   */
  public static String text(XPath xpath, String expression, Node context) {
    try {
      String value = (String) xpath.evaluate(expression, context, XPathConstants.STRING);
      return value == null ? "" : value.trim();
    } catch (XPathExpressionException ex) {
      throw new IllegalArgumentException("Invalid XPath expression: " + expression, ex);
    }
  }

  /**
   * Evaluates an expression to a node list.
   *
   * @param xpath configured XPath
   * @param expression XPath expression
   * @param context context node
   * @return matching nodes in document order
   */
  public static List<Node> nodes(XPath xpath, String expression, Node context) {
    try {
      NodeList list = (NodeList) xpath.evaluate(expression, context, XPathConstants.NODESET);
      List<Node> result = new ArrayList<>(list.getLength());
      for (int i = 0; i < list.getLength(); i++) {
        result.add(list.item(i));
      }
      return result;
    } catch (XPathExpressionException ex) {
      throw new IllegalArgumentException("Invalid XPath expression: " + expression, ex);
    }
  }

  /**
   * Returns the direct child elements with one of the given namespaces and local name.
   *
   * @param parent parent element; {@code null} yields an empty list
   * @param namespaces accepted namespace URIs
   * @param localName element local name
   * @return matching children in document order
   */
  public static List<Element> children(Element parent, Set<String> namespaces, String localName) {
    List<Element> result = new ArrayList<>();
    if (parent == null) {
      return result;
    }
    for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
      if (node instanceof Element element
          && localName.equals(element.getLocalName())
          && namespaces.contains(Objects.requireNonNullElse(element.getNamespaceURI(), ""))) {
        result.add(element);
      }
    }
    return result;
  }

  /** Convenience overload of {@link #children(Element, Set, String)} for a single namespace. */
  public static List<Element> children(Element parent, String namespace, String localName) {
    return children(parent, Set.of(namespace), localName);
  }

  /**
   * Returns the first direct child element matching the namespaces and local name.
   *
   * @param parent parent element; {@code null} yields empty
   * @param namespaces accepted namespace URIs
   * @param localName element local name
   * @return first match, if any
   */
  public static Optional<Element> child(Element parent, Set<String> namespaces, String localName) {
    List<Element> matches = children(parent, namespaces, localName);
    return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
  }

  /** Convenience overload of {@link #child(Element, Set, String)} for a single namespace. */
  public static Optional<Element> child(Element parent, String namespace, String localName) {
    return child(parent, Set.of(namespace), localName);
  }

  /**
   * Returns the trimmed text of the first matching child element.
   *
   * @param parent parent element
   * @param namespaces accepted namespace URIs
   * @param localName element local name
   * @return trimmed text, or empty when absent
   */
  public static String childText(Element parent, Set<String> namespaces, String localName) {
    return child(parent, namespaces, localName).map(XmlDocuments::text).orElse("");
  }

  /** Convenience overload of {@link #childText(Element, Set, String)} for a single namespace. */
  public static String childText(Element parent, String namespace, String localName) {
    return childText(parent, Set.of(namespace), localName);
  }

  /**
   * Returns the trimmed text content of an element.
   *
   * @param element element; {@code null} yields empty
   * @return trimmed text
   */
  public static String text(Element element) {
    if (element == null) {
      return "";
    }
    String content = element.getTextContent();
    return content == null ? "" : content.trim();
  }

  /**
   * Returns an attribute value, trimmed.
   *
   * @param element element; {@code null} yields empty
   * @param namespace attribute namespace, or {@code null} for unqualified attributes
   * @param name attribute local name
   * @return trimmed value, or empty when absent
   */
  public static String attribute(Element element, String namespace, String name) {
    if (element == null) {
      return "";
    }
    String value = namespace == null ? element.getAttribute(name) : element.getAttributeNS(namespace, name);
    return value == null ? "" : value.trim();
  }

  private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
    DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    factory.setXIncludeAware(false);
    factory.setExpandEntityReferences(false);
    factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
    factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
    factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
    factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
    factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
    return factory;
  }

  private record MapNamespaceContext(Map<String, String> bindings) implements NamespaceContext {
    @Override
    public String getNamespaceURI(String prefix) {
      return bindings.getOrDefault(prefix, XMLConstants.NULL_NS_URI);
    }

    @Override
    public String getPrefix(String namespaceUri) {
      for (Map.Entry<String, String> entry : bindings.entrySet()) {
        if (entry.getValue().equals(namespaceUri)) {
          return entry.getKey();
        }
      }
      return null;
    }

    @Override
    public Iterator<String> getPrefixes(String namespaceUri) {
      String prefix = getPrefix(namespaceUri);
      return prefix == null ? List.<String>of().iterator() : List.of(prefix).iterator();
    }
  }
}
