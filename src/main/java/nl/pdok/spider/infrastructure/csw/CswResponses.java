package nl.pdok.spider.infrastructure.csw;

import java.util.ArrayList;
import java.util.List;
import nl.pdok.spider.infrastructure.parse.DocumentParseException;
import nl.pdok.spider.infrastructure.parse.Namespaces;
import nl.pdok.spider.infrastructure.parse.XmlDocuments;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Parses CSW 2.0.2 {@code GetRecordsResponse} and {@code GetRecordByIdResponse} documents.
 */
final class CswResponses {

  private CswResponses() {
    // Utility
  }

  /**
   * Parsed {@code csw:SearchResults} element.
   *
   * @param matched {@code numberOfRecordsMatched}
   * @param returned {@code numberOfRecordsReturned}
   * @param nextRecord {@code nextRecord}, 0 when absent
   * @param records child record elements
   */
  record SearchResults(int matched, int returned, int nextRecord, List<Element> records) {}

  static SearchResults searchResults(String xml) throws DocumentParseException {
    Element root = root(xml);
    Element results = XmlDocuments.child(root, Namespaces.CSW, "SearchResults")
        .orElseThrow(() -> new DocumentParseException("GetRecords response lacks csw:SearchResults"));
    List<Element> records = elements(results);
    int matched = intAttribute(results, "numberOfRecordsMatched", records.size());
    int returned = intAttribute(results, "numberOfRecordsReturned", records.size());
    int next = intAttribute(results, "nextRecord", 0);
    return new SearchResults(matched, returned, next, records);
  }

  static List<Element> recordsById(String xml) throws DocumentParseException {
    return elements(root(xml));
  }

  private static Element root(String xml) throws DocumentParseException {
    Document document = XmlDocuments.parse(xml);
    Element root = document.getDocumentElement();
    if ("ExceptionReport".equals(root.getLocalName())) {
      throw new DocumentParseException("Catalogue returned an exception: " + XmlDocuments.text(root));
    }
    return root;
  }

  private static List<Element> elements(Element parent) {
    List<Element> children = new ArrayList<>();
    for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
      if (node instanceof Element element) {
        children.add(element);
      }
    }
    return children;
  }

  private static int intAttribute(Element element, String name, int defaultValue)
      throws DocumentParseException {
    String value = XmlDocuments.attribute(element, null, name);
    if (value.isEmpty()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException ex) {
      throw new DocumentParseException("Invalid " + name + " attribute: " + value, ex);
    }
  }
}
