package nl.pdok.spider.infrastructure.capabilities;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import nl.pdok.spider.infrastructure.parse.XmlDocuments;
import org.w3c.dom.Element;

/**
 * Readers for the OWS Common sections shared by WFS 2.0, WCS 1.1, and WMTS 1.0 capabilities.
 */
final class OwsCommon {

  private OwsCommon() {
    // Utility
  }

  /**
   * Title, abstract, and keywords of {@code ows:ServiceIdentification}.
   *
   * @param title service title
   * @param abstractText service abstract
   * @param keywords service keywords
   */
  record Identification(String title, String abstractText, List<String> keywords) {}

  static Identification identification(Element root, Set<String> ows) {
    Element identification = XmlDocuments.child(root, ows, "ServiceIdentification").orElse(null);
    List<String> keywords = new ArrayList<>();
    for (Element group : XmlDocuments.children(identification, ows, "Keywords")) {
      for (Element keyword : XmlDocuments.children(group, ows, "Keyword")) {
        String text = XmlDocuments.text(keyword);
        if (!text.isEmpty()) {
          keywords.add(text);
        }
      }
    }
    return new Identification(
        XmlDocuments.childText(identification, ows, "Title"),
        XmlDocuments.childText(identification, ows, "Abstract"),
        keywords);
  }

  /**
   * Returns the allowed values of an operation parameter, falling back to a service-wide parameter of the same name.
   *
   * @param root capabilities root element
   * @param ows accepted OWS namespaces
   * @param operation operation name such as {@code GetFeature}
   * @param parameter parameter name such as {@code outputFormat}
   * @return distinct values in document order
   */
  static List<String> parameterValues(Element root, Set<String> ows, String operation, String parameter) {
    Element metadata = XmlDocuments.child(root, ows, "OperationsMetadata").orElse(null);
    for (Element op : XmlDocuments.children(metadata, ows, "Operation")) {
      if (operation.equals(XmlDocuments.attribute(op, null, "name"))) {
        Set<String> values = values(op, ows, parameter);
        if (!values.isEmpty()) {
          return List.copyOf(values);
        }
      }
    }
    return List.copyOf(values(metadata, ows, parameter));
  }

  private static Set<String> values(Element parent, Set<String> ows, String parameter) {
    Set<String> values = new LinkedHashSet<>();
    for (Element param : XmlDocuments.children(parent, ows, "Parameter")) {
      if (!parameter.equalsIgnoreCase(XmlDocuments.attribute(param, null, "name"))) {
        continue;
      }
      for (Element allowed : XmlDocuments.children(param, ows, "AllowedValues")) {
        for (Element value : XmlDocuments.children(allowed, ows, "Value")) {
          addText(values, value);
        }
      }
      for (Element value : XmlDocuments.children(param, ows, "Value")) {
        addText(values, value);
      }
    }
    return values;
  }

  private static void addText(Set<String> values, Element element) {
    String text = XmlDocuments.text(element);
    if (!text.isEmpty()) {
      values.add(text);
    }
  }
}
