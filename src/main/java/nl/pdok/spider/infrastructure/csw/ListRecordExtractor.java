package nl.pdok.spider.infrastructure.csw;

import java.util.ArrayList;
import java.util.List;
import nl.pdok.spider.domain.catalogue.CatalogueListRecord;
import nl.pdok.spider.infrastructure.parse.Namespaces;
import nl.pdok.spider.infrastructure.parse.XmlDocuments;
import org.w3c.dom.Element;

/**
 * Extracts {@link CatalogueListRecord}s from Dublin Core {@code csw:SummaryRecord} or {@code csw:Record} elements.
 */
final class ListRecordExtractor {

  private ListRecordExtractor() {
    // Utility
  }

  static CatalogueListRecord extract(Element record) {
    List<String> subjects = new ArrayList<>();
    for (Element subject : XmlDocuments.children(record, Namespaces.DC, "subject")) {
      String text = XmlDocuments.text(subject);
      if (!text.isEmpty()) {
        subjects.add(text);
      }
    }
    String abstractText = XmlDocuments.childText(record, Namespaces.DCT, "abstract");
    if (abstractText.isEmpty()) {
      abstractText = XmlDocuments.childText(record, Namespaces.DC, "description");
    }
    return new CatalogueListRecord(
        XmlDocuments.childText(record, Namespaces.DC, "title"),
        abstractText,
        XmlDocuments.childText(record, Namespaces.DC, "type"),
        XmlDocuments.childText(record, Namespaces.DC, "identifier"),
        subjects,
        XmlDocuments.childText(record, Namespaces.DCT, "modified"));
  }
}
