package nl.pdok.spider.infrastructure.csw;

import javax.xml.xpath.XPath;
import nl.pdok.spider.domain.catalogue.DatasetMetadataRecord;
import nl.pdok.spider.infrastructure.parse.Namespaces;
import nl.pdok.spider.infrastructure.parse.XmlDocuments;
import org.w3c.dom.Node;

/**
 * Extracts {@link DatasetMetadataRecord}s from ISO 19139 dataset metadata.
 */
final class DatasetRecordExtractor {
  private static final String IDENTIFICATION = "gmd:identificationInfo/*";

  private DatasetRecordExtractor() {
    // Utility
  }

  /**
   * Extracts a dataset record.
   *
   * @param metadata {@code gmd:MD_Metadata} element
   * @param requestedId identifier used for the lookup; used when the record lacks a file identifier
   * @return dataset record
   */
  static DatasetMetadataRecord extract(Node metadata, String requestedId) {
    XPath xpath = XmlDocuments.xpath(Namespaces.CATALOGUE);
    String metadataId = XmlDocuments.text(xpath, "gmd:fileIdentifier/gco:CharacterString", metadata);
    return new DatasetMetadataRecord(
        XmlDocuments.text(xpath, IDENTIFICATION + "/gmd:citation/gmd:CI_Citation/gmd:title/gco:CharacterString",
            metadata),
        XmlDocuments.text(xpath, IDENTIFICATION + "/gmd:abstract/gco:CharacterString", metadata),
        metadataId.isEmpty() ? requestedId : metadataId);
  }
}
