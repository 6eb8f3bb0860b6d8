package nl.pdok.spider.infrastructure.capabilities;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import nl.pdok.spider.application.port.CapabilitiesReader;
import nl.pdok.spider.application.port.DocumentFetcher;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.ContentItem.Coverage;
import nl.pdok.spider.domain.service.Service;
import nl.pdok.spider.domain.service.ServiceContent.CoverageContent;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.infrastructure.parse.DocumentParseException;
import nl.pdok.spider.infrastructure.parse.Namespaces;
import nl.pdok.spider.infrastructure.parse.XmlDocuments;
import org.w3c.dom.Element;

/**
 * Reads WCS 1.1 capabilities into one {@link Coverage} per coverage summary.
 *
 * <p>Some servers (MapServer) write OWS elements in the unversioned {@code http://www.opengis.net/ows}
 * namespace instead of OWS 1.1; both are accepted.</p>
 */
public final class WcsCapabilitiesReader implements CapabilitiesReader {
  static final String VERSION = "1.1.0";
  private static final Set<String> OWS = Set.of(Namespaces.OWS_11, Namespaces.OWS_LEGACY);
  private static final Set<String> WCS = Set.of(Namespaces.WCS_11, Namespaces.WCS_111);

  private final DocumentFetcher fetcher;

  /**
   * Creates the reader.
   *
   * @param fetcher transport for capability documents
   * @since 0.1.0
   */
  public WcsCapabilitiesReader(DocumentFetcher fetcher) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
  }

  @Override
  public ServiceProtocol protocol() {
    return ServiceProtocol.WCS;
  }

  @Override
  public Service read(ServiceDescriptionRecord record) throws IOException, InterruptedException {
    return parse(fetcher.fetch(CapabilitiesRequests.withVersion(record.serviceUrl(), VERSION)), record);
  }

  Service parse(String xml, ServiceDescriptionRecord record) throws DocumentParseException {
    Element root = XmlDocuments.parse(xml).getDocumentElement();
    if (!"Capabilities".equals(root.getLocalName()) || !WCS.contains(root.getNamespaceURI())) {
      throw new DocumentParseException("Not a WCS 1.1 capabilities document: " + root.getTagName());
    }
    OwsCommon.Identification identification = OwsCommon.identification(root, OWS);

    List<Coverage> coverages = new ArrayList<>();
    Element contents = XmlDocuments.child(root, WCS, "Contents").orElse(null);
    for (Element summary : XmlDocuments.children(contents, WCS, "CoverageSummary")) {
      coverages.add(new Coverage(
          XmlDocuments.childText(summary, WCS, "Identifier"),
          XmlDocuments.childText(summary, OWS, "Title"),
          XmlDocuments.childText(summary, OWS, "Abstract"),
          record.datasetMetadataId()));
    }

    return new Service(
        identification.title(),
        identification.abstractText(),
        record.metadataId(),
        record.datasetMetadataId(),
        record.serviceUrl(),
        identification.keywords(),
        ServiceProtocol.WCS,
        new CoverageContent(coverages));
  }
}
