package nl.pdok.spider.infrastructure.capabilities;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import nl.pdok.spider.application.port.CapabilitiesReader;
import nl.pdok.spider.application.port.DocumentFetcher;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.ContentItem.FeatureType;
import nl.pdok.spider.domain.service.Service;
import nl.pdok.spider.domain.service.ServiceContent.FeatureContent;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.infrastructure.parse.DocumentParseException;
import nl.pdok.spider.infrastructure.parse.Namespaces;
import nl.pdok.spider.infrastructure.parse.XmlDocuments;
import org.w3c.dom.Element;

/**
 * Reads WFS 2.0.0 capabilities: service identification, GetFeature output formats, and feature types.
 *
 * <p>Feature types inherit the dataset id of the catalogue record.</p>
 */
public final class WfsCapabilitiesReader implements CapabilitiesReader {
  static final String VERSION = "2.0.0";
  private static final Set<String> OWS = Set.of(Namespaces.OWS_11);
  private static final String WFS = Namespaces.WFS_20;

  private final DocumentFetcher fetcher;

  /**
   * Creates the reader.
   *
   * @param fetcher transport for capability documents
   * @since 0.1.0
   */
  public WfsCapabilitiesReader(DocumentFetcher fetcher) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
  }

  @Override
  public ServiceProtocol protocol() {
    return ServiceProtocol.WFS;
  }

  @Override
  public Service read(ServiceDescriptionRecord record) throws IOException, InterruptedException {
    return parse(fetcher.fetch(CapabilitiesRequests.withVersion(record.serviceUrl(), VERSION)), record);
  }

  Service parse(String xml, ServiceDescriptionRecord record) throws DocumentParseException {
    Element root = XmlDocuments.parse(xml).getDocumentElement();
    if (!"WFS_Capabilities".equals(root.getLocalName()) || !WFS.equals(root.getNamespaceURI())) {
      throw new DocumentParseException("Not a WFS 2.0 capabilities document: " + root.getTagName());
    }
    OwsCommon.Identification identification = OwsCommon.identification(root, OWS);
    List<String> outputFormats = OwsCommon.parameterValues(root, OWS, "GetFeature", "outputFormat");

    List<FeatureType> featureTypes = new ArrayList<>();
    Element list = XmlDocuments.child(root, WFS, "FeatureTypeList").orElse(null);
    for (Element featureType : XmlDocuments.children(list, WFS, "FeatureType")) {
      featureTypes.add(new FeatureType(
          XmlDocuments.childText(featureType, WFS, "Name"),
          XmlDocuments.childText(featureType, WFS, "Title"),
          XmlDocuments.childText(featureType, WFS, "Abstract"),
          record.datasetMetadataId()));
    }

    return new Service(
        identification.title(),
        identification.abstractText(),
        record.metadataId(),
        record.datasetMetadataId(),
        record.serviceUrl(),
        identification.keywords(),
        ServiceProtocol.WFS,
        new FeatureContent(String.join(",", outputFormats), featureTypes));
  }
}
