package nl.pdok.spider.infrastructure.capabilities;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import nl.pdok.spider.application.port.CapabilitiesReader;
import nl.pdok.spider.application.port.DocumentFetcher;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.ContentItem.TileLayer;
import nl.pdok.spider.domain.service.Service;
import nl.pdok.spider.domain.service.ServiceContent.TileContent;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.domain.service.Style;
import nl.pdok.spider.infrastructure.parse.DocumentParseException;
import nl.pdok.spider.infrastructure.parse.Namespaces;
import nl.pdok.spider.infrastructure.parse.XmlDocuments;
import org.w3c.dom.Element;

/**
 * Reads WMTS 1.0.0 capabilities into {@link TileLayer}s with styles, tile matrix set links, and formats.
 */
public final class WmtsCapabilitiesReader implements CapabilitiesReader {
  private static final Set<String> OWS = Set.of(Namespaces.OWS_11);
  private static final String WMTS = Namespaces.WMTS;

  private final DocumentFetcher fetcher;

  /**
   * Creates the reader.
   *
   * @param fetcher transport for capability documents
   * @since 0.1.0
   */
  public WmtsCapabilitiesReader(DocumentFetcher fetcher) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
  }

  @Override
  public ServiceProtocol protocol() {
    return ServiceProtocol.WMTS;
  }

  @Override
  public Service read(ServiceDescriptionRecord record) throws IOException, InterruptedException {
    return parse(fetcher.fetch(CapabilitiesRequests.toUri(record.serviceUrl())), record);
  }

  Service parse(String xml, ServiceDescriptionRecord record) throws DocumentParseException {
    Element root = XmlDocuments.parse(xml).getDocumentElement();
    if (!"Capabilities".equals(root.getLocalName()) || !WMTS.equals(root.getNamespaceURI())) {
      throw new DocumentParseException("Not a WMTS 1.0 capabilities document: " + root.getTagName());
    }
    OwsCommon.Identification identification = OwsCommon.identification(root, OWS);

    List<TileLayer> layers = new ArrayList<>();
    Element contents = XmlDocuments.child(root, WMTS, "Contents").orElse(null);
    for (Element layer : XmlDocuments.children(contents, WMTS, "Layer")) {
      List<Style> styles = new ArrayList<>();
      for (Element style : XmlDocuments.children(layer, WMTS, "Style")) {
        String legend = XmlDocuments.child(style, WMTS, "LegendURL")
            .map(legendUrl -> XmlDocuments.attribute(legendUrl, Namespaces.XLINK, "href"))
            .orElse("");
        styles.add(new Style(
            XmlDocuments.childText(style, OWS, "Title"),
            XmlDocuments.childText(style, OWS, "Identifier"),
            legend));
      }
      List<String> matrixSets = new ArrayList<>();
      for (Element link : XmlDocuments.children(layer, WMTS, "TileMatrixSetLink")) {
        String id = XmlDocuments.childText(link, WMTS, "TileMatrixSet");
        if (!id.isEmpty()) {
          matrixSets.add(id);
        }
      }
      List<String> formats = new ArrayList<>();
      for (Element format : XmlDocuments.children(layer, WMTS, "Format")) {
        formats.add(XmlDocuments.text(format));
      }
      layers.add(new TileLayer(
          XmlDocuments.childText(layer, OWS, "Identifier"),
          XmlDocuments.childText(layer, OWS, "Title"),
          XmlDocuments.childText(layer, OWS, "Abstract"),
          record.datasetMetadataId(),
          styles,
          String.join(",", matrixSets),
          String.join(",", formats)));
    }

    return new Service(
        identification.title(),
        identification.abstractText(),
        record.metadataId(),
        record.datasetMetadataId(),
        record.serviceUrl(),
        identification.keywords(),
        ServiceProtocol.WMTS,
        new TileContent(layers));
  }
}
