package nl.pdok.spider.infrastructure.capabilities;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import nl.pdok.spider.application.port.CapabilitiesReader;
import nl.pdok.spider.application.port.DocumentFetcher;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.ContentItem.MapLayer;
import nl.pdok.spider.domain.service.Service;
import nl.pdok.spider.domain.service.ServiceContent.MapContent;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.domain.service.Style;
import nl.pdok.spider.infrastructure.parse.DocumentParseException;
import nl.pdok.spider.infrastructure.parse.Namespaces;
import nl.pdok.spider.infrastructure.parse.UrlQueries;
import nl.pdok.spider.infrastructure.parse.XmlDocuments;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * <strong>What:</strong> Reads WMS 1.3.0 capabilities.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Emit one {@link MapLayer} per named layer in document order, nested layers included.</li>
 *   <li>Apply WMS inheritance: CRS and styles accumulate from ancestors, scale denominators are replaced.</li>
 *   <li>Take the layer dataset id from its first {@code TC211} metadata URL.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class WmsCapabilitiesReader implements CapabilitiesReader {
  static final String VERSION = "1.3.0";
  private static final String WMS = Namespaces.WMS;

  private final DocumentFetcher fetcher;

  /**
   * Creates the reader.
   *
   * @param fetcher transport for capability documents
   */
  public WmsCapabilitiesReader(DocumentFetcher fetcher) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
  }

  @Override
  public ServiceProtocol protocol() {
    return ServiceProtocol.WMS;
  }

  @Override
  public Service read(ServiceDescriptionRecord record) throws IOException, InterruptedException {
    URI uri = CapabilitiesRequests.withVersion(record.serviceUrl(), VERSION);
    return parse(fetcher.fetch(uri), record);
  }

  /**
   * Normalizes a capabilities document.
   *
   * @param xml capabilities document
   * @param record catalogue record the document belongs to
   * @return normalized service
   * @throws DocumentParseException when the document is not WMS 1.3.0 capabilities
   */
  Service parse(String xml, ServiceDescriptionRecord record) throws DocumentParseException {
    Document document = XmlDocuments.parse(xml);
    Element root = document.getDocumentElement();
    if (!"WMS_Capabilities".equals(root.getLocalName()) || !WMS.equals(root.getNamespaceURI())) {
      throw new DocumentParseException("Not a WMS 1.3.0 capabilities document: " + root.getTagName());
    }
    Element serviceElement = XmlDocuments.child(root, WMS, "Service").orElse(null);
    Element capability = XmlDocuments.child(root, WMS, "Capability")
        .orElseThrow(() -> new DocumentParseException("WMS capabilities lack a Capability section"));

    List<String> keywords = new ArrayList<>();
    XmlDocuments.child(serviceElement, WMS, "KeywordList").ifPresent(list -> {
      for (Element keyword : XmlDocuments.children(list, WMS, "Keyword")) {
        String text = XmlDocuments.text(keyword);
        if (!text.isEmpty()) {
          keywords.add(text);
        }
      }
    });

    List<String> formats = new ArrayList<>();
    XmlDocuments.child(capability, WMS, "Request")
        .flatMap(request -> XmlDocuments.child(request, WMS, "GetMap"))
        .ifPresent(getMap -> {
          for (Element format : XmlDocuments.children(getMap, WMS, "Format")) {
            formats.add(XmlDocuments.text(format));
          }
        });

    List<MapLayer> layers = new ArrayList<>();
    for (Element layer : XmlDocuments.children(capability, WMS, "Layer")) {
      collectLayers(layer, Inherited.ROOT, layers);
    }

    return new Service(
        XmlDocuments.childText(serviceElement, WMS, "Title"),
        XmlDocuments.childText(serviceElement, WMS, "Abstract"),
        record.metadataId(),
        record.datasetMetadataId(),
        record.serviceUrl(),
        keywords,
        ServiceProtocol.WMS,
        new MapContent(String.join(",", formats), layers));
  }

  private static void collectLayers(Element layer, Inherited parent, List<MapLayer> out) {
    Inherited inherited = parent.extend(layer);
    String name = XmlDocuments.childText(layer, WMS, "Name");
    if (!name.isEmpty()) {
      out.add(new MapLayer(
          name,
          XmlDocuments.childText(layer, WMS, "Title"),
          XmlDocuments.childText(layer, WMS, "Abstract"),
          datasetMetadataId(layer),
          List.copyOf(inherited.styles().values()),
          String.join(",", inherited.crs()),
          inherited.minScale(),
          inherited.maxScale()));
    }
    for (Element child : XmlDocuments.children(layer, WMS, "Layer")) {
      collectLayers(child, inherited, out);
    }
  }

  private static String datasetMetadataId(Element layer) {
    for (Element metadataUrl : XmlDocuments.children(layer, WMS, "MetadataURL")) {
      if (!"TC211".equalsIgnoreCase(XmlDocuments.attribute(metadataUrl, null, "type"))) {
        continue;
      }
      String href = XmlDocuments.child(metadataUrl, WMS, "OnlineResource")
          .map(resource -> XmlDocuments.attribute(resource, Namespaces.XLINK, "href"))
          .orElse("");
      return href.isEmpty() ? "" : UrlQueries.metadataId(href);
    }
    return "";
  }

  private static Style style(Element style) {
    String legend = XmlDocuments.child(style, WMS, "LegendURL")
        .flatMap(legendUrl -> XmlDocuments.child(legendUrl, WMS, "OnlineResource"))
        .map(resource -> XmlDocuments.attribute(resource, Namespaces.XLINK, "href"))
        .orElse("");
    return new Style(
        XmlDocuments.childText(style, WMS, "Title"),
        XmlDocuments.childText(style, WMS, "Name"),
        legend);
  }

  private record Inherited(Set<String> crs, Map<String, Style> styles, String minScale, String maxScale) {
    static final Inherited ROOT = new Inherited(Set.of(), Map.of(), "", "");

    Inherited extend(Element layer) {
      Set<String> mergedCrs = new LinkedHashSet<>(crs);
      for (Element element : XmlDocuments.children(layer, WMS, "CRS")) {
        String value = XmlDocuments.text(element);
        if (!value.isEmpty()) {
          mergedCrs.add(value);
        }
      }
      Map<String, Style> mergedStyles = new LinkedHashMap<>(styles);
      for (Element element : XmlDocuments.children(layer, WMS, "Style")) {
        Style style = style(element);
        mergedStyles.put(style.name(), style);
      }
      String min = XmlDocuments.childText(layer, WMS, "MinScaleDenominator");
      String max = XmlDocuments.childText(layer, WMS, "MaxScaleDenominator");
      return new Inherited(
          mergedCrs,
          mergedStyles,
          min.isEmpty() ? minScale : min,
          max.isEmpty() ? maxScale : max);
    }
  }
}
