package nl.pdok.spider.infrastructure.csw;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.xml.xpath.XPath;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.infrastructure.parse.Namespaces;
import nl.pdok.spider.infrastructure.parse.UrlQueries;
import nl.pdok.spider.infrastructure.parse.XmlDocuments;
import org.slf4j.Logger;
import org.w3c.dom.Node;

/**
 * <strong>What:</strong> Extracts {@link ServiceDescriptionRecord}s from ISO 19139 {@code gmd:MD_Metadata} elements.
 * <p><strong>Why:</strong> Catalogue records are inconsistent; every field is read with a tolerant path query and
 * missing values become empty strings.</p>
 * <p><strong>Thread-safety:</strong> Creates an XPath per call; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class ServiceRecordExtractor {
  private static final String SERVICE_IDENTIFICATION = "gmd:identificationInfo/srv:SV_ServiceIdentification";
  private static final String ONLINE_RESOURCE = "gmd:distributionInfo/gmd:MD_Distribution/gmd:transferOptions"
      + "/gmd:MD_DigitalTransferOptions/gmd:onLine/gmd:CI_OnlineResource";

  private final Logger log;

  /**
   * Creates an extractor.
   *
   * @param log logger receiving skipped-record diagnostics
   */
  public ServiceRecordExtractor(Logger log) {
    this.log = Objects.requireNonNull(log, "log");
  }

  /**
   * Extracts a service record.
   *
   * @param metadata {@code gmd:MD_Metadata} element
   * @param queried protocol the record was searched for; its online resource is preferred when several exist
   * @return record, or empty when no online resource carries a supported protocol
   */
  public Optional<ServiceDescriptionRecord> extract(Node metadata, Optional<ServiceProtocol> queried) {
    XPath xpath = XmlDocuments.xpath(Namespaces.CATALOGUE);
    String metadataId = XmlDocuments.text(xpath, "gmd:fileIdentifier/gco:CharacterString", metadata);

    Optional<OnlineResource> resource = selectResource(onlineResources(xpath, metadata), queried);
    if (resource.isEmpty()) {
      log.debug("Skipping record {}: no online resource with a supported protocol", metadataId);
      return Optional.empty();
    }
    OnlineResource selected = resource.get();

    String operatesOn = XmlDocuments.text(xpath, SERVICE_IDENTIFICATION + "/srv:operatesOn/@xlink:href", metadata);
    return Optional.of(new ServiceDescriptionRecord(
        metadataId,
        XmlDocuments.text(xpath, SERVICE_IDENTIFICATION + "/gmd:citation/gmd:CI_Citation/gmd:title/gco:CharacterString",
            metadata),
        XmlDocuments.text(xpath, SERVICE_IDENTIFICATION + "/gmd:abstract/gco:CharacterString", metadata),
        XmlDocuments.text(xpath,
            SERVICE_IDENTIFICATION + "/gmd:resourceConstraints/*/gmd:useLimitation/gco:CharacterString", metadata),
        keywords(xpath, metadata, metadataId),
        operatesOn,
        datasetId(operatesOn),
        ServiceUrls.canonical(selected.url(), selected.protocol()),
        selected.protocol(),
        selected.description()));
  }

  /**
   * Reads the dataset identifier from an {@code operatesOn} reference: the lowercased {@code id} parameter, falling
   * back to {@code uuid}.
   *
   * @param operatesOn reference URL
   * @return identifier, or empty
   */
  static String datasetId(String operatesOn) {
    if (operatesOn == null || operatesOn.isBlank()) {
      return "";
    }
    Map<String, String> params = UrlQueries.parameters(operatesOn.toLowerCase(Locale.ROOT));
    String id = params.getOrDefault("id", "");
    if (!id.isBlank()) {
      return id.trim();
    }
    return params.getOrDefault("uuid", "").trim();
  }

  private Map<String, List<String>> keywords(XPath xpath, Node metadata, String metadataId) {
    Map<String, List<String>> result = new LinkedHashMap<>();
    for (Node keyword : XmlDocuments.nodes(xpath,
        SERVICE_IDENTIFICATION + "/gmd:descriptiveKeywords/gmd:MD_Keywords/gmd:keyword", metadata)) {
      if (!XmlDocuments.nodes(xpath, "gco:CharacterString", keyword).isEmpty()) {
        result.computeIfAbsent("", k -> new ArrayList<>())
            .add(XmlDocuments.text(xpath, "gco:CharacterString", keyword));
      } else if (!XmlDocuments.nodes(xpath, "gmx:Anchor", keyword).isEmpty()) {
        String namespace = XmlDocuments.text(xpath, "gmx:Anchor/@xlink:href", keyword);
        result.computeIfAbsent(namespace, k -> new ArrayList<>())
            .add(XmlDocuments.text(xpath, "gmx:Anchor", keyword));
      } else {
        log.warn("Unexpected keyword encoding in record {}", metadataId);
      }
    }
    return result;
  }

  private static List<OnlineResource> onlineResources(XPath xpath, Node metadata) {
    List<OnlineResource> resources = new ArrayList<>();
    for (Node node : XmlDocuments.nodes(xpath, ONLINE_RESOURCE, metadata)) {
      String protocolText = XmlDocuments.text(xpath, "gmd:protocol/gmx:Anchor", node);
      if (protocolText.isEmpty()) {
        protocolText = XmlDocuments.text(xpath, "gmd:protocol/gco:CharacterString", node);
      }
      Optional<ServiceProtocol> protocol = ServiceProtocol.fromCatalogueValue(protocolText);
      if (protocol.isEmpty()) {
        continue;
      }
      String description = XmlDocuments.text(xpath, "gmd:description/gmx:Anchor", node);
      if (description.isEmpty()) {
        description = XmlDocuments.text(xpath, "gmd:description/gco:CharacterString", node);
      }
      resources.add(new OnlineResource(
          XmlDocuments.text(xpath, "gmd:linkage/gmd:URL", node), protocol.get(), description));
    }
    return resources;
  }

  private static Optional<OnlineResource> selectResource(
      List<OnlineResource> resources, Optional<ServiceProtocol> queried) {
    if (queried.isPresent()) {
      for (OnlineResource resource : resources) {
        if (resource.protocol() == queried.get()) {
          return Optional.of(resource);
        }
      }
    }
    return resources.isEmpty() ? Optional.empty() : Optional.of(resources.get(0));
  }

  private record OnlineResource(String url, ServiceProtocol protocol, String description) {}
}
