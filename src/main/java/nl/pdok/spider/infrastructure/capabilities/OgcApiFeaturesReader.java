package nl.pdok.spider.infrastructure.capabilities;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import nl.pdok.spider.application.port.CapabilitiesReader;
import nl.pdok.spider.application.port.DocumentFetcher;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.ContentItem.FeatureType;
import nl.pdok.spider.domain.service.Service;
import nl.pdok.spider.domain.service.ServiceContent.FeatureContent;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.infrastructure.parse.JsonDocuments;

/**
 * <strong>What:</strong> Reads an OGC API Features landing page into a service with one feature type per
 * collection.
 * <p><strong>Role:</strong> Follows the {@code service-desc} link for title, description and tags, and the
 * {@code data} link for the collections.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class OgcApiFeaturesReader implements CapabilitiesReader {
  private final DocumentFetcher fetcher;

  /**
   * Creates the reader.
   *
   * @param fetcher transport for the landing page, API description and collections
   * @since 0.1.0
   */
  public OgcApiFeaturesReader(DocumentFetcher fetcher) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
  }

  @Override
  public ServiceProtocol protocol() {
    return ServiceProtocol.OGC_API_FEATURES;
  }

  @Override
  public Service read(ServiceDescriptionRecord record) throws IOException, InterruptedException {
    URI landingUri = CapabilitiesRequests.withJsonFormat(record.serviceUrl());
    JsonNode landing = JsonDocuments.parse(fetcher.fetch(landingUri));

    JsonNode serviceDesc = null;
    Optional<String> descHref = JsonDocuments.linkHref(landing, "service-desc");
    if (descHref.isPresent()) {
      serviceDesc = JsonDocuments.parse(fetcher.fetch(CapabilitiesRequests.resolve(landingUri, descHref.get())));
    }
    JsonNode collections = null;
    Optional<String> dataHref = JsonDocuments.linkHref(landing, "data");
    if (dataHref.isPresent()) {
      collections = JsonDocuments.parse(fetcher.fetch(CapabilitiesRequests.resolve(landingUri, dataHref.get())));
    }
    return assemble(record, landing, serviceDesc, collections);
  }

  /**
   * Builds the service from already fetched documents.
   *
   * @param record catalogue record
   * @param landing landing page
   * @param serviceDesc OpenAPI document, or {@code null}
   * @param collections collections document, or {@code null}
   * @return normalized service
   */
  static Service assemble(ServiceDescriptionRecord record, JsonNode landing, JsonNode serviceDesc,
      JsonNode collections) {
    JsonNode info = serviceDesc == null ? null : serviceDesc.path("info");
    String title = firstNonEmpty(JsonDocuments.text(landing, "title"), JsonDocuments.text(info, "title"));
    String description =
        firstNonEmpty(JsonDocuments.text(landing, "description"), JsonDocuments.text(info, "description"));

    List<FeatureType> featureTypes = new ArrayList<>();
    Set<String> outputFormats = new LinkedHashSet<>();
    if (collections != null) {
      for (JsonNode collection : collections.path("collections")) {
        featureTypes.add(new FeatureType(
            JsonDocuments.text(collection, "id"),
            JsonDocuments.text(collection, "title"),
            JsonDocuments.text(collection, "description"),
            record.datasetMetadataId()));
        for (JsonNode link : collection.path("links")) {
          String type = JsonDocuments.text(link, "type");
          if ("items".equals(JsonDocuments.text(link, "rel")) && !type.isEmpty()) {
            outputFormats.add(type);
          }
        }
      }
    }

    return new Service(
        title,
        description,
        record.metadataId(),
        record.datasetMetadataId(),
        record.serviceUrl(),
        OgcApiTilesReader.tagNames(serviceDesc),
        ServiceProtocol.OGC_API_FEATURES,
        new FeatureContent(String.join(",", outputFormats), featureTypes));
  }

  static String firstNonEmpty(String first, String second) {
    return first.isEmpty() ? second : first;
  }
}
