package nl.pdok.spider.domain.catalogue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import nl.pdok.spider.domain.service.ServiceProtocol;

/**
 * <strong>What:</strong> Service metadata record extracted from one ISO 19139 catalogue document.
 * <p><strong>Why:</strong> Input of capability resolution; carries the canonical service URL and protocol.</p>
 * <p><strong>Thread-safety:</strong> Immutable; keyword lists are unmodifiable copies.</p>
 *
 * @param metadataId file identifier of the record
 * @param title service title
 * @param abstractText service abstract
 * @param useLimitation use limitation text
 * @param keywords keywords grouped by thesaurus URI; free keywords live under the empty key
 * @param operatesOnRef raw {@code operatesOn} reference to the dataset record
 * @param datasetMetadataId identifier taken from {@code operatesOnRef}, or empty
 * @param serviceUrl canonical service URL
 * @param serviceProtocol supported protocol of the online resource
 * @param serviceDescription description of the online resource
 * @since 0.1.0
 */
public record ServiceDescriptionRecord(
    String metadataId,
    String title,
    String abstractText,
    String useLimitation,
    Map<String, List<String>> keywords,
    String operatesOnRef,
    String datasetMetadataId,
    String serviceUrl,
    ServiceProtocol serviceProtocol,
    String serviceDescription) {

  public ServiceDescriptionRecord {
    metadataId = Objects.requireNonNullElse(metadataId, "");
    title = Objects.requireNonNullElse(title, "");
    abstractText = Objects.requireNonNullElse(abstractText, "");
    useLimitation = Objects.requireNonNullElse(useLimitation, "");
    keywords = copyKeywords(keywords);
    operatesOnRef = Objects.requireNonNullElse(operatesOnRef, "");
    datasetMetadataId = Objects.requireNonNullElse(datasetMetadataId, "");
    serviceUrl = Objects.requireNonNullElse(serviceUrl, "");
    Objects.requireNonNull(serviceProtocol, "serviceProtocol");
    serviceDescription = Objects.requireNonNullElse(serviceDescription, "");
  }

  private static Map<String, List<String>> copyKeywords(Map<String, List<String>> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    Map<String, List<String>> copy = new LinkedHashMap<>();
    source.forEach((namespace, terms) ->
        copy.put(Objects.requireNonNullElse(namespace, ""), terms == null ? List.of() : List.copyOf(terms)));
    return Collections.unmodifiableMap(copy);
  }
}
