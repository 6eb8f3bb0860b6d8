package nl.pdok.spider.domain.service;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Normalized description of one OGC or INSPIRE service.
 * <p><strong>Why:</strong> Capability documents differ per protocol; this record carries the fields every protocol
 * shares and delegates the protocol specific part to {@link ServiceContent}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param title service title from the capabilities document
 * @param abstractText service abstract
 * @param metadataId metadata identifier of the service record
 * @param datasetMetadataId metadata identifier of the dataset the service operates on, or empty
 * @param url service URL the capabilities were read from
 * @param keywords keywords advertised by the service
 * @param protocol service protocol
 * @param content protocol specific payload
 * @since 0.1.0
 */
public record Service(
    String title,
    String abstractText,
    String metadataId,
    String datasetMetadataId,
    String url,
    List<String> keywords,
    ServiceProtocol protocol,
    ServiceContent content) implements ServiceResult {

  public Service {
    title = Objects.requireNonNullElse(title, "");
    abstractText = Objects.requireNonNullElse(abstractText, "");
    metadataId = Objects.requireNonNullElse(metadataId, "");
    datasetMetadataId = Objects.requireNonNullElse(datasetMetadataId, "");
    url = Objects.requireNonNullElse(url, "");
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
    Objects.requireNonNull(protocol, "protocol");
    Objects.requireNonNull(content, "content");
  }

  /**
   * Returns the nested layers, feature types, coverages, or datasets of this service.
   *
   * @return content items in document order
   */
  public List<? extends ContentItem> items() {
    return content.items();
  }
}
