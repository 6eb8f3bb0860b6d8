package nl.pdok.spider.domain.service;

import java.util.Objects;

/**
 * One content item of a service with selected service fields copied alongside it.
 *
 * @param item nested layer, feature type, or coverage
 * @param serviceUrl URL of the owning service
 * @param serviceTitle title of the owning service
 * @param serviceAbstract abstract of the owning service
 * @param serviceProtocol protocol of the owning service
 * @param serviceMetadataId metadata identifier of the owning service
 * @param imgFormats GetMap formats of the owning WMS service, empty for other protocols
 */
public record FlatLayerRow(
    ContentItem item,
    String serviceUrl,
    String serviceTitle,
    String serviceAbstract,
    ServiceProtocol serviceProtocol,
    String serviceMetadataId,
    String imgFormats) {

  public FlatLayerRow {
    Objects.requireNonNull(item, "item");
    Objects.requireNonNull(serviceProtocol, "serviceProtocol");
    serviceUrl = Objects.requireNonNullElse(serviceUrl, "");
    serviceTitle = Objects.requireNonNullElse(serviceTitle, "");
    serviceAbstract = Objects.requireNonNullElse(serviceAbstract, "");
    serviceMetadataId = Objects.requireNonNullElse(serviceMetadataId, "");
    imgFormats = Objects.requireNonNullElse(imgFormats, "");
  }

  /** @return name of the nested item */
  public String name() {
    return item.name();
  }
}
