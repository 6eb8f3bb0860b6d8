package nl.pdok.spider.domain.service;

import java.util.Objects;

/**
 * Marks a catalogue record whose capabilities could not be resolved.
 *
 * @param url service URL that failed or was skipped
 * @param metadataId metadata identifier of the service record
 * @param protocol protocol of the service record
 */
public record ServiceError(String url, String metadataId, ServiceProtocol protocol)
    implements ServiceResult {

  public ServiceError {
    url = Objects.requireNonNullElse(url, "");
    metadataId = Objects.requireNonNullElse(metadataId, "");
    Objects.requireNonNull(protocol, "protocol");
  }
}
