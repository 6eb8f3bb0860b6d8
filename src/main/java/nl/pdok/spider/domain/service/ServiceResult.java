package nl.pdok.spider.domain.service;

/**
 * Outcome of resolving one catalogue service record: either a normalized {@link Service} or a
 * {@link ServiceError} marker. Resolution never throws, so batches always carry one result per record.
 *
 * @since 0.1.0
 */
public sealed interface ServiceResult permits Service, ServiceError {

  /** @return URL the result was resolved from */
  String url();

  /** @return metadata identifier of the catalogue record */
  String metadataId();

  /** @return protocol of the catalogue record */
  ServiceProtocol protocol();
}
