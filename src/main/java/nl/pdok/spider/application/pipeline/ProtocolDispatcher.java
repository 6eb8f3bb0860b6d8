package nl.pdok.spider.application.pipeline;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import nl.pdok.spider.application.exec.RetryExhaustedException;
import nl.pdok.spider.application.exec.RetryPolicy;
import nl.pdok.spider.application.port.CapabilitiesReader;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.ServiceError;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.domain.service.ServiceResult;
import org.slf4j.Logger;

/**
 * <strong>What:</strong> Resolves one catalogue record into a {@link ServiceResult}.
 * <p><strong>Why:</strong> Capability retrieval is the slowest and least reliable step of a harvest; one broken
 * service must never fail the others.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Skip secured endpoints without fetching them.</li>
 *   <li>Select the reader registered for the record protocol.</li>
 *   <li>Retry OGC services through the {@link RetryPolicy}; read Atom feeds once.</li>
 *   <li>Demote every failure to a {@link ServiceError}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use when the readers are.</p>
 *
 * @since 0.1.0
 */
public final class ProtocolDispatcher {
  private final Map<ServiceProtocol, CapabilitiesReader> readers;
  private final RetryPolicy retryPolicy;
  private final Logger log;

  /**
   * Creates a dispatcher.
   *
   * @param readers one reader per supported protocol
   * @param retryPolicy retry applied to OGC capability reads
   * @param log logger receiving failures
   */
  public ProtocolDispatcher(List<? extends CapabilitiesReader> readers, RetryPolicy retryPolicy, Logger log) {
    Objects.requireNonNull(readers, "readers");
    this.readers = new EnumMap<>(ServiceProtocol.class);
    for (CapabilitiesReader reader : readers) {
      if (this.readers.put(reader.protocol(), reader) != null) {
        throw new IllegalArgumentException("duplicate reader for " + reader.protocol().catalogueValue());
      }
    }
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.log = Objects.requireNonNull(log, "log");
  }

  /**
   * Retrieves and normalizes the service described by {@code record}.
   *
   * @param record catalogue record with canonical service URL
   * @return the service, or a {@link ServiceError} when it could not be read
   * @throws InterruptedException when interrupted while fetching or waiting between attempts
   */
  public ServiceResult resolve(ServiceDescriptionRecord record) throws InterruptedException {
    Objects.requireNonNull(record, "record");
    ServiceProtocol protocol = record.serviceProtocol();
    if (record.serviceUrl().contains("://secure")) {
      log.info("Skipping secured {} service {}", protocol.catalogueValue(), record.serviceUrl());
      return error(record);
    }
    CapabilitiesReader reader = readers.get(protocol);
    if (reader == null) {
      log.error("No capabilities reader registered for {}", protocol.catalogueValue());
      return error(record);
    }
    return switch (protocol) {
      case ATOM -> readOnce(reader, record);
      case WMS, WFS, WCS, WMTS, OGC_API_TILES, OGC_API_FEATURES -> readWithRetry(reader, record);
    };
  }

  private ServiceResult readOnce(CapabilitiesReader reader, ServiceDescriptionRecord record)
      throws InterruptedException {
    try {
      return reader.read(record);
    } catch (InterruptedException ex) {
      throw ex;
    } catch (Exception ex) {
      log.error("Failed to read {} service {} (metadata {}): {}",
          record.serviceProtocol().catalogueValue(), record.serviceUrl(), record.metadataId(), ex.toString());
      return error(record);
    }
  }

  private ServiceResult readWithRetry(CapabilitiesReader reader, ServiceDescriptionRecord record)
      throws InterruptedException {
    String description = record.serviceProtocol().catalogueValue() + " " + record.serviceUrl();
    try {
      return retryPolicy.execute(description, () -> reader.read(record));
    } catch (RetryExhaustedException ex) {
      log.error("Failed to read {} service {} (metadata {}) after {} attempt(s): {}",
          record.serviceProtocol().catalogueValue(), record.serviceUrl(), record.metadataId(), ex.attempts(),
          String.valueOf(ex.getCause()));
      return error(record);
    }
  }

  private static ServiceError error(ServiceDescriptionRecord record) {
    return new ServiceError(record.serviceUrl(), record.metadataId(), record.serviceProtocol());
  }
}
