package nl.pdok.spider.application.port;

import java.io.IOException;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.Service;
import nl.pdok.spider.domain.service.ServiceProtocol;

/**
 * <strong>What:</strong> Port reading the capabilities of one service protocol into the normalized model.
 * <p><strong>Why:</strong> Every protocol publishes a structurally different document; each reader hides one of
 * them behind the same call.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or thread-safe; one instance serves all
 * fetch workers.</p>
 *
 * @since 0.1.0
 */
public interface CapabilitiesReader {

  /** @return protocol handled by this reader */
  ServiceProtocol protocol();

  /**
   * Retrieves and normalizes the capabilities of {@code record}.
   *
   * @param record catalogue record with canonical service URL
   * @return normalized service
   * @throws IOException on transport failures or malformed documents
   * @throws InterruptedException when interrupted while waiting on the endpoint
   */
  Service read(ServiceDescriptionRecord record) throws IOException, InterruptedException;
}
