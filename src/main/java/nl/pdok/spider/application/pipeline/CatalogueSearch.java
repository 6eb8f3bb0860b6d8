package nl.pdok.spider.application.pipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import nl.pdok.spider.application.exec.FetchOrchestrator;
import nl.pdok.spider.application.exec.ItemResult;
import nl.pdok.spider.application.port.CatalogueClient;
import nl.pdok.spider.domain.catalogue.CatalogueListRecord;
import nl.pdok.spider.domain.catalogue.FilterMode;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.ServiceProtocol;
import org.slf4j.Logger;

/**
 * <strong>What:</strong> Queries the catalogue for several protocols at once.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Fan one catalogue query per protocol out through the {@link FetchOrchestrator}.</li>
 *   <li>Concatenate the results in protocol order.</li>
 *   <li>Keep the results of healthy protocols when others fail; fail only when every query failed.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class CatalogueSearch {
  private final CatalogueClient catalogue;
  private final FetchOrchestrator orchestrator;
  private final Logger log;

  /**
   * Creates a search.
   *
   * @param catalogue CSW client
   * @param orchestrator runs the per-protocol queries concurrently
   * @param log logger receiving failed protocol queries
   * @since 0.1.0
   */
  public CatalogueSearch(CatalogueClient catalogue, FetchOrchestrator orchestrator, Logger log) {
    this.catalogue = Objects.requireNonNull(catalogue, "catalogue");
    this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    this.log = Objects.requireNonNull(log, "log");
  }

  /**
   * Collects the service records of every protocol.
   *
   * @param protocols protocols to query
   * @param owner organisation name
   * @param maxResults maximum records per protocol, {@code 0} for unlimited
   * @param filterMode post-processing applied per protocol
   * @return records of all protocols, grouped per protocol in request order
   * @throws IOException when every protocol query failed
   * @throws InterruptedException when interrupted while waiting on the catalogue
   */
  public List<ServiceDescriptionRecord> serviceRecords(
      List<ServiceProtocol> protocols, String owner, int maxResults, FilterMode filterMode)
      throws IOException, InterruptedException {
    return fanOut(protocols,
        protocol -> catalogue.queryByProtocol(protocol, owner, maxResults, filterMode));
  }

  /**
   * Collects summary records of every protocol.
   *
   * @param protocols protocols to query
   * @param owner organisation name
   * @param maxResults maximum records per protocol, {@code 0} for unlimited
   * @return records of all protocols, grouped per protocol in request order
   * @throws IOException when every protocol query failed
   * @throws InterruptedException when interrupted while waiting on the catalogue
   */
  public List<CatalogueListRecord> listRecords(List<ServiceProtocol> protocols, String owner, int maxResults)
      throws IOException, InterruptedException {
    return fanOut(protocols, protocol -> catalogue.listByProtocol(protocol, owner, maxResults));
  }

  /**
   * Looks up the service records carrying one metadata id.
   *
   * @param metadataId service metadata identifier
   * @return matching records
   * @throws IOException when the catalogue cannot be queried
   * @throws InterruptedException when interrupted while waiting on the catalogue
   */
  public List<ServiceDescriptionRecord> serviceRecordsById(String metadataId)
      throws IOException, InterruptedException {
    List<ServiceDescriptionRecord> records = catalogue.queryById(metadataId);
    log.info("Found {} service metadata record(s) for id {}", records.size(), metadataId);
    return records;
  }

  private <T> List<T> fanOut(List<ServiceProtocol> protocols, FetchOrchestrator.Task<ServiceProtocol, List<T>> query)
      throws IOException, InterruptedException {
    List<ItemResult<List<T>>> results = orchestrator.map(protocols, query);
    List<T> records = new ArrayList<>();
    Exception firstFailure = null;
    int failures = 0;
    for (int i = 0; i < results.size(); i++) {
      ItemResult<List<T>> result = results.get(i);
      if (result instanceof ItemResult.Success<List<T>> success) {
        records.addAll(success.value());
      } else if (result instanceof ItemResult.Failure<List<T>> failure) {
        failures++;
        if (firstFailure == null) {
          firstFailure = failure.error();
        }
        log.error("Catalogue query for {} failed: {}",
            protocols.get(i).catalogueValue(), failure.error().toString());
      }
    }
    if (!protocols.isEmpty() && failures == protocols.size()) {
      if (firstFailure instanceof IOException io) {
        throw io;
      }
      throw new IOException("Every catalogue query failed", firstFailure);
    }
    return records;
  }
}
