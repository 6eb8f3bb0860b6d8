package nl.pdok.spider.application.port;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import nl.pdok.spider.domain.catalogue.CatalogueListRecord;
import nl.pdok.spider.domain.catalogue.DatasetMetadataRecord;
import nl.pdok.spider.domain.catalogue.FilterMode;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.ServiceProtocol;

/**
 * <strong>What:</strong> Port for the metadata catalogue holding service and dataset records.
 * <p><strong>Why:</strong> Separates harvest orchestration from the CSW wire protocol.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use; dataset lookups are fanned
 * out over fetch workers.</p>
 *
 * @since 0.1.0
 */
public interface CatalogueClient {

  /**
   * Pages through all service records of one protocol published by {@code owner}.
   *
   * @param protocol protocol to query
   * @param owner organisation name of the publisher
   * @param maxResults maximum number of records, {@code 0} for all
   * @param filterMode post-processing of the result set
   * @return records sorted by title
   * @throws IOException when the first page cannot be retrieved or parsed
   * @throws InterruptedException when interrupted while waiting on the catalogue
   */
  List<ServiceDescriptionRecord> queryByProtocol(
      ServiceProtocol protocol, String owner, int maxResults, FilterMode filterMode)
      throws IOException, InterruptedException;

  /**
   * Retrieves the service record(s) with the given identifier.
   *
   * @param metadataId service metadata identifier
   * @return matching records with a supported protocol, possibly empty
   * @throws IOException when the catalogue cannot be queried
   * @throws InterruptedException when interrupted while waiting on the catalogue
   */
  List<ServiceDescriptionRecord> queryById(String metadataId) throws IOException, InterruptedException;

  /**
   * Looks up a dataset record. Failures are logged by the implementation and reported as empty.
   *
   * @param metadataId dataset metadata identifier
   * @return dataset record, or empty when it does not exist or cannot be retrieved
   * @throws InterruptedException when interrupted while waiting on the catalogue
   */
  Optional<DatasetMetadataRecord> fetchDatasetMetadata(String metadataId) throws InterruptedException;

  /**
   * Pages through brief records of one protocol.
   *
   * @param protocol protocol to query
   * @param owner organisation name of the publisher
   * @param maxResults maximum number of records, {@code 0} for all
   * @return brief records in catalogue order
   * @throws IOException when the first page cannot be retrieved or parsed
   * @throws InterruptedException when interrupted while waiting on the catalogue
   */
  List<CatalogueListRecord> listByProtocol(ServiceProtocol protocol, String owner, int maxResults)
      throws IOException, InterruptedException;
}
