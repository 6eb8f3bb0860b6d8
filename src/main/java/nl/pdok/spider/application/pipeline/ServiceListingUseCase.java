package nl.pdok.spider.application.pipeline;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import nl.pdok.spider.domain.catalogue.CatalogueListRecord;
import nl.pdok.spider.domain.catalogue.FilterMode;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.ServiceProtocol;
import org.slf4j.Logger;

/**
 * Runs the {@code services} command: lists catalogue service records without reading capabilities.
 */
public final class ServiceListingUseCase {
  private final CatalogueSearch search;
  private final DatasetGrouper grouper;
  private final Logger log;

  /**
   * Creates the use case.
   *
   * @param search catalogue search over the requested protocols
   * @param grouper groups records by dataset in {@code datasets} mode
   * @param log logger receiving the listing summary
   * @since 0.1.0
   */
  public ServiceListingUseCase(CatalogueSearch search, DatasetGrouper grouper, Logger log) {
    this.search = Objects.requireNonNull(search, "search");
    this.grouper = Objects.requireNonNull(grouper, "grouper");
    this.log = Objects.requireNonNull(log, "log");
  }

  /**
   * Lists summary records.
   *
   * @param protocols protocols to query
   * @param owner organisation name
   * @param maxResults maximum records per protocol, {@code 0} for unlimited
   * @return summary records
   * @throws IOException when every catalogue query failed
   * @throws InterruptedException when interrupted while waiting on the catalogue
   */
  public List<CatalogueListRecord> brief(List<ServiceProtocol> protocols, String owner, int maxResults)
      throws IOException, InterruptedException {
    return search.listRecords(protocols, owner, maxResults);
  }

  /**
   * Lists full service records.
   *
   * @param protocols protocols to query
   * @param owner organisation name
   * @param maxResults maximum records per protocol, {@code 0} for unlimited
   * @param filterMode post-processing of catalogue records
   * @return service records
   * @throws IOException when every catalogue query failed
   * @throws InterruptedException when interrupted while waiting on the catalogue
   */
  public List<ServiceDescriptionRecord> records(
      List<ServiceProtocol> protocols, String owner, int maxResults, FilterMode filterMode)
      throws IOException, InterruptedException {
    List<ServiceDescriptionRecord> records = search.serviceRecords(protocols, owner, maxResults, filterMode);
    log.info("Listed {} service record(s) for {} protocol(s)", records.size(), protocols.size());
    return records;
  }

  /**
   * Lists full service records grouped under their datasets.
   *
   * @param protocols protocols to query
   * @param owner organisation name
   * @param maxResults maximum records per protocol, {@code 0} for unlimited
   * @param filterMode post-processing of catalogue records
   * @return dataset groups; records without a resolvable dataset are left out
   * @throws IOException when every catalogue query failed
   * @throws InterruptedException when interrupted while waiting on the catalogue
   */
  public List<DatasetGroup<ServiceDescriptionRecord>> recordsByDataset(
      List<ServiceProtocol> protocols, String owner, int maxResults, FilterMode filterMode)
      throws IOException, InterruptedException {
    List<ServiceDescriptionRecord> records = records(protocols, owner, maxResults, filterMode);
    return grouper.group(records, ServiceDescriptionRecord::datasetMetadataId);
  }
}
