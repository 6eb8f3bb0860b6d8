package nl.pdok.spider.testing;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import nl.pdok.spider.application.port.CatalogueClient;
import nl.pdok.spider.domain.catalogue.CatalogueListRecord;
import nl.pdok.spider.domain.catalogue.DatasetMetadataRecord;
import nl.pdok.spider.domain.catalogue.FilterMode;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.ServiceProtocol;

/** In-memory catalogue keyed by protocol, metadata id, and dataset id. */
public final class FakeCatalogueClient implements CatalogueClient {
  private final Map<ServiceProtocol, List<ServiceDescriptionRecord>> byProtocol = new EnumMap<>(ServiceProtocol.class);
  private final Map<ServiceProtocol, IOException> failures = new EnumMap<>(ServiceProtocol.class);
  private final Map<ServiceProtocol, List<CatalogueListRecord>> listRecords = new EnumMap<>(ServiceProtocol.class);
  private final Map<String, DatasetMetadataRecord> datasets = new HashMap<>();
  private final AtomicInteger calls = new AtomicInteger();

  public FakeCatalogueClient withRecords(ServiceProtocol protocol, ServiceDescriptionRecord... records) {
    byProtocol.computeIfAbsent(protocol, p -> new ArrayList<>()).addAll(List.of(records));
    return this;
  }

  public FakeCatalogueClient withListRecords(ServiceProtocol protocol, CatalogueListRecord... records) {
    listRecords.computeIfAbsent(protocol, p -> new ArrayList<>()).addAll(List.of(records));
    return this;
  }

  public FakeCatalogueClient failing(ServiceProtocol protocol, IOException failure) {
    failures.put(protocol, failure);
    return this;
  }

  public FakeCatalogueClient withDataset(DatasetMetadataRecord dataset) {
    datasets.put(dataset.metadataId(), dataset);
    return this;
  }

  /** @return number of catalogue calls of any kind */
  public int calls() {
    return calls.get();
  }

  @Override
  public List<ServiceDescriptionRecord> queryByProtocol(
      ServiceProtocol protocol, String owner, int maxResults, FilterMode filterMode) throws IOException {
    calls.incrementAndGet();
    IOException failure = failures.get(protocol);
    if (failure != null) {
      throw failure;
    }
    List<ServiceDescriptionRecord> records = byProtocol.getOrDefault(protocol, List.of());
    return maxResults > 0 && records.size() > maxResults ? records.subList(0, maxResults) : records;
  }

  @Override
  public List<ServiceDescriptionRecord> queryById(String metadataId) {
    calls.incrementAndGet();
    List<ServiceDescriptionRecord> matches = new ArrayList<>();
    byProtocol.values().forEach(records -> records.stream()
        .filter(record -> record.metadataId().equals(metadataId))
        .forEach(matches::add));
    return matches;
  }

  @Override
  public Optional<DatasetMetadataRecord> fetchDatasetMetadata(String metadataId) {
    calls.incrementAndGet();
    return Optional.ofNullable(datasets.get(metadataId));
  }

  @Override
  public List<CatalogueListRecord> listByProtocol(ServiceProtocol protocol, String owner, int maxResults)
      throws IOException {
    calls.incrementAndGet();
    IOException failure = failures.get(protocol);
    if (failure != null) {
      throw failure;
    }
    return listRecords.getOrDefault(protocol, List.of());
  }
}
