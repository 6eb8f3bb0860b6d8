package nl.pdok.spider.application.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import nl.pdok.spider.application.exec.FetchOrchestrator;
import nl.pdok.spider.application.port.CatalogueClient;
import nl.pdok.spider.domain.catalogue.DatasetMetadataRecord;
import org.slf4j.Logger;

/**
 * <strong>What:</strong> Groups harvested services under the datasets they operate on.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Collect distinct non-empty dataset metadata ids in first-seen order.</li>
 *   <li>Look each id up in the catalogue through the {@link FetchOrchestrator}.</li>
 *   <li>Drop datasets that cannot be resolved, with a WARN naming the affected services.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class DatasetGrouper {
  private final CatalogueClient catalogue;
  private final FetchOrchestrator orchestrator;
  private final Logger log;

  /**
   * Creates a grouper.
   *
   * @param catalogue source of dataset metadata
   * @param orchestrator executor for the lookups
   * @param log logger receiving dropped datasets
   */
  public DatasetGrouper(CatalogueClient catalogue, FetchOrchestrator orchestrator, Logger log) {
    this.catalogue = Objects.requireNonNull(catalogue, "catalogue");
    this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    this.log = Objects.requireNonNull(log, "log");
  }

  /**
   * Groups {@code services} by dataset.
   *
   * @param services harvested services or catalogue service records
   * @param datasetId extracts the dataset metadata id of one service
   * @param <T> service representation
   * @return one group per resolved dataset, in first-seen order
   * @throws InterruptedException when interrupted while waiting on lookups
   */
  public <T> List<DatasetGroup<T>> group(List<T> services, Function<? super T, String> datasetId)
      throws InterruptedException {
    Map<String, List<T>> byDataset = new LinkedHashMap<>();
    for (T service : services) {
      String id = datasetId.apply(service);
      if (id != null && !id.isEmpty()) {
        byDataset.computeIfAbsent(id, key -> new ArrayList<>()).add(service);
      }
    }
    List<String> ids = new ArrayList<>(byDataset.keySet());
    List<Optional<DatasetMetadataRecord>> lookups =
        orchestrator.map(ids, catalogue::fetchDatasetMetadata, (id, error) -> {
          log.warn("Dataset metadata lookup for {} failed: {}", id, error.toString());
          return Optional.empty();
        });

    List<DatasetGroup<T>> groups = new ArrayList<>();
    for (int i = 0; i < ids.size(); i++) {
      List<T> members = byDataset.get(ids.get(i));
      Optional<DatasetMetadataRecord> dataset = lookups.get(i);
      if (dataset.isPresent()) {
        groups.add(new DatasetGroup<>(dataset.get(), members));
      } else {
        log.warn("Dropping dataset {} with {} service(s): metadata not found", ids.get(i), members.size());
      }
    }
    return groups;
  }
}
