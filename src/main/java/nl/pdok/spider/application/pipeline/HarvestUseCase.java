package nl.pdok.spider.application.pipeline;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import nl.pdok.spider.application.exec.FetchOrchestrator;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.FlatLayerRow;
import nl.pdok.spider.domain.service.Service;
import nl.pdok.spider.domain.service.ServiceError;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.domain.service.ServiceResult;
import nl.pdok.spider.domain.service.UnsupportedModeException;
import org.slf4j.Logger;

/**
 * <strong>What:</strong> Runs a {@code layers} harvest: catalogue search, capability retrieval, and shaping.
 * <p><strong>Why:</strong> Keeps the batch sequence in one place so the CLI only parses arguments and writes
 * output.</p>
 * <p><strong>Role:</strong> Application-layer use case coordinating {@link CatalogueSearch},
 * {@link ProtocolDispatcher}, {@link ServiceAggregator}, and the output-mode specific steps.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject protocol and mode combinations without a representation before any request is made.</li>
 *   <li>Run the batches in sequence: catalogue queries, capability retrieval, dataset lookups.</li>
 *   <li>Return every resolved service; failed services only show up in the summary.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe to reuse sequentially; each call runs its own batches.</p>
 * <p><strong>Observability:</strong> Logs batch progress at INFO.</p>
 *
 * @since 0.1.0
 */
public final class HarvestUseCase {
  private final CatalogueSearch search;
  private final ProtocolDispatcher dispatcher;
  private final FetchOrchestrator orchestrator;
  private final ServiceAggregator aggregator;
  private final DatasetGrouper grouper;
  private final Logger log;

  /**
   * Creates the use case.
   *
   * @param search multi-protocol catalogue search
   * @param dispatcher capability retrieval per record
   * @param orchestrator executor for capability retrieval
   * @param aggregator summary and partitioning
   * @param grouper dataset grouping for {@link OutputMode#DATASETS}
   * @param log logger receiving progress
   */
  public HarvestUseCase(
      CatalogueSearch search,
      ProtocolDispatcher dispatcher,
      FetchOrchestrator orchestrator,
      ServiceAggregator aggregator,
      DatasetGrouper grouper,
      Logger log) {
    this.search = Objects.requireNonNull(search, "search");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.grouper = Objects.requireNonNull(grouper, "grouper");
    this.log = Objects.requireNonNull(log, "log");
  }

  /**
   * Checks that every requested protocol can be written in the requested mode.
   *
   * @param request harvest request
   * @throws UnsupportedModeException when a protocol has no representation in the mode
   */
  public static void validate(HarvestRequest request) {
    for (ServiceProtocol protocol : request.protocols()) {
      requireSupported(protocol, request.mode());
    }
  }

  /**
   * Runs the harvest.
   *
   * @param request harvest request
   * @return harvest outcome in the requested shape
   * @throws UnsupportedModeException when a protocol has no representation in the mode
   * @throws IOException when the catalogue cannot be queried
   * @throws InterruptedException when interrupted while waiting on remote services
   */
  public HarvestOutcome run(HarvestRequest request) throws IOException, InterruptedException {
    Objects.requireNonNull(request, "request");
    if (request.identifier().isEmpty()) {
      validate(request);
    }

    List<ServiceDescriptionRecord> records = request.identifier().isEmpty()
        ? search.serviceRecords(request.protocols(), request.owner(), request.maxResults(), request.filterMode())
        : search.serviceRecordsById(request.identifier());
    for (ServiceDescriptionRecord record : records) {
      requireSupported(record.serviceProtocol(), request.mode());
    }

    log.info("Retrieving capabilities of {} service(s)", records.size());
    List<ServiceResult> resolved = orchestrator.map(records, dispatcher::resolve,
        (record, error) -> {
          log.error("Capability retrieval for {} failed: {}", record.serviceUrl(), error.toString());
          return new ServiceError(record.serviceUrl(), record.metadataId(), record.serviceProtocol());
        });
    HarvestResult result = aggregator.aggregate(resolved);

    return switch (request.mode()) {
      case SERVICES -> new HarvestOutcome.Services(result);
      case DATASETS -> {
        log.info("Resolving dataset metadata for {} service(s)", result.services().size());
        yield new HarvestOutcome.Datasets(result, grouper.group(result.services(), Service::datasetMetadataId));
      }
      case FLAT -> {
        List<FlatLayerRow> rows = LayerFlattener.flatten(result.services());
        if (!request.sortRules().isEmpty()) {
          rows = new FlatLayerSorter(request.sortRules(), log).sort(rows);
        }
        yield new HarvestOutcome.Flat(result, rows);
      }
    };
  }

  private static void requireSupported(ServiceProtocol protocol, OutputMode mode) {
    if (mode == OutputMode.DATASETS && protocol == ServiceProtocol.ATOM) {
      throw new UnsupportedModeException(protocol, OutputMode.DATASETS.cliName());
    }
    if (mode == OutputMode.FLAT) {
      LayerFlattener.requireSupported(protocol);
    }
  }
}
