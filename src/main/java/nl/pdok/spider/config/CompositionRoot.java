package nl.pdok.spider.config;

import java.io.IOException;
import java.io.OutputStream;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import nl.pdok.spider.application.exec.FetchOrchestrator;
import nl.pdok.spider.application.exec.RetryPolicy;
import nl.pdok.spider.application.pipeline.CataloguePaginator;
import nl.pdok.spider.application.pipeline.CatalogueSearch;
import nl.pdok.spider.application.pipeline.DatasetGrouper;
import nl.pdok.spider.application.pipeline.HarvestRequest;
import nl.pdok.spider.application.pipeline.HarvestUseCase;
import nl.pdok.spider.application.pipeline.ProtocolDispatcher;
import nl.pdok.spider.application.pipeline.ServiceAggregator;
import nl.pdok.spider.application.pipeline.ServiceListingUseCase;
import nl.pdok.spider.application.pipeline.SortRule;
import nl.pdok.spider.application.port.CapabilitiesReader;
import nl.pdok.spider.application.port.CatalogueClient;
import nl.pdok.spider.application.port.ClockPort;
import nl.pdok.spider.application.port.DocumentFetcher;
import nl.pdok.spider.infrastructure.capabilities.AtomFeedReader;
import nl.pdok.spider.infrastructure.capabilities.OgcApiFeaturesReader;
import nl.pdok.spider.infrastructure.capabilities.OgcApiTilesReader;
import nl.pdok.spider.infrastructure.capabilities.WcsCapabilitiesReader;
import nl.pdok.spider.infrastructure.capabilities.WfsCapabilitiesReader;
import nl.pdok.spider.infrastructure.capabilities.WmsCapabilitiesReader;
import nl.pdok.spider.infrastructure.capabilities.WmtsCapabilitiesReader;
import nl.pdok.spider.infrastructure.csw.CswCatalogueClient;
import nl.pdok.spider.infrastructure.csw.ServiceRecordExtractor;
import nl.pdok.spider.infrastructure.http.HttpDocumentFetcher;
import nl.pdok.spider.infrastructure.output.OutputRenderer;
import nl.pdok.spider.infrastructure.output.OutputSink;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires spider use cases to concrete adapters.
 * <p><strong>Why:</strong> Keeps configuration-to-object translation in one place so the core only ever sees
 * ports and injected loggers.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning catalogue search, capability retrieval, and output.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the shared HTTP transport, executor, and retry policy from {@link HarvestConfig}.</li>
 *   <li>Register one capabilities reader per supported protocol.</li>
 *   <li>Construct the {@code layers} and {@code services} use cases and the output stage.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and use from the CLI thread. The produced use cases are safe to run
 * once at a time.</p>
 *
 * @since 0.1.0
 * @see HarvestUseCase
 * @see ServiceListingUseCase
 */
public final class CompositionRoot {
  private final HarvestConfig config;
  private final DocumentFetcher fetcher;
  private final FetchOrchestrator orchestrator;
  private final CatalogueClient catalogue;
  private final ClockPort clock;

  /**
   * Creates a composition root backed by the real HTTP transport and system clock.
   *
   * @param config validated configuration
   */
  public CompositionRoot(HarvestConfig config) {
    this(config,
        new HttpDocumentFetcher(config.httpTimeout(), LoggerFactory.getLogger(HttpDocumentFetcher.class)),
        ClockPort.SYSTEM);
  }

  /**
   * Creates a composition root with a substitutable transport and clock.
   *
   * @param config validated configuration
   * @param fetcher document transport shared by catalogue and readers
   * @param clock clock used for output timestamps
   */
  public CompositionRoot(HarvestConfig config, DocumentFetcher fetcher, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.orchestrator = new FetchOrchestrator(
        config.concurrency(), "spider-fetch", LoggerFactory.getLogger(FetchOrchestrator.class));
    this.catalogue = new CswCatalogueClient(
        config.cswUrl(),
        fetcher,
        new CataloguePaginator(LoggerFactory.getLogger(CataloguePaginator.class)),
        new ServiceRecordExtractor(LoggerFactory.getLogger(ServiceRecordExtractor.class)),
        LoggerFactory.getLogger(CswCatalogueClient.class));
  }

  /**
   * Builds the readers registered with the dispatcher, one per protocol.
   *
   * @return capability readers
   */
  public List<CapabilitiesReader> capabilitiesReaders() {
    return List.of(
        new WmsCapabilitiesReader(fetcher),
        new WfsCapabilitiesReader(fetcher),
        new WcsCapabilitiesReader(fetcher),
        new WmtsCapabilitiesReader(fetcher),
        new AtomFeedReader(fetcher, LoggerFactory.getLogger(AtomFeedReader.class)),
        new OgcApiTilesReader(fetcher, LoggerFactory.getLogger(OgcApiTilesReader.class)),
        new OgcApiFeaturesReader(fetcher));
  }

  /**
   * Builds the {@code layers} use case.
   *
   * @return harvest use case
   */
  public HarvestUseCase harvestUseCase() {
    RetryPolicy retryPolicy = new RetryPolicy(
        config.retryAttempts(), config.retryBackoff(), LoggerFactory.getLogger(RetryPolicy.class));
    ProtocolDispatcher dispatcher = new ProtocolDispatcher(
        capabilitiesReaders(), retryPolicy, LoggerFactory.getLogger(ProtocolDispatcher.class));
    return new HarvestUseCase(
        catalogueSearch(),
        dispatcher,
        orchestrator,
        new ServiceAggregator(LoggerFactory.getLogger(ServiceAggregator.class)),
        datasetGrouper(),
        LoggerFactory.getLogger(HarvestUseCase.class));
  }

  /**
   * Builds the {@code services} use case.
   *
   * @return listing use case
   */
  public ServiceListingUseCase serviceListingUseCase() {
    return new ServiceListingUseCase(
        catalogueSearch(), datasetGrouper(), LoggerFactory.getLogger(ServiceListingUseCase.class));
  }

  /**
   * Translates the configuration into a harvest request, loading sort rules when configured.
   *
   * @return harvest request
   * @throws IOException when the sort rule file cannot be read
   * @throws IllegalArgumentException when the sort rule file is malformed
   */
  public HarvestRequest harvestRequest() throws IOException {
    List<SortRule> rules = config.sortRules().isPresent()
        ? SortRuleLoader.load(config.sortRules().get())
        : List.of();
    return new HarvestRequest(
        config.protocols(),
        config.owner(),
        config.number(),
        config.identifier(),
        config.filter(),
        config.mode(),
        rules);
  }

  /**
   * Builds the renderer for the configured output format.
   *
   * @return output renderer
   */
  public OutputRenderer outputRenderer() {
    return new OutputRenderer(clock, ZoneId.systemDefault());
  }

  /**
   * Builds a sink writing to {@code stdout} when the target is {@code -}, or to the configured file.
   *
   * @param stdout stream standing in for stdout
   * @return output sink
   */
  public OutputSink outputSink(OutputStream stdout) {
    return new OutputSink(stdout, LoggerFactory.getLogger(OutputSink.class));
  }

  /**
   * Returns the configuration backing this root.
   *
   * @return configuration
   */
  public HarvestConfig config() {
    return config;
  }

  private CatalogueSearch catalogueSearch() {
    return new CatalogueSearch(catalogue, orchestrator, LoggerFactory.getLogger(CatalogueSearch.class));
  }

  private DatasetGrouper datasetGrouper() {
    return new DatasetGrouper(catalogue, orchestrator, LoggerFactory.getLogger(DatasetGrouper.class));
  }
}
