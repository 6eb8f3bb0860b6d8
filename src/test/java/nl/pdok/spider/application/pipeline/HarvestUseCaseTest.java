package nl.pdok.spider.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import nl.pdok.spider.application.exec.FetchOrchestrator;
import nl.pdok.spider.application.exec.RetryPolicy;
import nl.pdok.spider.application.port.CapabilitiesReader;
import nl.pdok.spider.domain.catalogue.DatasetMetadataRecord;
import nl.pdok.spider.domain.catalogue.FilterMode;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.ContentItem;
import nl.pdok.spider.domain.service.FlatLayerRow;
import nl.pdok.spider.domain.service.Service;
import nl.pdok.spider.domain.service.ServiceContent;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.domain.service.UnsupportedModeException;
import nl.pdok.spider.testing.CapturedLogs;
import nl.pdok.spider.testing.FakeCatalogueClient;
import nl.pdok.spider.testing.ServiceRecords;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class HarvestUseCaseTest {
  private final CapturedLogs logs = CapturedLogs.create("harvest");
  private final AtomicInteger reads = new AtomicInteger();

  @AfterEach
  void tearDown() {
    logs.close();
  }

  @Test
  void datasetModeWithAtomIsRejectedBeforeAnyNetworkCall() {
    FakeCatalogueClient catalogue = new FakeCatalogueClient()
        .withRecords(ServiceProtocol.ATOM, ServiceRecords.record(ServiceProtocol.ATOM, "https://x/atom.xml"));
    HarvestUseCase useCase = useCase(catalogue);

    UnsupportedModeException ex = assertThrows(UnsupportedModeException.class, () -> useCase.run(request(
        List.of(ServiceProtocol.WMS, ServiceProtocol.ATOM), OutputMode.DATASETS, List.of())));

    assertEquals(ServiceProtocol.ATOM, ex.protocol());
    assertEquals("datasets", ex.mode());
    assertEquals(0, catalogue.calls());
    assertEquals(0, reads.get());
  }

  @Test
  void flatModeWithAtomIsRejected() {
    assertThrows(UnsupportedModeException.class, () -> HarvestUseCase.validate(request(
        List.of(ServiceProtocol.ATOM), OutputMode.FLAT, List.of())));
  }

  @Test
  void servicesModeKeepsResolvedServicesAndCountsFailures() throws Exception {
    FakeCatalogueClient catalogue = new FakeCatalogueClient()
        .withRecords(ServiceProtocol.WMS,
            ServiceRecords.record(ServiceProtocol.WMS, "https://service.pdok.nl/a/wms", "md-a", "ds-a", "A"),
            ServiceRecords.record(ServiceProtocol.WMS, "https://service.pdok.nl/fail/wms", "md-f", "ds-f", "F"));

    HarvestOutcome outcome = useCase(catalogue).run(request(List.of(ServiceProtocol.WMS), OutputMode.SERVICES,
        List.of()));

    HarvestOutcome.Services services = assertInstanceOf(HarvestOutcome.Services.class, outcome);
    assertEquals(1, services.services().size());
    assertEquals("md-a", services.services().get(0).metadataId());
    assertEquals(1, outcome.result().errors().size());
    assertEquals("https://service.pdok.nl/fail/wms", outcome.result().errors().get(0).url());
  }

  @Test
  void datasetModeGroupsResolvedServices() throws Exception {
    FakeCatalogueClient catalogue = new FakeCatalogueClient()
        .withRecords(ServiceProtocol.WMS,
            ServiceRecords.record(ServiceProtocol.WMS, "https://service.pdok.nl/a/wms", "md-a", "ds-a", "A"))
        .withRecords(ServiceProtocol.WFS,
            ServiceRecords.record(ServiceProtocol.WFS, "https://service.pdok.nl/a/wfs", "md-b", "ds-a", "B"))
        .withDataset(new DatasetMetadataRecord("Dataset A", "Over A", "ds-a"));

    HarvestOutcome outcome = useCase(catalogue).run(request(
        List.of(ServiceProtocol.WMS, ServiceProtocol.WFS), OutputMode.DATASETS, List.of()));

    HarvestOutcome.Datasets datasets = assertInstanceOf(HarvestOutcome.Datasets.class, outcome);
    assertEquals(1, datasets.groups().size());
    assertEquals("Dataset A", datasets.groups().get(0).dataset().title());
    assertEquals(2, datasets.groups().get(0).services().size());
  }

  @Test
  void flatModeExplodesLayersAndAppliesSortRules() throws Exception {
    FakeCatalogueClient catalogue = new FakeCatalogueClient()
        .withRecords(ServiceProtocol.WFS,
            ServiceRecords.record(ServiceProtocol.WFS, "https://service.pdok.nl/a/wfs", "md-a", "ds-a", "A"))
        .withRecords(ServiceProtocol.WMTS,
            ServiceRecords.record(ServiceProtocol.WMTS, "https://service.pdok.nl/b/wmts", "md-b", "ds-b", "B"));

    HarvestOutcome outcome = useCase(catalogue).run(request(
        List.of(ServiceProtocol.WFS, ServiceProtocol.WMTS), OutputMode.FLAT,
        List.of(SortRule.of(0, List.of("wmts"), List.of("^base$")))));

    HarvestOutcome.Flat flat = assertInstanceOf(HarvestOutcome.Flat.class, outcome);
    List<String> order = flat.rows().stream()
        .map(row -> row.serviceProtocol().shortName() + ":" + row.name())
        .collect(Collectors.toList());
    assertEquals(List.of("wmts:base", "wmts:overlay", "wfs:base", "wfs:overlay"), order);
    FlatLayerRow first = flat.rows().get(0);
    assertEquals("https://service.pdok.nl/b/wmts", first.serviceUrl());
    assertEquals("md-b", first.serviceMetadataId());
  }

  @Test
  void singleRecordHarvestSkipsProtocolSearch() throws Exception {
    FakeCatalogueClient catalogue = new FakeCatalogueClient()
        .withRecords(ServiceProtocol.WMS,
            ServiceRecords.record(ServiceProtocol.WMS, "https://service.pdok.nl/a/wms", "md-a", "ds-a", "A"),
            ServiceRecords.record(ServiceProtocol.WMS, "https://service.pdok.nl/b/wms", "md-b", "ds-b", "B"));
    HarvestRequest request = new HarvestRequest(List.of(), "Beheer PDOK", 0, "md-b", FilterMode.FILTERED,
        OutputMode.SERVICES, List.of());

    HarvestOutcome outcome = useCase(catalogue).run(request);

    assertEquals(1, outcome.result().services().size());
    assertEquals("md-b", outcome.result().services().get(0).metadataId());
  }

  private HarvestUseCase useCase(FakeCatalogueClient catalogue) {
    FetchOrchestrator orchestrator = new FetchOrchestrator(4, "test-fetch", logs.logger());
    RetryPolicy retry = new RetryPolicy(2, Duration.ofMillis(1), logs.logger());
    List<CapabilitiesReader> readers = new ArrayList<>();
    for (ServiceProtocol protocol : ServiceProtocol.values()) {
      readers.add(new StubReader(protocol));
    }
    return new HarvestUseCase(
        new CatalogueSearch(catalogue, orchestrator, logs.logger()),
        new ProtocolDispatcher(readers, retry, logs.logger()),
        orchestrator,
        new ServiceAggregator(logs.logger()),
        new DatasetGrouper(catalogue, orchestrator, logs.logger()),
        logs.logger());
  }

  private static HarvestRequest request(List<ServiceProtocol> protocols, OutputMode mode, List<SortRule> rules) {
    return new HarvestRequest(protocols, "Beheer PDOK", 0, "", FilterMode.FILTERED, mode, rules);
  }

  private final class StubReader implements CapabilitiesReader {
    private final ServiceProtocol protocol;

    StubReader(ServiceProtocol protocol) {
      this.protocol = protocol;
    }

    @Override
    public ServiceProtocol protocol() {
      return protocol;
    }

    @Override
    public Service read(ServiceDescriptionRecord record) throws IOException {
      reads.incrementAndGet();
      if (record.serviceUrl().contains("/fail/")) {
        throw new IOException("503 Service Unavailable");
      }
      List<ContentItem.FeatureType> items = List.of(
          new ContentItem.FeatureType("base", "Base", "", record.datasetMetadataId()),
          new ContentItem.FeatureType("overlay", "Overlay", "", record.datasetMetadataId()));
      ServiceContent content = protocol == ServiceProtocol.WMTS
          ? new ServiceContent.TileContent(List.of(
              new ContentItem.TileLayer("base", "Base", "", "", List.of(), "EPSG:28992", "image/png"),
              new ContentItem.TileLayer("overlay", "Overlay", "", "", List.of(), "EPSG:28992", "image/png")))
          : new ServiceContent.FeatureContent("application/json", items);
      return new Service(record.title(), "", record.metadataId(), record.datasetMetadataId(),
          record.serviceUrl(), List.of(), protocol, content);
    }
  }
}
