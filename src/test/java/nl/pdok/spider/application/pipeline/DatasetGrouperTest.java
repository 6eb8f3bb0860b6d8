package nl.pdok.spider.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import java.util.List;
import nl.pdok.spider.application.exec.FetchOrchestrator;
import nl.pdok.spider.domain.catalogue.DatasetMetadataRecord;
import nl.pdok.spider.domain.service.Service;
import nl.pdok.spider.domain.service.ServiceContent;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.testing.CapturedLogs;
import nl.pdok.spider.testing.FakeCatalogueClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class DatasetGrouperTest {
  private final CapturedLogs logs = CapturedLogs.create("grouper");

  @AfterEach
  void tearDown() {
    logs.close();
  }

  @Test
  void groupsServicesUnderResolvedDatasetsInFirstSeenOrder() throws Exception {
    FakeCatalogueClient catalogue = new FakeCatalogueClient()
        .withDataset(new DatasetMetadataRecord("Bestuurlijke Gebieden", "Grenzen", "ds-bg"))
        .withDataset(new DatasetMetadataRecord("Wegen", "Wegennet", "ds-wegen"));
    DatasetGrouper grouper = new DatasetGrouper(
        catalogue, new FetchOrchestrator(4, "test-fetch", logs.logger()), logs.logger());
    Service wegenWms = service("ds-wegen", ServiceProtocol.WMS);
    Service bgWfs = service("ds-bg", ServiceProtocol.WFS);
    Service wegenWfs = service("ds-wegen", ServiceProtocol.WFS);

    List<DatasetGroup<Service>> groups = grouper.group(List.of(wegenWms, bgWfs, wegenWfs), Service::datasetMetadataId);

    assertEquals(2, groups.size());
    assertEquals("ds-wegen", groups.get(0).dataset().metadataId());
    assertEquals(List.of(wegenWms, wegenWfs), groups.get(0).services());
    assertEquals("ds-bg", groups.get(1).dataset().metadataId());
    assertEquals(List.of(bgWfs), groups.get(1).services());
  }

  @Test
  void unresolvedDatasetsAreDroppedWithWarning() throws Exception {
    FakeCatalogueClient catalogue = new FakeCatalogueClient()
        .withDataset(new DatasetMetadataRecord("Wegen", "", "ds-wegen"));
    DatasetGrouper grouper = new DatasetGrouper(
        catalogue, new FetchOrchestrator(4, "test-fetch", logs.logger()), logs.logger());

    List<DatasetGroup<Service>> groups = grouper.group(
        List.of(service("ds-wegen", ServiceProtocol.WMS), service("ds-missing", ServiceProtocol.WMS),
            service("", ServiceProtocol.WMS)),
        Service::datasetMetadataId);

    assertEquals(1, groups.size());
    assertTrue(logs.contains(Level.WARN, "Dropping dataset ds-missing with 1 service(s)"));
    assertEquals(2, catalogue.calls());
  }

  private static Service service(String datasetId, ServiceProtocol protocol) {
    return new Service("Service " + datasetId, "", "md-" + datasetId + "-" + protocol.shortName(), datasetId,
        "https://service.pdok.nl/" + datasetId + "/" + protocol.shortName(), List.of(), protocol,
        new ServiceContent.FeatureContent("", List.of()));
  }
}
