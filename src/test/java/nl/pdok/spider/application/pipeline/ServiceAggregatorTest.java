package nl.pdok.spider.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import java.util.List;
import nl.pdok.spider.domain.service.Service;
import nl.pdok.spider.domain.service.ServiceContent;
import nl.pdok.spider.domain.service.ServiceError;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.domain.service.ServiceResult;
import nl.pdok.spider.testing.CapturedLogs;
import org.junit.jupiter.api.Test;

class ServiceAggregatorTest {

  @Test
  void partitionsResultsAndLogsSummaryPerProtocol() {
    Service wfs = new Service("Wegen", "", "md-1", "ds-1", "https://service.pdok.nl/wegen/wfs", List.of(),
        ServiceProtocol.WFS, new ServiceContent.FeatureContent("", List.of()));
    ServiceError broken = new ServiceError("https://service.pdok.nl/broken/wms", "md-2", ServiceProtocol.WMS);
    List<ServiceResult> results = List.of(wfs, broken);

    try (CapturedLogs logs = CapturedLogs.create("aggregator")) {
      HarvestResult result = new ServiceAggregator(logs.logger()).aggregate(results);

      assertEquals(List.of(wfs), result.services());
      assertEquals(List.of(broken), result.errors());
      assertEquals(2, result.total());
      assertTrue(logs.contains(Level.INFO, "Resolved 1 of 2 service(s), 1 failed"));
      assertTrue(logs.contains(Level.INFO, "OGC:WFS: 1 resolved, 0 failed"));
      assertTrue(logs.contains(Level.INFO, "OGC:WMS: 0 resolved, 1 failed"));
      assertTrue(logs.contains(Level.INFO, "failed: https://service.pdok.nl/broken/wms (metadata md-2)"));
    }
  }
}
