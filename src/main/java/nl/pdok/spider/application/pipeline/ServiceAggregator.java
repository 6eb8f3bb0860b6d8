package nl.pdok.spider.application.pipeline;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import nl.pdok.spider.domain.service.Service;
import nl.pdok.spider.domain.service.ServiceError;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.domain.service.ServiceResult;
import org.slf4j.Logger;

/**
 * Partitions resolution results into services and errors and logs the harvest summary.
 *
 * <p>The summary is informational only; a harvest with failures still produces output.</p>
 */
public final class ServiceAggregator {
  private final Logger log;

  /**
   * Creates an aggregator.
   *
   * @param log logger receiving the harvest summary and per-service errors
   * @since 0.1.0
   */
  public ServiceAggregator(Logger log) {
    this.log = Objects.requireNonNull(log, "log");
  }

  /**
   * Splits {@code results}, keeping their relative order.
   *
   * @param results one result per resolved record
   * @return partitioned harvest result
   */
  public HarvestResult aggregate(List<? extends ServiceResult> results) {
    List<Service> services = new ArrayList<>();
    List<ServiceError> errors = new ArrayList<>();
    Map<ServiceProtocol, int[]> perProtocol = new EnumMap<>(ServiceProtocol.class);
    for (ServiceResult result : results) {
      int[] counts = perProtocol.computeIfAbsent(result.protocol(), p -> new int[2]);
      if (result instanceof Service service) {
        services.add(service);
        counts[0]++;
      } else if (result instanceof ServiceError error) {
        errors.add(error);
        counts[1]++;
      }
    }

    log.info("Resolved {} of {} service(s), {} failed", services.size(), results.size(), errors.size());
    for (Map.Entry<ServiceProtocol, int[]> entry : perProtocol.entrySet()) {
      log.info("  {}: {} resolved, {} failed",
          entry.getKey().catalogueValue(), entry.getValue()[0], entry.getValue()[1]);
    }
    for (ServiceError error : errors) {
      log.info("  failed: {} (metadata {})", error.url(), error.metadataId());
    }
    return new HarvestResult(services, errors);
  }
}
