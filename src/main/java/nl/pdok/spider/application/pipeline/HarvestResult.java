package nl.pdok.spider.application.pipeline;

import java.util.List;
import nl.pdok.spider.domain.service.Service;
import nl.pdok.spider.domain.service.ServiceError;

/**
 * Resolved services and failed records of one harvest, each in resolution order.
 *
 * @param services services whose capabilities were read
 * @param errors records whose capabilities could not be read
 */
public record HarvestResult(List<Service> services, List<ServiceError> errors) {
  public HarvestResult {
    services = services == null ? List.of() : List.copyOf(services);
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  /** @return number of records attempted */
  public int total() {
    return services.size() + errors.size();
  }
}
