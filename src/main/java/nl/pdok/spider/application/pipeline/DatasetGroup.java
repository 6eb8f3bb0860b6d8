package nl.pdok.spider.application.pipeline;

import java.util.List;
import java.util.Objects;
import nl.pdok.spider.domain.catalogue.DatasetMetadataRecord;

/**
 * A dataset with the services that publish it.
 *
 * @param dataset dataset metadata from the catalogue
 * @param services services, or service records, operating on the dataset, in harvest order
 * @param <T> service representation
 */
public record DatasetGroup<T>(DatasetMetadataRecord dataset, List<T> services) {
  public DatasetGroup {
    Objects.requireNonNull(dataset, "dataset");
    services = services == null ? List.of() : List.copyOf(services);
  }
}
