package nl.pdok.spider.application.pipeline;

import java.util.List;
import java.util.Objects;
import nl.pdok.spider.domain.service.FlatLayerRow;
import nl.pdok.spider.domain.service.Service;

/**
 * Result of a {@code layers} harvest in the requested output shape.
 */
public sealed interface HarvestOutcome
    permits HarvestOutcome.Services, HarvestOutcome.Datasets, HarvestOutcome.Flat {

  /** @return resolved services and failed records */
  HarvestResult result();

  /** Services in harvest order. */
  record Services(HarvestResult result) implements HarvestOutcome {
    public Services {
      Objects.requireNonNull(result, "result");
    }

    /** @return resolved services */
    public List<Service> services() {
      return result.services();
    }
  }

  /** Services grouped under resolved datasets. */
  record Datasets(HarvestResult result, List<DatasetGroup<Service>> groups) implements HarvestOutcome {
    public Datasets {
      Objects.requireNonNull(result, "result");
      groups = List.copyOf(groups);
    }
  }

  /** One row per content item, sorted when rules were given. */
  record Flat(HarvestResult result, List<FlatLayerRow> rows) implements HarvestOutcome {
    public Flat {
      Objects.requireNonNull(result, "result");
      rows = List.copyOf(rows);
    }
  }
}
