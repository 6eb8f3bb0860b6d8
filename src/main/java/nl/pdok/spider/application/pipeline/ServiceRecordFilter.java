package nl.pdok.spider.application.pipeline;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import nl.pdok.spider.domain.catalogue.FilterMode;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;

/**
 * Post-processes catalogue service records.
 *
 * <p>In {@link FilterMode#FILTERED} mode records are sorted by title descending, records without service URL are
 * dropped, and one record per service URL is kept (the last one in descending title order). The result is always
 * sorted by title ascending.</p>
 */
public final class ServiceRecordFilter {
  private static final Comparator<ServiceDescriptionRecord> BY_TITLE =
      Comparator.comparing(ServiceDescriptionRecord::title);

  private ServiceRecordFilter() {
    // Utility
  }

  /**
   * Applies the filter.
   *
   * @param records records as returned by the catalogue
   * @param mode filter mode
   * @return new list sorted by title ascending
   */
  public static List<ServiceDescriptionRecord> apply(List<ServiceDescriptionRecord> records, FilterMode mode) {
    List<ServiceDescriptionRecord> working = new ArrayList<>(records);
    if (mode == FilterMode.FILTERED) {
      working.sort(BY_TITLE.reversed());
      Map<String, ServiceDescriptionRecord> byUrl = new LinkedHashMap<>();
      for (ServiceDescriptionRecord record : working) {
        if (!record.serviceUrl().isEmpty()) {
          byUrl.put(record.serviceUrl(), record);
        }
      }
      working = new ArrayList<>(byUrl.values());
    }
    working.sort(BY_TITLE);
    return List.copyOf(working);
  }
}
