package nl.pdok.spider.domain.catalogue;

import java.util.Locale;

/**
 * Post-processing applied to catalogue service records.
 */
public enum FilterMode {
  /** Drop records without URL and keep one record per service URL. */
  FILTERED,
  /** Keep every record; only the final title sort is applied. */
  RAW;

  /**
   * Parses a filter mode name, ignoring case.
   *
   * @param value mode name
   * @return parsed mode
   * @throws IllegalArgumentException for unknown names
   */
  public static FilterMode parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("filter must be filtered or raw");
    }
    try {
      return FilterMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("filter must be filtered or raw (was " + value + ")", ex);
    }
  }
}
