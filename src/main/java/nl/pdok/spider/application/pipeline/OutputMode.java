package nl.pdok.spider.application.pipeline;

import java.util.Locale;

/** Shape of the harvest output document. */
public enum OutputMode {
  /** One entry per service. */
  SERVICES,
  /** Services nested under the datasets they publish. */
  DATASETS,
  /** One row per layer, feature type, or coverage. */
  FLAT;

  /** @return lowercase CLI name */
  public String cliName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a CLI value.
   *
   * @param value {@code services}, {@code datasets}, or {@code flat}; blank selects {@link #SERVICES}
   * @return mode
   * @throws IllegalArgumentException for unknown values
   */
  public static OutputMode parse(String value) {
    if (value == null || value.isBlank()) {
      return SERVICES;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("mode must be services, datasets or flat (was " + value + ")", ex);
    }
  }
}
