package nl.pdok.spider.infrastructure.output;

import java.util.Locale;

/** Serialization format of output documents. */
public enum OutputFormat {
  JSON,
  YAML;

  /**
   * Parses a CLI value.
   *
   * @param value {@code json} or {@code yaml}; blank selects {@link #JSON}
   * @return format
   * @throws IllegalArgumentException for unknown values
   */
  public static OutputFormat parse(String value) {
    if (value == null || value.isBlank()) {
      return JSON;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "json" -> JSON;
      case "yaml", "yml" -> YAML;
      default -> throw new IllegalArgumentException("format must be json or yaml (was " + value + ")");
    };
  }
}
