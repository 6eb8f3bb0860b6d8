package nl.pdok.spider.infrastructure.output;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Key naming of output documents.
 */
public enum KeyStyle {
  /** {@code service_metadata_id} becomes {@code serviceMetadataId}. */
  CAMEL,
  /** Keys are written as mapped. */
  SNAKE;

  private static final Pattern SNAKE_KEY = Pattern.compile("[a-z][a-z0-9]*(_[a-z0-9]+)+");

  /**
   * Parses a CLI value.
   *
   * @param value {@code camel} or {@code snake}; blank selects {@link #CAMEL}
   * @return key style
   * @throws IllegalArgumentException for unknown values
   */
  public static KeyStyle parse(String value) {
    if (value == null || value.isBlank()) {
      return CAMEL;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "camel" -> CAMEL;
      case "snake" -> SNAKE;
      default -> throw new IllegalArgumentException("keys must be camel or snake (was " + value + ")");
    };
  }

  /**
   * Renames the keys of {@code value} recursively; lists are traversed, scalars are returned unchanged.
   *
   * @param value map, list, or scalar with snake_case keys
   * @return converted copy, or {@code value} itself for scalars and {@link #SNAKE}
   */
  public Object apply(Object value) {
    if (this == SNAKE) {
      return value;
    }
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> converted = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        converted.put(toCamel(String.valueOf(entry.getKey())), apply(entry.getValue()));
      }
      return converted;
    }
    if (value instanceof List<?> list) {
      List<Object> converted = new ArrayList<>(list.size());
      for (Object item : list) {
        converted.add(apply(item));
      }
      return converted;
    }
    return value;
  }

  /**
   * Converts one snake_case key: the first part is kept, later parts are capitalized. Keys that are not
   * snake_case identifiers, such as thesaurus URLs, are returned unchanged.
   *
   * @param key map key
   * @return camelCase key
   */
  static String toCamel(String key) {
    if (!SNAKE_KEY.matcher(key).matches()) {
      return key;
    }
    String[] parts = key.split("_");
    StringBuilder sb = new StringBuilder(parts[0]);
    for (int i = 1; i < parts.length; i++) {
      String part = parts[i];
      if (!part.isEmpty()) {
        sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
      }
    }
    return sb.toString();
  }
}
