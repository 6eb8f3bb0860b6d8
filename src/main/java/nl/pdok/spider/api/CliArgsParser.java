package nl.pdok.spider.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns the {@code name=value} arguments of the {@code layers} and {@code services} commands into a settings map
 * keyed by canonical setting names.
 *
 * <p>Names are matched case-insensitively and may carry a leading {@code --}, so {@code --cswurl=...} and
 * {@code cswUrl=...} both land on {@code cswUrl}. The value is everything after the first {@code '='}: catalogue
 * URLs with query strings and protocol lists such as {@code protocols=OGC:WMS,OGC:WFS} pass through untouched.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  /** Setting names accepted on the command line, in usage order. */
  static final List<String> SETTING_NAMES = List.of(
      "config", "protocols", "mode", "owner", "cswUrl", "number", "id", "filter", "format", "keys", "out",
      "sortRules", "timestamp", "pretty", "brief", "datasetMd", "concurrency", "retryAttempts",
      "retryBackoffMs", "httpTimeoutMs");

  private static final Map<String, String> CANONICAL = SETTING_NAMES.stream()
      .collect(Collectors.toUnmodifiableMap(name -> name.toLowerCase(Locale.ROOT), Function.identity()));

  private CliArgsParser() {
    // Utility
  }

  /**
   * Parses the settings arguments.
   *
   * <p>An explicitly empty value such as {@code id=} is kept, so it can blank out a YAML setting. {@code null}
   * and blank arguments are skipped.</p>
   *
   * @param args raw arguments; {@code null} returns an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException when an argument is not {@code name=value}, names an unknown setting, repeats
   *     a setting, or carries control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> settings = new LinkedHashMap<>();
    if (args == null) {
      return settings;
    }
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx < 0) {
        throw new IllegalArgumentException("argument must be name=value (was '" + arg + "')");
      }
      String name = canonicalName(arg.substring(0, idx));
      String value = arg.substring(idx + 1).trim();
      if (containsControl(value)) {
        throw new IllegalArgumentException("argument " + name + " must not contain control characters");
      }
      if (settings.putIfAbsent(name, value) != null) {
        throw new IllegalArgumentException("argument " + name + " given more than once");
      }
    }
    return settings;
  }

  static String canonicalName(String rawName) {
    String name = rawName.trim();
    if (name.startsWith("--")) {
      name = name.substring(2);
    }
    if (name.isEmpty()) {
      throw new IllegalArgumentException("argument name is missing before '='");
    }
    String canonical = CANONICAL.get(name.toLowerCase(Locale.ROOT));
    if (canonical == null) {
      throw new IllegalArgumentException(
          "unknown argument '" + name + "'; expected one of " + String.join(", ", SETTING_NAMES));
    }
    return canonical;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
