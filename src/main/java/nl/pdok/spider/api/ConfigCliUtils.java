package nl.pdok.spider.api;

import java.util.Map;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Translates output flags into their key/value form unless the key was given explicitly.
   *
   * @param input parsed CLI input
   * @param cliKv mutable CLI key/value map
   */
  static void applyOutputFlags(CliInput input, Map<String, String> cliKv) {
    if (input.hasFlag("--pretty")) {
      cliKv.putIfAbsent("pretty", "true");
    }
    if (input.hasFlag("--no-timestamp")) {
      cliKv.putIfAbsent("timestamp", "false");
    }
  }
}
