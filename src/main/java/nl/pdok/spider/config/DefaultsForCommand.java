package nl.pdok.spider.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import nl.pdok.spider.application.exec.FetchOrchestrator;
import nl.pdok.spider.application.exec.RetryPolicy;
import nl.pdok.spider.infrastructure.csw.CswCatalogueClient;

/**
 * Supplies flattened default configuration maps for each spider command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForCommand {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForCommand() {}

  /**
   * Returns the defaults of {@code command} merged with the common defaults.
   *
   * @param command {@code layers} or {@code services}
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for unknown commands
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (command.trim().toLowerCase(Locale.ROOT)) {
      case "layers" -> Map.of("mode", "services", "id", "", "sortRules", "");
      case "services" -> Map.of("brief", "false", "datasetMd", "false");
      default -> throw new IllegalArgumentException("Unsupported command: " + command);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("protocols", "");
    map.put("owner", HarvestConfig.DEFAULT_OWNER);
    map.put("cswUrl", CswCatalogueClient.DEFAULT_CSW_URL);
    map.put("number", "0");
    map.put("filter", "filtered");
    map.put("format", "json");
    map.put("keys", "camel");
    map.put("out", HarvestConfig.STDOUT);
    map.put("timestamp", "true");
    map.put("pretty", "false");
    map.put("concurrency", Integer.toString(FetchOrchestrator.DEFAULT_CONCURRENCY));
    map.put("retryAttempts", Integer.toString(RetryPolicy.DEFAULT_ATTEMPTS));
    map.put("retryBackoffMs", Long.toString(RetryPolicy.DEFAULT_BACKOFF.toMillis()));
    map.put("httpTimeoutMs", "60000");
    return Map.copyOf(map);
  }
}
