package nl.pdok.spider.config;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import nl.pdok.spider.application.exec.FetchOrchestrator;
import nl.pdok.spider.application.exec.RetryPolicy;
import nl.pdok.spider.application.pipeline.OutputMode;
import nl.pdok.spider.domain.catalogue.FilterMode;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.infrastructure.csw.CswCatalogueClient;
import nl.pdok.spider.infrastructure.output.KeyStyle;
import nl.pdok.spider.infrastructure.output.OutputFormat;
import nl.pdok.spider.validation.Numbers;
import nl.pdok.spider.validation.Strings;

/**
 * <strong>What:</strong> Validated settings for the {@code layers} and {@code services} commands.
 * <p><strong>Why:</strong> Merged CLI, YAML, and default values arrive as strings; this record is the single place
 * where they are parsed, bounded, and defaulted.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param protocols protocols to harvest, in request order
 * @param owner organisation name the catalogue records must belong to
 * @param cswUrl catalogue endpoint
 * @param number maximum records per protocol, {@code 0} for unlimited
 * @param identifier metadata id of a single service record to harvest, or empty
 * @param mode output shape of the {@code layers} command
 * @param filter post-processing of catalogue records
 * @param format output serialization
 * @param keys output key style
 * @param out output file, or {@code -} for stdout
 * @param sortRules sort rule file for flat output
 * @param timestamp whether to add the {@code updated} timestamp
 * @param pretty whether to indent output
 * @param concurrency ceiling on concurrent requests
 * @param retryAttempts attempts per capability document
 * @param retryBackoff wait between attempts
 * @param httpTimeout per-request timeout
 * @param brief whether the {@code services} command lists summary records only
 * @param datasetMd whether the {@code services} command groups records by dataset
 * @since 0.1.0
 */
public record HarvestConfig(
    List<ServiceProtocol> protocols,
    String owner,
    URI cswUrl,
    int number,
    String identifier,
    OutputMode mode,
    FilterMode filter,
    OutputFormat format,
    KeyStyle keys,
    String out,
    Optional<Path> sortRules,
    boolean timestamp,
    boolean pretty,
    int concurrency,
    int retryAttempts,
    Duration retryBackoff,
    Duration httpTimeout,
    boolean brief,
    boolean datasetMd) {

  /** Default catalogue owner. */
  public static final String DEFAULT_OWNER = "Beheer PDOK";
  /** Output target meaning stdout. */
  public static final String STDOUT = "-";

  public HarvestConfig {
    protocols = List.copyOf(protocols);
    Objects.requireNonNull(owner, "owner");
    Objects.requireNonNull(cswUrl, "cswUrl");
    Objects.requireNonNull(identifier, "identifier");
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(filter, "filter");
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(keys, "keys");
    Objects.requireNonNull(out, "out");
    Objects.requireNonNull(sortRules, "sortRules");
    Objects.requireNonNull(retryBackoff, "retryBackoff");
    Objects.requireNonNull(httpTimeout, "httpTimeout");
  }

  /**
   * Builds a configuration from merged string settings.
   *
   * @param args merged key/value settings
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static HarvestConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    OutputMode mode = OutputMode.parse(args.get("mode"));
    List<ServiceProtocol> protocols = protocols(args.get("protocols"), mode);
    String owner = Strings.requireNonBlank("owner", args.getOrDefault("owner", DEFAULT_OWNER));
    URI cswUrl = Strings.requireHttpUrl("cswUrl", args.getOrDefault("cswUrl", CswCatalogueClient.DEFAULT_CSW_URL));
    int number = Numbers.parseInt("number", args.getOrDefault("number", "0"), 0, Integer.MAX_VALUE);
    String identifier = trim(args.get("id"));
    FilterMode filter = FilterMode.parse(args.getOrDefault("filter", "filtered"));
    OutputFormat format = OutputFormat.parse(args.get("format"));
    KeyStyle keys = KeyStyle.parse(args.get("keys"));
    String out = trim(args.get("out"));
    if (out.isEmpty()) {
      out = STDOUT;
    }
    Optional<Path> sortRules = Optional.of(trim(args.get("sortRules"))).filter(s -> !s.isEmpty()).map(Path::of);
    if (sortRules.isPresent() && mode != OutputMode.FLAT) {
      throw new IllegalArgumentException("sortRules requires mode=flat");
    }
    int concurrency = Numbers.parseInt("concurrency",
        args.getOrDefault("concurrency", Integer.toString(FetchOrchestrator.DEFAULT_CONCURRENCY)), 1, 64);
    int retryAttempts = Numbers.parseInt("retryAttempts",
        args.getOrDefault("retryAttempts", Integer.toString(RetryPolicy.DEFAULT_ATTEMPTS)), 1, 10);
    int retryBackoffMs = Numbers.parseInt("retryBackoffMs",
        args.getOrDefault("retryBackoffMs", Long.toString(RetryPolicy.DEFAULT_BACKOFF.toMillis())), 0, 600_000);
    int httpTimeoutMs = Numbers.parseInt("httpTimeoutMs",
        args.getOrDefault("httpTimeoutMs", "60000"), 1, 600_000);

    return new HarvestConfig(
        protocols,
        owner,
        cswUrl,
        number,
        identifier,
        mode,
        filter,
        format,
        keys,
        out,
        sortRules,
        parseBoolean(args.get("timestamp"), true),
        parseBoolean(args.get("pretty"), false),
        concurrency,
        retryAttempts,
        Duration.ofMillis(retryBackoffMs),
        Duration.ofMillis(httpTimeoutMs),
        parseBoolean(args.get("brief"), false),
        parseBoolean(args.get("datasetMd"), false));
  }

  /**
   * Parses a comma separated protocol list. Without an explicit list every protocol is harvested, except
   * INSPIRE Atom for output modes that cannot represent feeds.
   */
  static List<ServiceProtocol> protocols(String value, OutputMode mode) {
    String trimmed = trim(value);
    if (trimmed.isEmpty()) {
      List<ServiceProtocol> all = new ArrayList<>(List.of(ServiceProtocol.values()));
      if (mode != OutputMode.SERVICES) {
        all.remove(ServiceProtocol.ATOM);
      }
      return all;
    }
    Set<ServiceProtocol> parsed = new LinkedHashSet<>();
    for (String token : trimmed.split(",")) {
      if (!token.isBlank()) {
        parsed.add(ServiceProtocol.parse(token));
      }
    }
    if (parsed.isEmpty()) {
      throw new IllegalArgumentException("protocols must name at least one protocol");
    }
    return new ArrayList<>(parsed);
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim();
    if (normalized.equalsIgnoreCase("true")) {
      return true;
    }
    if (normalized.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException("expected true or false (was " + value + ")");
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
