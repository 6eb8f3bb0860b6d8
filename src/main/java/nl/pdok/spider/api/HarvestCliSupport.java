package nl.pdok.spider.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import nl.pdok.spider.config.CompositionRoot;
import nl.pdok.spider.config.ConfigMerger;
import nl.pdok.spider.config.DefaultsForCommand;
import nl.pdok.spider.config.HarvestConfig;
import nl.pdok.spider.config.YamlConfigLoader;
import nl.pdok.spider.logging.LoggingConfigurator;
import org.slf4j.Logger;

/**
 * Argument, configuration, and output handling shared by the {@code layers} and {@code services} commands.
 */
final class HarvestCliSupport {

  private HarvestCliSupport() {
    // Utility
  }

  static void configureLogging(CliInput input, String command, Logger log) {
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} command", command);
    } else if (input.quiet()) {
      LoggingConfigurator.enableQuietLogging();
    }
  }

  /**
   * Merges CLI arguments, the optional YAML file, and command defaults into a validated configuration.
   *
   * @param input parsed CLI input
   * @param command command name selecting the YAML section and defaults
   * @param usage summary usage printed on invalid input
   * @param log command logger
   * @return validated configuration
   * @throws CliAbort when arguments or configuration are invalid; the cause has been logged
   */
  static HarvestConfig resolveConfig(CliInput input, String command, String usage, Logger log) throws CliAbort {
    Map<String, String> cliKv;
    try {
      cliKv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }

    String configPath = ConfigCliUtils.extractConfigPath(cliKv);
    ConfigCliUtils.applyOutputFlags(input, cliKv);
    Optional<Map<String, String>> yamlConfig = loadYamlConfig(configPath, command, usage, log);

    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          command, yamlConfig, cliKv, DefaultsForCommand.asFlatMap(command), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", command, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }

    try {
      return HarvestConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", command, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  /**
   * Renders a document in the configured format and writes it to the configured target.
   *
   * @param root composition root supplying renderer and sink
   * @param document snake_case document
   * @throws IOException when rendering or writing fails
   */
  static void emit(CompositionRoot root, Map<String, Object> document) throws IOException {
    HarvestConfig config = root.config();
    String content = root.outputRenderer()
        .render(document, config.format(), config.keys(), config.pretty(), config.timestamp());
    root.outputSink(CliPrinter.documentStream()).write(content, config.out());
  }

  private static Optional<Map<String, String>> loadYamlConfig(
      String configPath, String command, String usage, Logger log) throws CliAbort {
    if (configPath == null) {
      return Optional.empty();
    }

    Path yamlPath = Path.of(configPath);
    if (!Files.exists(yamlPath)) {
      log.error("Configuration file does not exist: {}", yamlPath);
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }

    try {
      return YamlConfigLoader.load(yamlPath, command);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", yamlPath, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }
}
