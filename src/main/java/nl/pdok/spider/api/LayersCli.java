package nl.pdok.spider.api;

import java.io.IOException;
import java.util.Map;
import java.util.function.Function;
import nl.pdok.spider.application.pipeline.HarvestOutcome;
import nl.pdok.spider.application.pipeline.HarvestRequest;
import nl.pdok.spider.application.pipeline.HarvestResult;
import nl.pdok.spider.config.CompositionRoot;
import nl.pdok.spider.config.HarvestConfig;
import nl.pdok.spider.domain.service.UnsupportedModeException;
import nl.pdok.spider.infrastructure.output.OutputDocumentMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for harvesting service capabilities into services, datasets, or flat layer documents.
 *
 * @since 0.1.0
 */
public final class LayersCli {
  private static final Logger log = LoggerFactory.getLogger(LayersCli.class);
  private static final String COMMAND = "layers";
  private static final String SUMMARY_USAGE =
      "usage: layers [protocols=OGC:WMS,OGC:WFS,...] [mode=services|datasets|flat] [number=N] [id=UUID] "
          + "[owner=NAME] [cswUrl=URL] [sortRules=PATH] [out=PATH|-] [format=json|yaml] [keys=camel|snake] "
          + "[filter=filtered|raw] [concurrency=1-64] [config=PATH] [--pretty] [--no-timestamp] [--verbose] "
          + "[--quiet]";
  private static final String HELP_TEXT = """
      NGR spider: harvest service capabilities listed in the national geo registry

      Usage:
        layers [options]

      Selection:
        protocols=LIST            Comma-separated protocols (OGC:WMS, OGC:WFS, OGC:WCS, OGC:WMTS,
                                  INSPIRE Atom, OGC:API tiles, OGC:API features or wms, wfs, wcs,
                                  wmts, atom, oat, oaf). Default: all supported by the mode
        owner=NAME                Organisation owning the service records (default Beheer PDOK)
        number=N                  Maximum records per protocol, 0 for all (default 0)
        id=UUID                   Harvest one service record; cannot be combined with number
        filter=filtered|raw       filtered drops records without URL and duplicate URLs (default filtered)
        cswUrl=URL                Catalogue endpoint (default nationaalgeoregister.nl)

      Output:
        mode=services|datasets|flat
                                  services: one entry per service (default)
                                  datasets: services grouped by dataset (no INSPIRE Atom)
                                  flat:     one row per layer (no INSPIRE Atom)
        sortRules=PATH            JSON or YAML sort rules for mode=flat
        out=PATH|-                Output file, - for stdout (default -)
        format=json|yaml          Output format (default json)
        keys=camel|snake          Output key style (default camel)
        --pretty                  Indent JSON output
        --no-timestamp            Leave out the updated timestamp

      Tuning:
        concurrency=1-64          Concurrent requests (default 10)
        retryAttempts=1-10        Attempts per capabilities document (default 3)
        retryBackoffMs=0-600000   Wait between attempts (default 5000)
        httpTimeoutMs=1-600000    Per-request timeout (default 60000)
        config=PATH               YAML file with common and layers sections

      Logging:
        --verbose                 Enable DEBUG logging
        --quiet                   Log warnings and errors only
        --help                    Show this message

      Exit codes:
        0 success (also when some services failed), 2 invalid arguments, 3 I/O failure,
        4 malformed sort rules, 5 every service failed, 6 protocol not supported in mode, 130 interrupted
      """;

  private LayersCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the layers command and returns a standardized exit code.
   *
   * @param args raw CLI arguments
   * @return exit code that callers can inspect
   */
  static ExitCode run(String[] args) {
    return run(args, CompositionRoot::new);
  }

  static ExitCode run(String[] args, Function<HarvestConfig, CompositionRoot> roots) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    HarvestCliSupport.configureLogging(input, COMMAND, log);

    HarvestConfig config;
    try {
      config = HarvestCliSupport.resolveConfig(input, COMMAND, SUMMARY_USAGE, log);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    log.info("Configured layers harvest: mode={}, protocols={}, owner={}, out={}",
        config.mode().cliName(), config.protocols(), config.owner(), config.out());
    return execute(roots.apply(config));
  }

  private static ExitCode execute(CompositionRoot root) {
    try {
      HarvestRequest request = root.harvestRequest();
      HarvestOutcome outcome = root.harvestUseCase().run(request);
      HarvestCliSupport.emit(root, document(outcome));
      return exitCodeFor(outcome.result());
    } catch (UnsupportedModeException ex) {
      log.error("Unsupported output mode: {}", ex.getMessage());
      return ExitCode.UNSUPPORTED_MODE;
    } catch (IOException ex) {
      log.error("Harvest I/O failure: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Harvest configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Harvest interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in layers harvest", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static Map<String, Object> document(HarvestOutcome outcome) {
    if (outcome instanceof HarvestOutcome.Services services) {
      return OutputDocumentMapper.services(services.services());
    }
    if (outcome instanceof HarvestOutcome.Datasets datasets) {
      return OutputDocumentMapper.datasets(datasets.groups());
    }
    if (outcome instanceof HarvestOutcome.Flat flat) {
      return OutputDocumentMapper.layers(flat.rows());
    }
    throw new IllegalStateException("unknown harvest outcome " + outcome.getClass().getName());
  }

  private static ExitCode exitCodeFor(HarvestResult result) {
    if (result.services().isEmpty() && !result.errors().isEmpty()) {
      log.error("None of the {} service(s) could be resolved", result.errors().size());
      return ExitCode.RUNTIME_FAILURE;
    }
    return ExitCode.SUCCESS;
  }
}
