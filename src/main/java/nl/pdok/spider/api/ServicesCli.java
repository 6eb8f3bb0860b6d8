package nl.pdok.spider.api;

import java.io.IOException;
import java.util.Map;
import java.util.function.Function;
import nl.pdok.spider.application.pipeline.ServiceListingUseCase;
import nl.pdok.spider.config.CompositionRoot;
import nl.pdok.spider.config.HarvestConfig;
import nl.pdok.spider.infrastructure.output.OutputDocumentMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for listing catalogue service records without contacting the services themselves.
 *
 * @since 0.1.0
 */
public final class ServicesCli {
  private static final Logger log = LoggerFactory.getLogger(ServicesCli.class);
  private static final String COMMAND = "services";
  private static final String SUMMARY_USAGE =
      "usage: services [protocols=OGC:WMS,...] [number=N] [owner=NAME] [cswUrl=URL] [brief=true|false] "
          + "[datasetMd=true|false] [filter=filtered|raw] [out=PATH|-] [format=json|yaml] [keys=camel|snake] "
          + "[config=PATH] [--pretty] [--no-timestamp] [--verbose] [--quiet]";
  private static final String HELP_TEXT = """
      NGR spider: list service metadata records from the national geo registry

      Usage:
        services [options]

      Options:
        protocols=LIST            Comma-separated protocols, see layers --help (default all)
        owner=NAME                Organisation owning the service records (default Beheer PDOK)
        number=N                  Maximum records per protocol, 0 for all (default 0)
        filter=filtered|raw       filtered drops records without URL and duplicate URLs (default filtered)
        brief=true|false          List summary records only (default false)
        datasetMd=true|false      Group records under their dataset metadata (default false)
        cswUrl=URL                Catalogue endpoint
        out=PATH|-                Output file, - for stdout (default -)
        format=json|yaml          Output format (default json)
        keys=camel|snake          Output key style (default camel)
        config=PATH               YAML file with common and services sections
        --pretty                  Indent JSON output
        --no-timestamp            Leave out the updated timestamp
        --verbose                 Enable DEBUG logging
        --quiet                   Log warnings and errors only
        --help                    Show this message
      """;

  private ServicesCli() {}

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
   * Executes the services command and returns a standardized exit code.
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
    return execute(roots.apply(config));
  }

  private static ExitCode execute(CompositionRoot root) {
    HarvestConfig config = root.config();
    ServiceListingUseCase listing = root.serviceListingUseCase();
    try {
      Map<String, Object> document;
      if (config.brief()) {
        document = OutputDocumentMapper.listRecords(
            listing.brief(config.protocols(), config.owner(), config.number()));
      } else if (config.datasetMd()) {
        document = OutputDocumentMapper.serviceRecordsByDataset(
            listing.recordsByDataset(config.protocols(), config.owner(), config.number(), config.filter()));
      } else {
        document = OutputDocumentMapper.serviceRecords(
            listing.records(config.protocols(), config.owner(), config.number(), config.filter()));
      }
      HarvestCliSupport.emit(root, document);
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Catalogue listing I/O failure: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Catalogue listing configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Catalogue listing interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in services listing", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
