package nl.pdok.spider.api;

/**
 * Aborts argument handling with an exit code after the cause has been logged.
 */
final class CliAbort extends Exception {
  private static final long serialVersionUID = 1L;

  private final ExitCode exitCode;

  CliAbort(ExitCode exitCode) {
    super(null, null, false, false);
    this.exitCode = exitCode;
  }

  ExitCode exitCode() {
    return exitCode;
  }
}
