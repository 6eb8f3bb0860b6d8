package nl.pdok.spider.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by the spider commands.
 * <p><strong>Why:</strong> Scheduled harvest jobs need to tell a bad invocation from an unreachable catalogue
 * or an unsupported output mode without parsing logs.</p>
 * <p><strong>Role:</strong> Adapter-facing enum returned by CLI entry points.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution, including runs where some services could not be resolved. */
  SUCCESS(0),
  /** Command-line arguments or configuration values were invalid. */
  INVALID_ARGS(2),
  /** The catalogue could not be queried or output could not be written. */
  IO_ERROR(3),
  /** A configuration file referenced by the settings was malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** A requested protocol cannot be rendered in the requested output mode. */
  UNSUPPORTED_MODE(6),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
