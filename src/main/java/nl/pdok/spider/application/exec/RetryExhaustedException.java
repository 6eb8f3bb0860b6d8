package nl.pdok.spider.application.exec;

/**
 * Raised by {@link RetryPolicy} when every attempt failed. The cause is the failure of the last attempt.
 */
public class RetryExhaustedException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int attempts;

  /**
   * Creates the exception.
   *
   * @param description action that was retried
   * @param attempts number of attempts made
   * @param cause failure of the last attempt
   */
  public RetryExhaustedException(String description, int attempts, Exception cause) {
    super(description + " failed after " + attempts + " attempt(s): " + cause, cause);
    this.attempts = attempts;
  }

  /** @return number of attempts made */
  public int attempts() {
    return attempts;
  }
}
