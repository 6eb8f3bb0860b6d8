package nl.pdok.spider.infrastructure.parse;

import java.io.IOException;

/**
 * Raised when a fetched document is not well-formed or lacks the structure a reader requires.
 */
public class DocumentParseException extends IOException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message description of the problem
   */
  public DocumentParseException(String message) {
    super(message);
  }

  /**
   * Creates the exception with a cause.
   *
   * @param message description of the problem
   * @param cause underlying parser failure
   */
  public DocumentParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
