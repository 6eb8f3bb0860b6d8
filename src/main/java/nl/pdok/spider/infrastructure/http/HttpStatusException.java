package nl.pdok.spider.infrastructure.http;

import java.io.IOException;
import java.net.URI;

/**
 * Raised when a remote document request completes with a non-2xx status.
 */
public class HttpStatusException extends IOException {
  private static final long serialVersionUID = 1L;

  private final int statusCode;
  private final URI uri;

  /**
   * Creates the exception.
   *
   * @param uri requested URI
   * @param statusCode HTTP status code
   */
  public HttpStatusException(URI uri, int statusCode) {
    super("HTTP " + statusCode + " for " + uri);
    this.uri = uri;
    this.statusCode = statusCode;
  }

  /** @return HTTP status code */
  public int statusCode() {
    return statusCode;
  }

  /** @return requested URI */
  public URI uri() {
    return uri;
  }
}
