package nl.pdok.spider.infrastructure.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.Objects;
import nl.pdok.spider.application.port.DocumentFetcher;
import org.slf4j.Logger;

/**
 * <strong>What:</strong> {@link DocumentFetcher} backed by the JDK {@link HttpClient}.
 * <p><strong>Role:</strong> Driven adapter used for catalogue requests and capability documents.</p>
 * <p><strong>Thread-safety:</strong> The underlying client is thread-safe; one instance serves all workers.</p>
 * <p><strong>Decoding:</strong> Bodies are read as bytes and decoded with the charset from {@code Content-Type},
 * a byte order mark or the XML declaration, falling back to UTF-8.</p>
 * <p><strong>Observability:</strong> Logs each request at DEBUG with status and elapsed time.</p>
 *
 * @since 0.1.0
 */
public final class HttpDocumentFetcher implements DocumentFetcher {
  static final String USER_AGENT = "ngr-spider/0.1";
  private static final String ACCEPT =
      "application/xml, text/xml, application/atom+xml, application/json;q=0.9, */*;q=0.8";

  private final HttpClient client;
  private final Duration requestTimeout;
  private final Logger log;

  /**
   * Creates a fetcher with its own client.
   *
   * @param requestTimeout timeout for connecting and for each complete request
   * @param log logger receiving request diagnostics
   */
  public HttpDocumentFetcher(Duration requestTimeout, Logger log) {
    this(HttpClient.newBuilder()
        .connectTimeout(Objects.requireNonNull(requestTimeout, "requestTimeout"))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build(), requestTimeout, log);
  }

  HttpDocumentFetcher(HttpClient client, Duration requestTimeout, Logger log) {
    this.client = Objects.requireNonNull(client, "client");
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    this.log = Objects.requireNonNull(log, "log");
  }

  @Override
  public String fetch(URI uri) throws IOException, InterruptedException {
    Objects.requireNonNull(uri, "uri");
    HttpRequest request = HttpRequest.newBuilder(uri)
        .timeout(requestTimeout)
        .header("User-Agent", USER_AGENT)
        .header("Accept", ACCEPT)
        .GET()
        .build();
    long started = System.nanoTime();
    HttpResponse<byte[]> response = client.send(request, BodyHandlers.ofByteArray());
    long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
    log.debug("GET {} -> {} in {} ms", uri, response.statusCode(), elapsedMs);
    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw new HttpStatusException(uri, response.statusCode());
    }
    return ResponseCharsets.decode(response.body(), response.headers().firstValue("Content-Type"));
  }
}
