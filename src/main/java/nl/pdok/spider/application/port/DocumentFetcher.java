package nl.pdok.spider.application.port;

import java.io.IOException;
import java.net.URI;

/**
 * <strong>What:</strong> Port retrieving remote documents (capabilities, feeds, JSON resources) as text.
 * <p><strong>Why:</strong> Keeps capability readers and the catalogue client independent of the HTTP stack so
 * tests can serve fixtures from memory.</p>
 * <p><strong>Thread-safety:</strong> Implementations must allow concurrent calls from fetch workers.</p>
 *
 * @since 0.1.0
 */
public interface DocumentFetcher {
  /**
   * Fetches the document at {@code uri}.
   *
   * @param uri absolute document URI
   * @return response body decoded as text
   * @throws IOException on transport failures or unsuccessful responses
   * @throws InterruptedException when the calling thread is interrupted
   */
  String fetch(URI uri) throws IOException, InterruptedException;
}
