package nl.pdok.spider.testing;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import nl.pdok.spider.application.port.DocumentFetcher;
import nl.pdok.spider.infrastructure.http.HttpStatusException;

/**
 * In-memory {@link DocumentFetcher} answering from registered rules; unmatched requests get a 404.
 */
public final class FixtureFetcher implements DocumentFetcher {
  private final List<Rule> rules = new CopyOnWriteArrayList<>();
  private final List<URI> requests = new CopyOnWriteArrayList<>();

  /** Serves {@code body} for exactly {@code uri}. */
  public FixtureFetcher respond(String uri, String body) {
    return when(candidate -> candidate.toString().equals(uri), body);
  }

  /** Serves a classpath fixture for exactly {@code uri}. */
  public FixtureFetcher respondWithFixture(String uri, String fixture) {
    return respond(uri, Fixtures.read(fixture));
  }

  /** Serves {@code body} for any URI containing all {@code fragments}. */
  public FixtureFetcher whenContains(String body, String... fragments) {
    return when(candidate -> {
      String text = candidate.toString();
      for (String fragment : fragments) {
        if (!text.contains(fragment)) {
          return false;
        }
      }
      return true;
    }, body);
  }

  /** Serves {@code body} for matching URIs. */
  public FixtureFetcher when(Predicate<URI> matcher, String body) {
    rules.add(new Rule(matcher, body, null, new AtomicInteger()));
    return this;
  }

  /** Fails matching requests {@code times} times before serving {@code body}. */
  public FixtureFetcher failThenRespond(String uri, int times, IOException failure, String body) {
    rules.add(new Rule(candidate -> candidate.toString().equals(uri), body, failure, new AtomicInteger(times)));
    return this;
  }

  /** Always fails requests for {@code uri}. */
  public FixtureFetcher fail(String uri, IOException failure) {
    return failThenRespond(uri, Integer.MAX_VALUE, failure, null);
  }

  /** @return requested URIs in request order */
  public List<URI> requests() {
    return new ArrayList<>(requests);
  }

  /** @return number of requests whose URI contains {@code fragment} */
  public long requestCount(String fragment) {
    return requests.stream().filter(uri -> uri.toString().contains(fragment)).count();
  }

  @Override
  public String fetch(URI uri) throws IOException {
    requests.add(uri);
    for (Rule rule : rules) {
      if (!rule.matcher().test(uri)) {
        continue;
      }
      if (rule.failure() != null && rule.remainingFailures().getAndDecrement() > 0) {
        throw rule.failure();
      }
      return rule.body();
    }
    throw new HttpStatusException(uri, 404);
  }

  private record Rule(Predicate<URI> matcher, String body, IOException failure, AtomicInteger remainingFailures) {}
}
