package nl.pdok.spider.application.pipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;

/**
 * <strong>What:</strong> Drives a paginated catalogue search to completion.
 * <p><strong>Why:</strong> The catalogue is stateful and occasionally inconsistent: its match count can change while
 * paging and {@code nextRecord} is not always trustworthy. This loop always terminates and never returns duplicate
 * identifiers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Request pages of {@link #pageSize(int)} records starting at position 1.</li>
 *   <li>Stop on {@code nextRecord == 0}, on a position past the match count, on a position that does not advance,
 *   on an empty page, once {@code maxResults} records are collected, or after
 *   {@code ceil(matches / pageSize) + 1} requests.</li>
 *   <li>Abort, keeping earlier pages, when the match count changes between pages.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; concurrent searches may share one instance.</p>
 *
 * @since 0.1.0
 */
public final class CataloguePaginator {
  /** Largest page requested from the catalogue. */
  public static final int MAX_PAGE_SIZE = 100;

  private final Logger log;

  /**
   * Creates a paginator.
   *
   * @param log logger receiving pagination warnings
   */
  public CataloguePaginator(Logger log) {
    this.log = Objects.requireNonNull(log, "log");
  }

  /**
   * Returns the page size used for a search limited to {@code maxResults} records.
   *
   * @param maxResults requested maximum, {@code 0} for unlimited
   * @return {@code min(maxResults, 100)}, or 100 when unlimited
   */
  public static int pageSize(int maxResults) {
    if (maxResults < 0) {
      throw new IllegalArgumentException("maxResults must not be negative");
    }
    return maxResults == 0 ? MAX_PAGE_SIZE : Math.min(maxResults, MAX_PAGE_SIZE);
  }

  /**
   * Collects all records of a search.
   *
   * @param query description of the query for log messages
   * @param maxResults maximum number of records, {@code 0} for all
   * @param source retrieves one page
   * @param identity identifier used to drop records already seen on an earlier page
   * @param <T> record type
   * @return collected records in catalogue order, at most {@code maxResults} when positive
   * @throws IOException when the first page cannot be retrieved
   * @throws InterruptedException when interrupted while waiting on the catalogue
   */
  public <T> List<T> collect(
      String query, int maxResults, PageSource<T> source, Function<? super T, String> identity)
      throws IOException, InterruptedException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(identity, "identity");
    int pageSize = pageSize(maxResults);

    Page<T> page = source.fetch(1, pageSize);
    int matches = page.matched();
    int guard = Math.max(1, (matches + pageSize - 1) / pageSize) + 1;
    log.debug("Catalogue query [{}] matched {} record(s); page size {}", query, matches, pageSize);

    List<T> collected = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    append(page, collected, seen, identity);

    int position = 1;
    int requests = 1;
    while (true) {
      if (maxResults > 0 && collected.size() >= maxResults) {
        break;
      }
      int next = page.nextRecord();
      if (next <= 0 || next > matches || next <= position || page.returned() == 0) {
        break;
      }
      if (requests >= guard) {
        log.warn("Catalogue query [{}] stopped after {} requests; nextRecord {} of {} matches",
            query, requests, next, matches);
        break;
      }
      int size = maxResults > 0 ? Math.min(pageSize, maxResults - collected.size()) : pageSize;
      Page<T> candidate;
      try {
        candidate = source.fetch(next, size);
      } catch (IOException ex) {
        log.warn("Catalogue query [{}] failed at position {}; keeping {} record(s): {}",
            query, next, collected.size(), ex.toString());
        break;
      }
      requests++;
      if (candidate.matched() != matches) {
        log.warn("Catalogue query [{}] match count changed from {} to {} at position {}; keeping {} record(s)",
            query, matches, candidate.matched(), next, collected.size());
        break;
      }
      page = candidate;
      position = next;
      append(page, collected, seen, identity);
    }

    if (maxResults > 0 && collected.size() > maxResults) {
      return List.copyOf(collected.subList(0, maxResults));
    }
    return List.copyOf(collected);
  }

  private static <T> void append(
      Page<T> page, List<T> collected, Set<String> seen, Function<? super T, String> identity) {
    for (T record : page.records()) {
      String id = identity.apply(record);
      if (id == null || id.isEmpty() || seen.add(id)) {
        collected.add(record);
      }
    }
  }

  /**
   * One page of a catalogue search.
   *
   * @param records parsed records usable by the caller
   * @param matched {@code numberOfRecordsMatched} reported by the catalogue
   * @param returned {@code numberOfRecordsReturned}, counting records the caller could not use
   * @param nextRecord 1-based position of the next page, {@code 0} when there is none
   * @param <T> record type
   */
  public record Page<T>(List<T> records, int matched, int returned, int nextRecord) {
    public Page {
      records = records == null ? List.of() : List.copyOf(records);
    }
  }

  /**
   * Retrieves one page of a search.
   *
   * @param <T> record type
   */
  @FunctionalInterface
  public interface PageSource<T> {
    /**
     * Fetches a page.
     *
     * @param startPosition 1-based position of the first record
     * @param maxRecords maximum number of records on the page
     * @return the page
     * @throws IOException on transport or parse failures
     * @throws InterruptedException when interrupted
     */
    Page<T> fetch(int startPosition, int maxRecords) throws IOException, InterruptedException;
  }
}
