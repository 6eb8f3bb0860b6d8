package nl.pdok.spider.application.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import nl.pdok.spider.domain.service.FlatLayerRow;
import nl.pdok.spider.domain.service.ServiceProtocol;
import org.slf4j.Logger;

/**
 * <strong>What:</strong> Reorders flat layer rows by configurable name rules.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Assign each row the index of the first matching rule, in ascending index order.</li>
 *   <li>Assign {@value #UNMATCHED_TILES} to unmatched WMTS rows, {@value #UNMATCHED} to other unmatched rows, and
 *   {@value #UNNAMED} to rows without a name.</li>
 *   <li>Emit rows bucket by bucket in ascending key order, keeping input order inside a bucket.</li>
 * </ul>
 * <p><strong>Observability:</strong> Rules that matched no row are logged at INFO. A rule counts as used only when
 * it was the first match for some row, whatever other rule shares its index.</p>
 *
 * @since 0.1.0
 */
public final class FlatLayerSorter {
  /** Key of unmatched WMTS rows. */
  public static final int UNMATCHED_TILES = 99;
  /** Key of other unmatched rows. */
  public static final int UNMATCHED = 100;
  /** Key of rows without a name. */
  public static final int UNNAMED = 101;

  private final List<SortRule> rules;
  private final Logger log;

  /**
   * Creates a sorter.
   *
   * @param rules sort rules in any order
   * @param log logger receiving unused rules
   */
  public FlatLayerSorter(List<SortRule> rules, Logger log) {
    List<SortRule> ordered = new ArrayList<>(Objects.requireNonNull(rules, "rules"));
    ordered.sort(Comparator.comparingInt(SortRule::index));
    this.rules = List.copyOf(ordered);
    this.log = Objects.requireNonNull(log, "log");
  }

  /**
   * Sorts {@code rows}.
   *
   * @param rows flat rows
   * @return new list in bucket order
   */
  public List<FlatLayerRow> sort(List<FlatLayerRow> rows) {
    TreeMap<Integer, List<FlatLayerRow>> buckets = new TreeMap<>();
    Set<SortRule> matched = Collections.newSetFromMap(new IdentityHashMap<>());
    for (FlatLayerRow row : rows) {
      Optional<SortRule> rule = matchingRule(row);
      rule.ifPresent(matched::add);
      buckets.computeIfAbsent(key(row, rule), k -> new ArrayList<>()).add(row);
    }
    for (SortRule rule : rules) {
      if (!matched.contains(rule)) {
        log.info("No layers found for sort rule {} (types {}, names {})", rule.index(), rule.types(), rule.names());
      }
    }
    List<FlatLayerRow> sorted = new ArrayList<>(rows.size());
    for (List<FlatLayerRow> bucket : buckets.values()) {
      sorted.addAll(bucket);
    }
    return sorted;
  }

  int key(FlatLayerRow row) {
    return key(row, matchingRule(row));
  }

  private static int key(FlatLayerRow row, Optional<SortRule> rule) {
    if (rule.isPresent()) {
      return rule.get().index();
    }
    if (row.name().isEmpty()) {
      return UNNAMED;
    }
    return row.serviceProtocol() == ServiceProtocol.WMTS ? UNMATCHED_TILES : UNMATCHED;
  }

  // Unnamed rows never match a rule.
  private Optional<SortRule> matchingRule(FlatLayerRow row) {
    if (row.name().isEmpty()) {
      return Optional.empty();
    }
    return rules.stream().filter(rule -> rule.matches(row)).findFirst();
  }
}
