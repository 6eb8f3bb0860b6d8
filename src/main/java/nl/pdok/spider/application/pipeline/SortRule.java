package nl.pdok.spider.application.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import nl.pdok.spider.domain.service.FlatLayerRow;
import nl.pdok.spider.domain.service.ServiceProtocol;

/**
 * Ordering rule for flat layer rows.
 *
 * @param index sort key assigned to matching rows
 * @param types protocols the rule applies to, as catalogue values or short names
 * @param names patterns searched case-insensitively in the row name
 */
public record SortRule(int index, List<String> types, List<Pattern> names) {
  public SortRule {
    types = types == null ? List.of() : List.copyOf(types);
    names = names == null ? List.of() : List.copyOf(names);
  }

  /**
   * Compiles a rule from its textual form.
   *
   * @param index sort key
   * @param types protocol names
   * @param names regular expressions
   * @return rule
   * @throws IllegalArgumentException when a pattern does not compile
   */
  public static SortRule of(int index, List<String> types, List<String> names) {
    Objects.requireNonNull(names, "names");
    List<Pattern> patterns = new ArrayList<>();
    for (String name : names) {
      try {
        patterns.add(Pattern.compile(name, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
      } catch (PatternSyntaxException ex) {
        throw new IllegalArgumentException("Invalid name pattern in sort rule " + index + ": " + name, ex);
      }
    }
    return new SortRule(index, types, patterns);
  }

  /**
   * Tests whether the rule applies to {@code row}.
   *
   * @param row flat row with a non-empty name
   * @return {@code true} when the protocol is listed and a name pattern is found
   */
  public boolean matches(FlatLayerRow row) {
    if (!appliesTo(row.serviceProtocol())) {
      return false;
    }
    String name = row.name().toLowerCase(Locale.ROOT);
    for (Pattern pattern : names) {
      if (pattern.matcher(name).find()) {
        return true;
      }
    }
    return false;
  }

  private boolean appliesTo(ServiceProtocol protocol) {
    for (String type : types) {
      if (type.equalsIgnoreCase(protocol.catalogueValue()) || type.equalsIgnoreCase(protocol.shortName())) {
        return true;
      }
    }
    return false;
  }
}
