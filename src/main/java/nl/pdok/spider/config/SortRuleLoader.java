package nl.pdok.spider.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import nl.pdok.spider.application.pipeline.SortRule;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads flat-layer sort rules from a JSON or YAML array of {@code {index, types[], names[]}} objects.
 */
public final class SortRuleLoader {

  private SortRuleLoader() {
    // Utility
  }

  /**
   * Reads the rules in {@code path}.
   *
   * @param path rule file; JSON is read as YAML
   * @return rules in file order
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not a list of valid rules
   */
  public static List<SortRule> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(new Yaml().load(reader), path.toString());
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse sort rules at " + path, ex);
    }
  }

  static List<SortRule> parse(Object document, String source) {
    if (!(document instanceof List<?> entries)) {
      throw new IllegalArgumentException("Sort rules at " + source + " must be a list");
    }
    List<SortRule> rules = new ArrayList<>(entries.size());
    for (Object entry : entries) {
      if (!(entry instanceof Map<?, ?> rule)) {
        throw new IllegalArgumentException("Sort rule in " + source + " must be a mapping: " + entry);
      }
      if (!(rule.get("index") instanceof Number index)) {
        throw new IllegalArgumentException("Sort rule in " + source + " lacks a numeric index: " + rule);
      }
      rules.add(SortRule.of(index.intValue(), strings(rule, "types", source), strings(rule, "names", source)));
    }
    return rules;
  }

  private static List<String> strings(Map<?, ?> rule, String key, String source) {
    Object value = rule.get(key);
    if (value == null) {
      return List.of();
    }
    if (!(value instanceof List<?> items)) {
      throw new IllegalArgumentException("Sort rule field '" + key + "' in " + source + " must be a list");
    }
    List<String> strings = new ArrayList<>(items.size());
    for (Object item : items) {
      strings.add(String.valueOf(item));
    }
    return strings;
  }
}
