package nl.pdok.spider.api;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command arguments split into {@code --flags} and {@code key=value} pairs.
 *
 * <p>Aliases are folded onto one canonical flag: {@code -h} and {@code help} become {@code --help},
 * {@code -v} and {@code --debug} become {@code --verbose}, {@code -q} becomes {@code --quiet}.</p>
 */
public final class CliInput {
  private static final Map<String, String> ALIASES = Map.of(
      "-h", "--help",
      "help", "--help",
      "-v", "--verbose",
      "--debug", "--verbose",
      "-q", "--quiet");

  private final List<String> keyValueArgs;
  private final Set<String> flags;

  private CliInput(List<String> keyValueArgs, Set<String> flags) {
    this.keyValueArgs = List.copyOf(keyValueArgs);
    this.flags = Set.copyOf(flags);
  }

  /**
   * Splits raw arguments. Blank and {@code null} entries are skipped; a token that starts with {@code -} and has
   * no {@code =} is a flag, everything else is handed to {@link CliArgsParser}.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new HashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        String canonical = ALIASES.getOrDefault(lower, lower);
        if (canonical.startsWith("-") && !canonical.contains("=")) {
          flags.add(canonical);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(kv, flags);
  }

  /** @return copy of the arguments meant for {@code key=value} parsing */
  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  /** @return {@code true} if help output was requested */
  public boolean help() {
    return flags.contains("--help");
  }

  /** @return {@code true} when DEBUG logging was requested */
  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /** @return {@code true} when only warnings and errors should be logged */
  public boolean quiet() {
    return flags.contains("--quiet");
  }

  /**
   * Checks whether a flag such as {@code --pretty} was given.
   *
   * @param flag flag to query, case-insensitive
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    String lower = flag.trim().toLowerCase(Locale.ROOT);
    return flags.contains(ALIASES.getOrDefault(lower, lower));
  }
}
