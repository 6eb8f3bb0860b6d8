package nl.pdok.spider.validation;

/**
 * Numeric validation helpers used by configuration parsing.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Parses a decimal integer and checks it against an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate text
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if the text is not an integer or lies outside {@code [min, max]}
   */
  public static int parseInt(String name, String value, int min, int max) {
    long parsed;
    try {
      parsed = Long.parseLong(Strings.requireNonBlank(name, value));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was " + value + ")", ex);
    }
    return (int) requireRange(name, parsed, min, max);
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
