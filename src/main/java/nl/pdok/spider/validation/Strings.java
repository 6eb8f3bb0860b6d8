package nl.pdok.spider.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through the CLI or configuration files.
 * <p><strong>Why:</strong> Owner names end up inside CQL constraints and URLs are used verbatim for catalogue
 * requests; both are checked before any request is built.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; {@code null} defaults to {@code "value"}
   * @param value candidate text
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value is an absolute {@code http} or {@code https} URL.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate URL
   * @return parsed URI
   * @throws IllegalArgumentException if the value is blank, malformed, or not HTTP(S)
   */
  public static URI requireHttpUrl(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    URI uri;
    try {
      uri = new URI(trimmed);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(message(name, "is not a valid URL: " + ex.getMessage()), ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException(message(name, "must be an http or https URL (was " + trimmed + ")"));
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException(message(name, "must include a host (was " + trimmed + ")"));
    }
    return uri;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
