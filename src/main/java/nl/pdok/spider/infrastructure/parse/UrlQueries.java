package nl.pdok.spider.infrastructure.parse;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Query-string helpers for metadata references embedded in catalogue records and capabilities.
 */
public final class UrlQueries {

  private UrlQueries() {
    // Utility
  }

  /**
   * Parses the query string of a URL into a map with lowercased keys. The first occurrence of a key wins.
   *
   * @param url URL text; {@code null} yields an empty map
   * @return decoded parameters keyed by lowercased name
   */
  public static Map<String, String> parameters(String url) {
    Map<String, String> params = new LinkedHashMap<>();
    if (url == null) {
      return params;
    }
    int start = url.indexOf('?');
    if (start < 0 || start == url.length() - 1) {
      return params;
    }
    int end = url.indexOf('#', start);
    String query = end < 0 ? url.substring(start + 1) : url.substring(start + 1, end);
    for (String pair : query.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String key = eq < 0 ? pair : pair.substring(0, eq);
      String value = eq < 0 ? "" : pair.substring(eq + 1);
      params.putIfAbsent(decode(key).toLowerCase(Locale.ROOT), decode(value));
    }
    return params;
  }

  /**
   * Extracts a metadata identifier from a metadata URL, preferring {@code uuid} over {@code id}.
   *
   * @param url metadata URL
   * @return identifier, or empty when neither parameter is present
   */
  public static String metadataId(String url) {
    Map<String, String> params = parameters(url);
    String uuid = params.get("uuid");
    if (uuid != null && !uuid.isBlank()) {
      return uuid.trim();
    }
    String id = params.get("id");
    return id == null ? "" : id.trim();
  }

  /**
   * Removes the query string and fragment from a URL.
   *
   * @param url URL text
   * @return URL without query and fragment
   */
  public static String stripQuery(String url) {
    if (url == null) {
      return "";
    }
    int cut = url.length();
    int q = url.indexOf('?');
    if (q >= 0) {
      cut = q;
    }
    int f = url.indexOf('#');
    if (f >= 0 && f < cut) {
      cut = f;
    }
    return url.substring(0, cut);
  }

  private static String decode(String value) {
    try {
      return URLDecoder.decode(value, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      return value;
    }
  }
}
