package nl.pdok.spider.infrastructure.capabilities;

import java.net.URI;
import java.util.Locale;
import nl.pdok.spider.infrastructure.parse.DocumentParseException;

/**
 * Builds capability request URIs from canonical service URLs.
 */
final class CapabilitiesRequests {

  private CapabilitiesRequests() {
    // Utility
  }

  /**
   * Adds a {@code version} parameter unless the URL already has one.
   *
   * @param url canonical GetCapabilities URL
   * @param version protocol version to request
   * @return request URI
   * @throws DocumentParseException when the URL is not a valid URI
   */
  static URI withVersion(String url, String version) throws DocumentParseException {
    String lower = url.toLowerCase(Locale.ROOT);
    if (lower.contains("?version=") || lower.contains("&version=")) {
      return toUri(url);
    }
    return toUri(url + (url.contains("?") ? "&" : "?") + "version=" + version);
  }

  /**
   * Adds {@code f=json} unless the URL already selects a format.
   *
   * @param url OGC API resource URL
   * @return request URI
   * @throws DocumentParseException when the URL is not a valid URI
   */
  static URI withJsonFormat(String url) throws DocumentParseException {
    String lower = url.toLowerCase(Locale.ROOT);
    if (lower.contains("?f=") || lower.contains("&f=")) {
      return toUri(url);
    }
    return toUri(url + (url.contains("?") ? "&" : "?") + "f=json");
  }

  /**
   * Parses a URL into a URI.
   *
   * @param url URL text
   * @return URI
   * @throws DocumentParseException when the URL is not a valid URI
   */
  static URI toUri(String url) throws DocumentParseException {
    try {
      return URI.create(url.trim());
    } catch (IllegalArgumentException ex) {
      throw new DocumentParseException("Invalid service URL: " + url, ex);
    }
  }

  /**
   * Resolves a possibly relative link against the document it appeared in.
   *
   * @param base URI of the containing document
   * @param href link target
   * @return absolute URI
   * @throws DocumentParseException when the link is not a valid URI
   */
  static URI resolve(URI base, String href) throws DocumentParseException {
    try {
      return base.resolve(href.trim());
    } catch (IllegalArgumentException ex) {
      throw new DocumentParseException("Invalid link: " + href, ex);
    }
  }
}
