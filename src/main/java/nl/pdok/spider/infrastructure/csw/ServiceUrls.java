package nl.pdok.spider.infrastructure.csw;

import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.infrastructure.parse.UrlQueries;

/**
 * Rewrites catalogue service URLs into canonical GetCapabilities requests.
 */
public final class ServiceUrls {
  /** Legacy PDOK WMTS endpoint; catalogue URLs below it carry redundant path elements. */
  static final String PDOK_TILES_WMTS = "https://geodata.nationaalgeoregister.nl/tiles/service/wmts";
  private static final String RESTFUL_WMTS_SUFFIX = "/WMTSCapabilities.xml";

  private ServiceUrls() {
    // Utility
  }

  /**
   * Returns the URL capabilities are requested from.
   *
   * <p>For OGC web services the query string is stripped, known endpoint quirks are normalized, and
   * {@code request=GetCapabilities&service=<type>} is appended. Feed and OGC API URLs are returned trimmed.</p>
   *
   * @param url URL from the catalogue online resource
   * @param protocol protocol of the online resource
   * @return canonical URL, or empty when {@code url} is blank
   */
  public static String canonical(String url, ServiceProtocol protocol) {
    if (url == null || url.isBlank()) {
      return "";
    }
    String trimmed = url.trim();
    if (protocol.capabilitiesType().isEmpty()) {
      return trimmed;
    }
    String base = UrlQueries.stripQuery(trimmed);
    if (base.contains(PDOK_TILES_WMTS)) {
      base = PDOK_TILES_WMTS;
    }
    if (base.endsWith(RESTFUL_WMTS_SUFFIX)) {
      base = base.substring(0, base.length() - RESTFUL_WMTS_SUFFIX.length());
    }
    return base + "?request=GetCapabilities&service=" + protocol.capabilitiesType().get();
  }
}
