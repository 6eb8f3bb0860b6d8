package nl.pdok.spider.domain.service;

import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> Closed set of service protocols recognised in catalogue records.
 * <p><strong>Why:</strong> Catalogue protocol strings are free text; everything downstream dispatches on this enum
 * instead so unsupported values are rejected once, at the catalogue boundary.</p>
 * <p><strong>Role:</strong> Domain value shared by the catalogue client, dispatcher, and output stages.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ServiceProtocol {
  /** OGC Web Map Service. */
  WMS("OGC:WMS", "wms", "protocol", "layers", "WMS"),
  /** OGC Web Feature Service. */
  WFS("OGC:WFS", "wfs", "protocol", "featuretypes", "WFS"),
  /** OGC Web Coverage Service. */
  WCS("OGC:WCS", "wcs", "protocol", "coverages", "WCS"),
  /** OGC Web Map Tile Service. */
  WMTS("OGC:WMTS", "wmts", "protocol", "layers", "WMTS"),
  /** INSPIRE download service published as an Atom feed. */
  ATOM("INSPIRE Atom", "atom", "protocol", "datasets", null),
  /** OGC API Tiles; the catalogue does not index this protocol so it is searched as free text. */
  OGC_API_TILES("OGC:API tiles", "oat", "anyText", "layers", null),
  /** OGC API Features. */
  OGC_API_FEATURES("OGC:API features", "oaf", "protocol", "featuretypes", null);

  private final String catalogueValue;
  private final String shortName;
  private final String queryKey;
  private final String contentKey;
  private final String capabilitiesType;

  ServiceProtocol(
      String catalogueValue,
      String shortName,
      String queryKey,
      String contentKey,
      String capabilitiesType) {
    this.catalogueValue = catalogueValue;
    this.shortName = shortName;
    this.queryKey = queryKey;
    this.contentKey = contentKey;
    this.capabilitiesType = capabilitiesType;
  }

  /**
   * Returns the protocol text as it appears in catalogue online resources.
   *
   * @return catalogue protocol value such as {@code OGC:WMS}
   */
  public String catalogueValue() {
    return catalogueValue;
  }

  /** @return lowercase short name such as {@code wmts} */
  public String shortName() {
    return shortName;
  }

  /** @return CQL queryable used to select records of this protocol */
  public String queryKey() {
    return queryKey;
  }

  /** @return output key holding the nested content items of a service */
  public String contentKey() {
    return contentKey;
  }

  /**
   * Returns the {@code service=} value of a GetCapabilities request.
   *
   * @return service type, or empty for protocols whose catalogue URL is used as-is
   */
  public Optional<String> capabilitiesType() {
    return Optional.ofNullable(capabilitiesType);
  }

  /**
   * Resolves a protocol from its exact catalogue value.
   *
   * @param value catalogue protocol text; may be {@code null}
   * @return matching protocol, or empty when the value is not supported
   */
  public static Optional<ServiceProtocol> fromCatalogueValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    for (ServiceProtocol protocol : values()) {
      if (protocol.catalogueValue.equals(trimmed)) {
        return Optional.of(protocol);
      }
    }
    return Optional.empty();
  }

  /**
   * Parses user input that names a protocol by catalogue value or short name, ignoring case.
   *
   * @param value user supplied text
   * @return matching protocol
   * @throws IllegalArgumentException when the value names no supported protocol
   */
  public static ServiceProtocol parse(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (ServiceProtocol protocol : values()) {
        if (protocol.catalogueValue.toLowerCase(Locale.ROOT).equals(normalized)
            || protocol.shortName.equals(normalized)) {
          return protocol;
        }
      }
    }
    throw new IllegalArgumentException("unsupported protocol: " + value);
  }
}
