package nl.pdok.spider.infrastructure.capabilities;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import nl.pdok.spider.application.port.CapabilitiesReader;
import nl.pdok.spider.application.port.DocumentFetcher;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.ContentItem.VectorTileLayer;
import nl.pdok.spider.domain.service.Service;
import nl.pdok.spider.domain.service.ServiceContent.VectorTileContent;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.domain.service.TileSet;
import nl.pdok.spider.domain.service.TileSetGroup;
import nl.pdok.spider.domain.service.VectorTileStyle;
import nl.pdok.spider.infrastructure.parse.JsonDocuments;
import org.slf4j.Logger;

/**
 * <strong>What:</strong> Reads an OGC API Tiles landing page into a service with a single vector tile layer.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Follow {@code service-desc} for title fallbacks, tags and the tile request URL template.</li>
 *   <li>Follow {@code data} or {@code *styles} for styles, default style first.</li>
 *   <li>Follow {@code tiles} or {@code *tilesets-vector} for tile sets and their maximum zoom level.</li>
 * </ul>
 * <p><strong>Observability:</strong> A tile set whose limits cannot be read is logged at WARN and reported without
 * zoom level.</p>
 *
 * @since 0.1.0
 */
public final class OgcApiTilesReader implements CapabilitiesReader {
  private static final String[] TILE_PLACEHOLDERS = {"{tileMatrixSetId}", "{tileMatrix}", "{tileRow}", "{tileCol}"};

  private final DocumentFetcher fetcher;
  private final Logger log;

  /**
   * Creates the reader.
   *
   * @param fetcher transport for the landing page and the tiles, tile set and styles resources
   * @param log logger receiving resources that could not be read
   * @since 0.1.0
   */
  public OgcApiTilesReader(DocumentFetcher fetcher, Logger log) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.log = Objects.requireNonNull(log, "log");
  }

  @Override
  public ServiceProtocol protocol() {
    return ServiceProtocol.OGC_API_TILES;
  }

  @Override
  public Service read(ServiceDescriptionRecord record) throws IOException, InterruptedException {
    URI landingUri = CapabilitiesRequests.withJsonFormat(record.serviceUrl());
    JsonNode landing = JsonDocuments.parse(fetcher.fetch(landingUri));

    JsonNode serviceDesc = null;
    JsonNode stylesDoc = null;
    JsonNode tilesDoc = null;
    URI tilesUri = null;
    for (JsonNode link : landing.path("links")) {
      String rel = JsonDocuments.text(link, "rel");
      String href = JsonDocuments.text(link, "href");
      if (href.isEmpty()) {
        continue;
      }
      if ("service-desc".equals(rel) && serviceDesc == null) {
        serviceDesc = fetchJson(landingUri, href);
      } else if (("data".equals(rel) || rel.endsWith("styles")) && stylesDoc == null) {
        stylesDoc = fetchJson(landingUri, href);
      } else if (("tiles".equals(rel) || rel.endsWith("tilesets-vector")) && tilesDoc == null) {
        tilesUri = CapabilitiesRequests.resolve(landingUri, href);
        tilesDoc = JsonDocuments.parse(fetcher.fetch(tilesUri));
      }
    }

    JsonNode info = serviceDesc == null ? null : serviceDesc.path("info");
    String title = OgcApiFeaturesReader.firstNonEmpty(
        JsonDocuments.text(landing, "title"), JsonDocuments.text(info, "title"));
    String description = OgcApiFeaturesReader.firstNonEmpty(
        JsonDocuments.text(landing, "description"), JsonDocuments.text(info, "description"));

    List<VectorTileLayer> layers = new ArrayList<>();
    if (tilesDoc != null) {
      String tilesTitle = JsonDocuments.text(tilesDoc, "title");
      String tilesDescription = JsonDocuments.text(tilesDoc, "description");
      TileSetGroup group = new TileSetGroup(tilesTitle, tilesDescription, tileSets(tilesUri, tilesDoc));
      layers.add(new VectorTileLayer(
          tilesTitle,
          tilesTitle,
          tilesDescription,
          record.datasetMetadataId(),
          styles(stylesDoc),
          List.of(group)));
    }

    String url = tileRequestUrl(serviceDesc).orElse(record.serviceUrl());
    return new Service(
        title,
        description,
        record.metadataId(),
        record.datasetMetadataId(),
        url,
        tagNames(serviceDesc),
        ServiceProtocol.OGC_API_TILES,
        new VectorTileContent(layers));
  }

  /**
   * Returns the names of the OpenAPI tags.
   *
   * @param serviceDesc OpenAPI document, or {@code null}
   * @return tag names in document order
   */
  static List<String> tagNames(JsonNode serviceDesc) {
    List<String> names = new ArrayList<>();
    if (serviceDesc == null) {
      return names;
    }
    for (JsonNode tag : serviceDesc.path("tags")) {
      String name = tag.isTextual() ? tag.asText() : JsonDocuments.text(tag, "name");
      if (!name.isEmpty()) {
        names.add(name);
      }
    }
    return names;
  }

  /**
   * Finds the tile request template: first non-empty server URL plus the first path carrying all tile placeholders.
   *
   * @param serviceDesc OpenAPI document, or {@code null}
   * @return tile request URL template, if the document advertises one
   */
  static Optional<String> tileRequestUrl(JsonNode serviceDesc) {
    if (serviceDesc == null) {
      return Optional.empty();
    }
    String server = "";
    for (JsonNode candidate : serviceDesc.path("servers")) {
      server = JsonDocuments.text(candidate, "url");
      if (!server.isEmpty()) {
        break;
      }
    }
    if (server.isEmpty()) {
      return Optional.empty();
    }
    Iterator<String> paths = serviceDesc.path("paths").fieldNames();
    while (paths.hasNext()) {
      String path = paths.next();
      if (hasTilePlaceholders(path)) {
        return Optional.of(server + path);
      }
    }
    return Optional.empty();
  }

  /**
   * Orders styles with the default style first; the default is matched on id or title.
   *
   * @param stylesDoc styles document, or {@code null}
   * @return styles
   */
  static List<VectorTileStyle> styles(JsonNode stylesDoc) {
    List<VectorTileStyle> styles = new ArrayList<>();
    if (stylesDoc == null) {
      return styles;
    }
    String defaultStyle = JsonDocuments.text(stylesDoc, "default");
    for (JsonNode style : stylesDoc.path("styles")) {
      String stylesheet = "";
      for (JsonNode link : style.path("links")) {
        if ("stylesheet".equals(JsonDocuments.text(link, "rel"))) {
          stylesheet = JsonDocuments.text(link, "href");
        }
      }
      VectorTileStyle entry =
          new VectorTileStyle(JsonDocuments.text(style, "id"), JsonDocuments.text(style, "title"), stylesheet);
      boolean isDefault = !defaultStyle.isEmpty()
          && (defaultStyle.equals(entry.name()) || defaultStyle.equals(entry.title()));
      if (isDefault) {
        styles.add(0, entry);
      } else {
        styles.add(entry);
      }
    }
    return styles;
  }

  private List<TileSet> tileSets(URI tilesUri, JsonNode tilesDoc) throws InterruptedException {
    List<TileSet> tileSets = new ArrayList<>();
    for (JsonNode tileSet : tilesDoc.path("tilesets")) {
      JsonNode crs = tileSet.path("crs");
      String crsText = crs.isObject() ? JsonDocuments.text(crs, "uri") : JsonDocuments.text(tileSet, "crs");
      tileSets.add(new TileSet(
          JsonDocuments.text(tileSet, "tileMatrixSetId"),
          crsText,
          maxZoomLevel(tilesUri, tileSet)));
    }
    return tileSets;
  }

  private OptionalInt maxZoomLevel(URI tilesUri, JsonNode tileSet) throws InterruptedException {
    String href = JsonDocuments.linkHref(tileSet, "self").orElseGet(() -> {
      JsonNode first = tileSet.path("links").path(0);
      return JsonDocuments.text(first, "href");
    });
    if (href.isEmpty()) {
      return OptionalInt.empty();
    }
    try {
      JsonNode detail = fetchJson(tilesUri, href);
      OptionalInt max = OptionalInt.empty();
      for (JsonNode limit : detail.path("tileMatrixSetLimits")) {
        String matrix = JsonDocuments.text(limit, "tileMatrix");
        if (matrix.isEmpty()) {
          continue;
        }
        int zoom = Integer.parseInt(matrix.trim());
        if (max.isEmpty() || zoom > max.getAsInt()) {
          max = OptionalInt.of(zoom);
        }
      }
      return max;
    } catch (IOException | NumberFormatException ex) {
      log.warn("Could not read tile matrix limits from {}: {}", href, ex.toString());
      return OptionalInt.empty();
    }
  }

  private JsonNode fetchJson(URI base, String href) throws IOException, InterruptedException {
    return JsonDocuments.parse(fetcher.fetch(CapabilitiesRequests.resolve(base, href)));
  }

  private static boolean hasTilePlaceholders(String path) {
    for (String placeholder : TILE_PLACEHOLDERS) {
      if (!path.contains(placeholder)) {
        return false;
      }
    }
    return true;
  }
}
