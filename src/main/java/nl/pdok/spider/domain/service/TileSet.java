package nl.pdok.spider.domain.service;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Vector tile set of an OGC API Tiles service.
 *
 * @param id tile matrix set identifier
 * @param crs coordinate reference system URI
 * @param maxZoomLevel highest tile matrix listed in the tile set limits, if any
 */
public record TileSet(String id, String crs, OptionalInt maxZoomLevel) {
  public TileSet {
    id = Objects.requireNonNullElse(id, "");
    crs = Objects.requireNonNullElse(crs, "");
    maxZoomLevel = Objects.requireNonNullElse(maxZoomLevel, OptionalInt.empty());
  }
}
