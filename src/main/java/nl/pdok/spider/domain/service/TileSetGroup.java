package nl.pdok.spider.domain.service;

import java.util.List;
import java.util.Objects;

/**
 * Tiles document of an OGC API Tiles service with its tile sets.
 *
 * @param title tiles title
 * @param abstractText tiles description
 * @param tileSets tile sets in document order
 */
public record TileSetGroup(String title, String abstractText, List<TileSet> tileSets) {
  public TileSetGroup {
    title = Objects.requireNonNullElse(title, "");
    abstractText = Objects.requireNonNullElse(abstractText, "");
    tileSets = tileSets == null ? List.of() : List.copyOf(tileSets);
  }
}
