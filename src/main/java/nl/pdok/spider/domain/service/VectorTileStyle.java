package nl.pdok.spider.domain.service;

import java.util.Objects;

/**
 * Style published by an OGC API Tiles service.
 *
 * @param name style identifier
 * @param title style title
 * @param url stylesheet URL, or empty
 */
public record VectorTileStyle(String name, String title, String url) {
  public VectorTileStyle {
    name = Objects.requireNonNullElse(name, "");
    title = Objects.requireNonNullElse(title, "");
    url = Objects.requireNonNullElse(url, "");
  }
}
