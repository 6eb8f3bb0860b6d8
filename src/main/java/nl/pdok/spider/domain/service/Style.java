package nl.pdok.spider.domain.service;

import java.util.Objects;

/**
 * Named style of a WMS or WMTS layer.
 *
 * @param title style title
 * @param name style name
 * @param legendUrl URL of the first legend graphic, or empty
 */
public record Style(String title, String name, String legendUrl) {
  public Style {
    title = Objects.requireNonNullElse(title, "");
    name = Objects.requireNonNullElse(name, "");
    legendUrl = Objects.requireNonNullElse(legendUrl, "");
  }
}
