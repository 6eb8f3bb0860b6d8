package nl.pdok.spider.domain.service;

import java.util.List;
import java.util.Objects;

/**
 * Entry of an Atom dataset feed, typically one download in one format or projection.
 *
 * @param title entry title
 * @param content entry content or summary text
 * @param links download links
 */
public record FeedDownload(String title, String content, List<FeedLink> links) {
  public FeedDownload {
    title = Objects.requireNonNullElse(title, "");
    content = Objects.requireNonNullElse(content, "");
    links = links == null ? List.of() : List.copyOf(links);
  }
}
