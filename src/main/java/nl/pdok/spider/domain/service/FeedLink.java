package nl.pdok.spider.domain.service;

import java.util.Objects;

/**
 * Link of an Atom feed entry.
 *
 * @param href link target
 * @param rel link relation, {@code alternate} when absent
 * @param type media type, or empty
 * @param title link title, or empty
 * @param length advertised byte length, or empty
 */
public record FeedLink(String href, String rel, String type, String title, String length) {
  public FeedLink {
    href = Objects.requireNonNullElse(href, "");
    rel = rel == null || rel.isEmpty() ? "alternate" : rel;
    type = Objects.requireNonNullElse(type, "");
    title = Objects.requireNonNullElse(title, "");
    length = Objects.requireNonNullElse(length, "");
  }
}
