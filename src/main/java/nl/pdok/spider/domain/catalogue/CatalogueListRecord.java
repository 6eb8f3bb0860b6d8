package nl.pdok.spider.domain.catalogue;

import java.util.List;
import java.util.Objects;

/**
 * Brief Dublin Core record returned by a summary catalogue search.
 *
 * @param title record title
 * @param abstractText record abstract
 * @param recordType {@code dc:type}, such as {@code service}
 * @param identifier record identifier
 * @param keywords subjects of the record
 * @param modifiedDate last modification date as published
 */
public record CatalogueListRecord(
    String title,
    String abstractText,
    String recordType,
    String identifier,
    List<String> keywords,
    String modifiedDate) {

  public CatalogueListRecord {
    title = Objects.requireNonNullElse(title, "");
    abstractText = Objects.requireNonNullElse(abstractText, "");
    recordType = Objects.requireNonNullElse(recordType, "");
    identifier = Objects.requireNonNullElse(identifier, "");
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
    modifiedDate = Objects.requireNonNullElse(modifiedDate, "");
  }
}
