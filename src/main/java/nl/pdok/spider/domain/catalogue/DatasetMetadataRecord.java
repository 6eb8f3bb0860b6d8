package nl.pdok.spider.domain.catalogue;

import java.util.Objects;

/**
 * Dataset metadata resolved through a catalogue lookup by identifier.
 *
 * @param title dataset title
 * @param abstractText dataset abstract
 * @param metadataId dataset file identifier
 */
public record DatasetMetadataRecord(String title, String abstractText, String metadataId) {
  public DatasetMetadataRecord {
    title = Objects.requireNonNullElse(title, "");
    abstractText = Objects.requireNonNullElse(abstractText, "");
    metadataId = Objects.requireNonNullElse(metadataId, "");
  }
}
