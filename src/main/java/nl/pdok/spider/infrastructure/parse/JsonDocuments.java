package nl.pdok.spider.infrastructure.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Objects;
import java.util.Optional;
import nl.pdok.spider.logging.Logs;

/**
 * Jackson tree parsing for OGC API documents with tolerant field accessors.
 *
 * @since 0.1.0
 */
public final class JsonDocuments {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final int SNIPPET_BYTES = 256;

  private JsonDocuments() {
    // Utility
  }

  /**
   * Parses JSON text into a tree.
   *
   * @param json document text
   * @return root node
   * @throws DocumentParseException when the text is not valid JSON or not an object
   */
  public static JsonNode parse(String json) throws DocumentParseException {
    Objects.requireNonNull(json, "json");
    try {
      JsonNode root = MAPPER.readTree(json);
      if (root == null || !root.isObject()) {
        throw new DocumentParseException("Expected a JSON object [" + Logs.truncate(json, SNIPPET_BYTES) + "]");
      }
      return root;
    } catch (JsonProcessingException ex) {
      throw new DocumentParseException(
          "Malformed JSON document: " + ex.getOriginalMessage() + " [" + Logs.truncate(json, SNIPPET_BYTES) + "]",
          ex);
    }
  }

  /**
   * Returns a text field, or empty when missing, null, or not textual.
   *
   * @param node parent node
   * @param field field name
   * @return field text or empty string
   */
  public static String text(JsonNode node, String field) {
    if (node == null) {
      return "";
    }
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || value.isContainerNode()) {
      return "";
    }
    return value.asText("");
  }

  /**
   * Returns the {@code href} of the first link with the given relation.
   *
   * @param node object holding a {@code links} array
   * @param rel link relation
   * @return link target, if present
   */
  public static Optional<String> linkHref(JsonNode node, String rel) {
    if (node == null) {
      return Optional.empty();
    }
    for (JsonNode link : node.path("links")) {
      if (rel.equals(text(link, "rel"))) {
        String href = text(link, "href");
        if (!href.isEmpty()) {
          return Optional.of(href);
        }
      }
    }
    return Optional.empty();
  }
}
