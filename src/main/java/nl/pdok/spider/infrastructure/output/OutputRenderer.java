package nl.pdok.spider.infrastructure.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import nl.pdok.spider.application.port.ClockPort;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * <strong>What:</strong> Serializes output documents to JSON or YAML text.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Apply the requested {@link KeyStyle}.</li>
 *   <li>Append {@code updated}, an ISO-8601 timestamp at seconds precision with the local offset.</li>
 *   <li>Write JSON through Jackson, indented by four spaces when pretty, and YAML through SnakeYAML block
 *   style.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; Jackson writers and the clock are thread-safe and a
 * {@link Yaml} instance is created per call.</p>
 *
 * @since 0.1.0
 */
public final class OutputRenderer {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final ClockPort clock;
  private final ZoneId zone;

  /**
   * Creates a renderer.
   *
   * @param clock source of the {@code updated} timestamp
   * @param zone zone whose offset is written
   */
  public OutputRenderer(ClockPort clock, ZoneId zone) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  /**
   * Renders {@code document}.
   *
   * @param document snake_case document from {@link OutputDocumentMapper}
   * @param format output format
   * @param keys key style
   * @param pretty whether to indent JSON
   * @param timestamp whether to add {@code updated}
   * @return serialized text ending with a newline
   * @throws IOException when serialization fails
   */
  public String render(
      Map<String, Object> document, OutputFormat format, KeyStyle keys, boolean pretty, boolean timestamp)
      throws IOException {
    Map<String, Object> root = new LinkedHashMap<>(document);
    if (timestamp) {
      root.put("updated", timestamp());
    }
    Object converted = keys.apply(root);
    return switch (format) {
      case JSON -> json(converted, pretty);
      case YAML -> yaml(converted);
    };
  }

  String timestamp() {
    OffsetDateTime now = OffsetDateTime.ofInstant(Instant.ofEpochMilli(clock.nowMillis()), zone)
        .truncatedTo(ChronoUnit.SECONDS);
    return now.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
  }

  private static String json(Object value, boolean pretty) throws IOException {
    ObjectWriter writer = pretty
        ? MAPPER.writer(new DefaultPrettyPrinter()
            .withObjectIndenter(new DefaultIndenter("    ", "\n"))
            .withArrayIndenter(new DefaultIndenter("    ", "\n")))
        : MAPPER.writer();
    try {
      return writer.writeValueAsString(value) + "\n";
    } catch (JsonProcessingException ex) {
      throw new IOException("Failed to serialize output as JSON: " + ex.getOriginalMessage(), ex);
    }
  }

  private static String yaml(Object value) {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    options.setSplitLines(false);
    return new Yaml(options).dump(value);
  }
}
