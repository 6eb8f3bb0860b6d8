package nl.pdok.spider.infrastructure.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OutputRendererTest {
  private static final long NOW = 1_704_880_800_500L;

  private final OutputRenderer renderer = new OutputRenderer(() -> NOW, ZoneOffset.ofHours(1));

  @Test
  void timestampHasSecondsPrecisionAndOffset() {
    assertEquals("2024-01-10T11:00:00+01:00", renderer.timestamp());
  }

  @Test
  void compactJsonWithCamelKeysAndTimestamp() throws Exception {
    String json = renderer.render(document(), OutputFormat.JSON, KeyStyle.CAMEL, false, true);

    assertEquals("{\"services\":[{\"metadataId\":\"md\",\"serviceUrl\":\"https://x/wms\"}],"
        + "\"updated\":\"2024-01-10T11:00:00+01:00\"}\n", json);
  }

  @Test
  void prettyJsonIndentsWithFourSpaces() throws Exception {
    String json = renderer.render(document(), OutputFormat.JSON, KeyStyle.SNAKE, true, false);

    assertTrue(json.contains("\n    \"services\""), json);
    assertTrue(json.contains("\"service_url\""), json);
    assertFalse(json.contains("updated"), json);
  }

  @Test
  void yamlUsesBlockStyle() throws Exception {
    String yaml = new OutputRenderer(() -> NOW, ZoneOffset.UTC)
        .render(document(), OutputFormat.YAML, KeyStyle.SNAKE, false, true);

    assertTrue(yaml.startsWith("services:\n- metadata_id: md\n"), yaml);
    assertFalse(yaml.contains("{"), yaml);
    assertTrue(yaml.contains("updated: "), yaml);
    assertTrue(yaml.contains("2024-01-10T10:00:00Z"), yaml);
  }

  private static Map<String, Object> document() {
    Map<String, Object> service = new LinkedHashMap<>();
    service.put("metadata_id", "md");
    service.put("service_url", "https://x/wms");
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("services", List.of(service));
    return document;
  }
}
