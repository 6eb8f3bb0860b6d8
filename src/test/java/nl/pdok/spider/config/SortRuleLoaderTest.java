package nl.pdok.spider.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import nl.pdok.spider.application.pipeline.SortRule;
import nl.pdok.spider.testing.Fixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SortRuleLoaderTest {

  @TempDir Path tempDir;

  @Test
  void readsJsonRules() throws IOException {
    Path file = tempDir.resolve("rules.json");
    Files.writeString(file, Fixtures.read("sort-rules.json"));

    List<SortRule> rules = SortRuleLoader.load(file);

    assertEquals(2, rules.size());
    assertEquals(0, rules.get(0).index());
    assertEquals(List.of("OGC:WMTS", "wmts"), rules.get(0).types());
    assertEquals("^standaard$", rules.get(0).names().get(0).pattern());
    assertEquals(1, rules.get(1).index());
    assertEquals(List.of(), rules.get(1).types());
  }

  @Test
  void readsYamlRules() throws IOException {
    Path file = tempDir.resolve("rules.yaml");
    Files.writeString(file, """
        - index: 3
          types: [wms]
          names: [luchtfoto]
        """);

    SortRule rule = SortRuleLoader.load(file).get(0);
    assertEquals(3, rule.index());
    assertEquals("luchtfoto", rule.names().get(0).pattern());
  }

  @Test
  void rejectsMalformedDocuments() throws IOException {
    assertInvalid("{\"index\": 1}");
    assertInvalid("[{\"types\": [\"wms\"], \"names\": [\"a\"]}]");
    assertInvalid("[{\"index\": 1, \"names\": \"a\"}]");
    assertInvalid("[{\"index\": 1, \"names\": [\"(unclosed\"]}]");
    assertInvalid("[\"not a rule\"]");
    assertInvalid("[{\"index\": 1");
  }

  @Test
  void missingFileIsAnIoError() {
    assertThrows(NoSuchFileException.class, () -> SortRuleLoader.load(tempDir.resolve("absent.json")));
  }

  private void assertInvalid(String content) throws IOException {
    Path file = Files.createTempFile(tempDir, "rules", ".json");
    Files.writeString(file, content);
    assertThrows(IllegalArgumentException.class, () -> SortRuleLoader.load(file), content);
  }
}
