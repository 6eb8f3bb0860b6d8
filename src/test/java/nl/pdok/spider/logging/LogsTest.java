package nl.pdok.spider.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {
  @Test
  void nullBecomesPlaceholder() {
    assertEquals("<null>", Logs.truncate(null, 10));
  }

  @Test
  void shortValuesAreCollapsedToOneLine() {
    assertEquals("<html> <body>Not found</body>", Logs.truncate("<html>\r\n  <body>Not found</body>\n", 100));
  }

  @Test
  void longValuesReportOriginalLength() {
    String snippet = Logs.truncate("abcdefghij", 4);
    assertEquals("abcd... (truncated, 4 of 10 bytes)", snippet);
  }

  @Test
  void truncationNeverSplitsMultiByteCharacters() {
    String snippet = Logs.truncate("ééé", 3);
    assertTrue(snippet.startsWith("é..."), snippet);
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
