package nl.pdok.spider.infrastructure.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import nl.pdok.spider.testing.CapturedLogs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OutputSinkTest {
  @TempDir Path tempDir;

  private final CapturedLogs logs = CapturedLogs.create("sink");
  private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

  @AfterEach
  void tearDown() {
    logs.close();
  }

  @Test
  void dashWritesToStdout() throws Exception {
    new OutputSink(stdout, logs.logger()).write("{\"kaart\":\"ë\"}\n", "-");

    assertEquals("{\"kaart\":\"ë\"}\n", stdout.toString(StandardCharsets.UTF_8));
    assertTrue(logs.contains(Level.INFO, "Output written to stdout"));
  }

  @Test
  void fileTargetCreatesParentDirectories() throws Exception {
    Path target = tempDir.resolve("out/nested/layers.json");

    new OutputSink(stdout, logs.logger()).write("{}\n", target.toString());

    assertEquals("{}\n", Files.readString(target));
    assertEquals(0, stdout.size());
  }

  @Test
  void existingFileIsReplaced() throws Exception {
    Path target = tempDir.resolve("layers.json");
    Files.writeString(target, "old content that is longer");

    new OutputSink(stdout, logs.logger()).write("new", target.toString());

    assertEquals("new", Files.readString(target));
  }
}
