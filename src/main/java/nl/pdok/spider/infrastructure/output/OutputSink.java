package nl.pdok.spider.infrastructure.output;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * Writes rendered output to a file, or to standard output for {@code -}.
 */
public final class OutputSink {
  private final OutputStream stdout;
  private final Logger log;

  /**
   * Creates a sink.
   *
   * @param stdout stream receiving output for target {@code -}; not closed by the sink
   * @param log logger receiving the output location
   */
  public OutputSink(OutputStream stdout, Logger log) {
    this.stdout = Objects.requireNonNull(stdout, "stdout");
    this.log = Objects.requireNonNull(log, "log");
  }

  /**
   * Writes {@code content} as UTF-8.
   *
   * @param content rendered document
   * @param target file path, or {@code -}
   * @throws IOException when the file or stream cannot be written
   */
  public void write(String content, String target) throws IOException {
    Objects.requireNonNull(content, "content");
    byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
    if ("-".equals(target)) {
      stdout.write(bytes);
      stdout.flush();
      log.info("Output written to stdout ({} bytes)", bytes.length);
      return;
    }
    Path path = Path.of(target).toAbsolutePath();
    Path parent = path.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.write(path, bytes);
    log.info("Output written to {} ({} bytes)", path, bytes.length);
  }
}
