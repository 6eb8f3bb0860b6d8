package nl.pdok.spider.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Minimal console output helper for usage text and harvested documents.
 *
 * <p>Uses native file descriptors in order to avoid direct {@code System.out} references while
 * preserving simple stdout writes that play nicely with logging configurations. Logs go to stderr, so
 * {@code out=-} documents can be piped.</p>
 */
public final class CliPrinter {
  private static final OutputStream STDOUT_STREAM = new FileOutputStream(FileDescriptor.out);
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(STDOUT_STREAM, StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;
  private static volatile OutputStream streamOverride;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout using the shared CLI writer.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Returns the raw stdout stream receiving rendered documents.
   *
   * @return stdout stream, or the test override
   */
  static OutputStream documentStream() {
    OutputStream stream = streamOverride;
    return stream != null ? stream : STDOUT_STREAM;
  }

  /**
   * Overrides the CLI writer for tests.
   *
   * @param writer writer to use during the test
   */
  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  /**
   * Overrides the document stream for tests.
   *
   * @param stream stream to use during the test
   */
  static void setDocumentStreamForTesting(OutputStream stream) {
    streamOverride = stream;
  }

  /**
   * Clears any test overrides.
   */
  static void clearTestWriter() {
    override = null;
    streamOverride = null;
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
