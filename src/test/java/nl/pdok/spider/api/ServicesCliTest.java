package nl.pdok.spider.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import nl.pdok.spider.config.CompositionRoot;
import nl.pdok.spider.testing.FixtureFetcher;
import nl.pdok.spider.testing.Fixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ServicesCliTest {
  private final StringWriter console = new StringWriter();
  private final ByteArrayOutputStream document = new ByteArrayOutputStream();
  private final FixtureFetcher fetcher = new FixtureFetcher();

  @BeforeEach
  void setUp() {
    CliPrinter.setWriterForTesting(new PrintWriter(console, true));
    CliPrinter.setDocumentStreamForTesting(document);
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void briefAndDatasetMdAreExclusive() {
    assertEquals(ExitCode.INVALID_ARGS, run("brief=true", "datasetMd=true"));
    assertTrue(console.toString().contains("usage: services"));
    assertEquals(0, fetcher.requests().size());
  }

  @Test
  void listsServiceRecordsWithCamelKeys() {
    fetcher
        .whenContains(Fixtures.read("csw-getrecords-wms-page1.xml"), "request=GetRecords", "startPosition=1&")
        .whenContains(Fixtures.read("csw-getrecords-wms-page2.xml"), "request=GetRecords", "startPosition=3&");

    assertEquals(ExitCode.SUCCESS, run("protocols=wms", "--no-timestamp"));

    String json = document.toString(StandardCharsets.UTF_8);
    assertTrue(json.startsWith("{\"services\":["), json);
    assertTrue(json.contains("\"serviceUrl\":\"https://service.pdok.nl/lv/bag/wms/v2_0"
        + "?request=GetCapabilities&service=WMS\""), json);
    assertTrue(json.contains("\"useLimitation\":\"Geen beperkingen\""), json);
  }

  @Test
  void briefListsSummaryRecords() {
    fetcher.whenContains(Fixtures.read("csw-summary-records.xml"), "request=GetRecords", "elementSetName=summary");

    assertEquals(ExitCode.SUCCESS, run("protocols=wms", "brief=true", "--no-timestamp"));

    String json = document.toString(StandardCharsets.UTF_8);
    assertTrue(json.startsWith("{\"records\":["), json);
    assertTrue(json.contains("\"identifier\":\"1c0dcc64-91aa-4d44-a9e3-54355556f5e7\""), json);
    assertTrue(json.contains("\"abstract\":\"Adressen en gebouwen.\""), json);
  }

  @Test
  void unreachableCatalogueIsIoError() {
    assertEquals(ExitCode.IO_ERROR, run("protocols=wms,wfs"));
  }

  private ExitCode run(String... args) {
    return ServicesCli.run(args, config -> new CompositionRoot(config, fetcher, () -> 0L));
  }
}
