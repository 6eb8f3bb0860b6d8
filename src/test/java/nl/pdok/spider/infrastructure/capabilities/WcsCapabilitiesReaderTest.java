package nl.pdok.spider.infrastructure.capabilities;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.ContentItem.Coverage;
import nl.pdok.spider.domain.service.Service;
import nl.pdok.spider.domain.service.ServiceContent.CoverageContent;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.infrastructure.parse.DocumentParseException;
import nl.pdok.spider.testing.FixtureFetcher;
import nl.pdok.spider.testing.Fixtures;
import nl.pdok.spider.testing.ServiceRecords;
import org.junit.jupiter.api.Test;

class WcsCapabilitiesReaderTest {
  private static final String URL = "https://service.pdok.nl/rws/ahn/wcs/v1_0?request=GetCapabilities&service=WCS";

  private final ServiceDescriptionRecord record =
      ServiceRecords.record(ServiceProtocol.WCS, URL, "md-wcs", "ds-ahn", "AHN");

  @Test
  void readsCoverageSummariesWithLegacyOwsNamespace() throws Exception {
    FixtureFetcher fetcher = new FixtureFetcher().respondWithFixture(URL + "&version=1.1.0", "wcs-capabilities.xml");

    Service service = new WcsCapabilitiesReader(fetcher).read(record);

    assertEquals("AHN WCS", service.title());
    assertEquals(List.of("hoogte"), service.keywords());
    assertEquals(List.of(
        new Coverage("dtm_05m", "DTM 0.5m", "Maaiveld.", "ds-ahn"),
        new Coverage("dsm_05m", "DSM 0.5m", "", "ds-ahn")), ((CoverageContent) service.content()).coverages());
  }

  @Test
  void acceptsOws11AndWcs111Namespaces() throws Exception {
    String xml = Fixtures.read("wcs-capabilities.xml")
        .replace("http://www.opengis.net/wcs/1.1\"", "http://www.opengis.net/wcs/1.1.1\"")
        .replace("http://www.opengis.net/ows\"", "http://www.opengis.net/ows/1.1\"");

    Service service = new WcsCapabilitiesReader(new FixtureFetcher()).parse(xml, record);

    assertEquals("AHN WCS", service.title());
    assertEquals(2, service.items().size());
  }

  @Test
  void rejectsWmtsCapabilities() {
    String wmts = Fixtures.read("wmts-capabilities.xml");

    assertThrows(DocumentParseException.class, () -> new WcsCapabilitiesReader(new FixtureFetcher()).parse(wmts, record));
  }
}
