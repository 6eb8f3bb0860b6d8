package nl.pdok.spider.infrastructure.capabilities;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import nl.pdok.spider.domain.service.ContentItem.FeatureType;
import nl.pdok.spider.domain.service.Service;
import nl.pdok.spider.domain.service.ServiceContent.FeatureContent;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.infrastructure.parse.DocumentParseException;
import nl.pdok.spider.testing.FixtureFetcher;
import nl.pdok.spider.testing.ServiceRecords;
import org.junit.jupiter.api.Test;

class OgcApiFeaturesReaderTest {
  private static final String BASE = "https://api.pdok.nl/lv/bag/ogc/v1/";

  @Test
  void readsCollectionsAsFeatureTypes() throws Exception {
    FixtureFetcher fetcher = new FixtureFetcher()
        .respondWithFixture(BASE + "?f=json", "oaf-landing.json")
        .respondWithFixture(BASE + "api?f=json", "oaf-service-desc.json")
        .respondWithFixture(BASE + "collections?f=json", "oaf-collections.json");

    Service service = new OgcApiFeaturesReader(fetcher)
        .read(ServiceRecords.record(ServiceProtocol.OGC_API_FEATURES, BASE, "md-oaf", "ds-bag", "BAG"));

    assertEquals("BAG OGC API Features", service.title());
    assertEquals("Adressen als OGC API Features.", service.abstractText());
    assertEquals(List.of("Features", "Collections"), service.keywords());
    assertEquals(BASE, service.url());
    FeatureContent content = (FeatureContent) service.content();
    assertEquals("application/geo+json,text/html", content.outputFormats());
    assertEquals(List.of(
        new FeatureType("adres", "Adres", "Adressen.", "ds-bag"),
        new FeatureType("pand", "Pand", "", "ds-bag")), content.featureTypes());
  }

  @Test
  void landingPageWithoutLinksYieldsEmptyService() throws Exception {
    FixtureFetcher fetcher = new FixtureFetcher().respond(BASE + "?f=json", "{\"title\": \"Leeg\"}");

    Service service = new OgcApiFeaturesReader(fetcher).read(ServiceRecords.record(ServiceProtocol.OGC_API_FEATURES, BASE));

    assertEquals("Leeg", service.title());
    assertEquals(List.of(), service.items());
  }

  @Test
  void rejectsNonJsonLandingPage() {
    FixtureFetcher fetcher = new FixtureFetcher().respond(BASE + "?f=json", "<html/>");

    assertThrows(DocumentParseException.class, () -> new OgcApiFeaturesReader(fetcher)
        .read(ServiceRecords.record(ServiceProtocol.OGC_API_FEATURES, BASE)));
  }
}
