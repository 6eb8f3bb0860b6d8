package nl.pdok.spider.infrastructure.capabilities;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.ContentItem.FeatureType;
import nl.pdok.spider.domain.service.Service;
import nl.pdok.spider.domain.service.ServiceContent.FeatureContent;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.infrastructure.parse.DocumentParseException;
import nl.pdok.spider.testing.FixtureFetcher;
import nl.pdok.spider.testing.Fixtures;
import nl.pdok.spider.testing.ServiceRecords;
import org.junit.jupiter.api.Test;

class WfsCapabilitiesReaderTest {
  private static final String URL = "https://service.pdok.nl/lv/bag/wfs/v2_0?request=GetCapabilities&service=WFS";

  private final ServiceDescriptionRecord record =
      ServiceRecords.record(ServiceProtocol.WFS, URL, "md-wfs", "ds-bag", "BAG");

  @Test
  void requestsVersionTwoAndReadsFeatureTypes() throws Exception {
    FixtureFetcher fetcher = new FixtureFetcher().respondWithFixture(URL + "&version=2.0.0", "wfs-capabilities.xml");

    Service service = new WfsCapabilitiesReader(fetcher).read(record);

    assertEquals("BAG WFS", service.title());
    assertEquals("Adressen en gebouwen.", service.abstractText());
    assertEquals(List.of("adressen", "gebouwen"), service.keywords());
    FeatureContent content = (FeatureContent) service.content();
    assertEquals("text/xml; subtype=gml/3.2,application/json", content.outputFormats());
    assertEquals(List.of(
        new FeatureType("bag:pand", "Pand", "Gebouwen.", "ds-bag"),
        new FeatureType("bag:verblijfsobject", "Verblijfsobject", "", "ds-bag")), content.featureTypes());
  }

  @Test
  void fallsBackToServiceWideOutputFormats() throws Exception {
    String xml = Fixtures.read("wfs-capabilities.xml")
        .replace("<ows:Operation name=\"GetFeature\">", "<ows:Operation name=\"DescribeFeatureType\">")
        .replace("</ows:OperationsMetadata>",
            "<ows:Parameter name=\"outputFormat\"><ows:AllowedValues><ows:Value>text/csv</ows:Value>"
                + "</ows:AllowedValues></ows:Parameter></ows:OperationsMetadata>");

    Service service = new WfsCapabilitiesReader(new FixtureFetcher()).parse(xml, record);

    assertEquals("text/csv", ((FeatureContent) service.content()).outputFormats());
  }

  @Test
  void rejectsWfsOneDocuments() {
    String legacy = "<WFS_Capabilities xmlns=\"http://www.opengis.net/wfs\" version=\"1.1.0\"/>";

    assertThrows(DocumentParseException.class, () -> new WfsCapabilitiesReader(new FixtureFetcher()).parse(legacy, record));
  }
}
