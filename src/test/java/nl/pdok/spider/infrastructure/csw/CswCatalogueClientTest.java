package nl.pdok.spider.infrastructure.csw;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import nl.pdok.spider.application.pipeline.CataloguePaginator;
import nl.pdok.spider.domain.catalogue.CatalogueListRecord;
import nl.pdok.spider.domain.catalogue.DatasetMetadataRecord;
import nl.pdok.spider.domain.catalogue.FilterMode;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.infrastructure.parse.DocumentParseException;
import nl.pdok.spider.testing.CapturedLogs;
import nl.pdok.spider.testing.FixtureFetcher;
import nl.pdok.spider.testing.Fixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class CswCatalogueClientTest {
  private static final String CSW = "https://nationaalgeoregister.nl/geonetwork/srv/dut/csw";

  private final CapturedLogs logs = CapturedLogs.create("csw");
  private final FixtureFetcher fetcher = new FixtureFetcher();

  @AfterEach
  void tearDown() {
    logs.close();
  }

  @Test
  void pagesThroughServiceRecordsAndExtractsFields() throws Exception {
    fetcher
        .whenContains(Fixtures.read("csw-getrecords-wms-page1.xml"), "request=GetRecords", "startPosition=1&")
        .whenContains(Fixtures.read("csw-getrecords-wms-page2.xml"), "request=GetRecords", "startPosition=3&");

    List<ServiceDescriptionRecord> records =
        client().queryByProtocol(ServiceProtocol.WMS, "Beheer PDOK", 0, FilterMode.FILTERED);

    assertEquals(2, fetcher.requests().size());
    assertEquals(List.of("BAG WMS", "Kadastrale Kaart (WMS)"),
        records.stream().map(ServiceDescriptionRecord::title).toList());

    ServiceDescriptionRecord kaart = records.get(1);
    assertEquals("97cf6a64-9cfc-4ce6-9741-2db44fd27fca", kaart.metadataId());
    assertEquals("Kaart met kadastrale percelen.", kaart.abstractText());
    assertEquals("Geen beperkingen", kaart.useLimitation());
    assertEquals(Map.of("", List.of("kadaster"), "http://inspire.ec.europa.eu/theme/cp", List.of("Kadastrale percelen")),
        kaart.keywords());
    assertEquals("a29917b9-3426-4041-a11b-69bcb2256904", kaart.datasetMetadataId());
    assertEquals("https://service.pdok.nl/kadaster/kadastralekaart/wms/v5_0?request=GetCapabilities&service=WMS",
        kaart.serviceUrl());
    assertEquals("accessPoint", kaart.serviceDescription());

    ServiceDescriptionRecord bag = records.get(0);
    assertEquals("https://service.pdok.nl/lv/bag/wms/v2_0?request=GetCapabilities&service=WMS", bag.serviceUrl());
    assertEquals("aa3b5e6e-7baa-40c0-8972-3353e927ec2f", bag.datasetMetadataId());
    assertEquals("Web Map Service", bag.serviceDescription());
  }

  @Test
  void sendsKvpGetRecordsRequest() throws Exception {
    fetcher.whenContains(Fixtures.read("csw-getrecords-wms-page2.xml"), "request=GetRecords");

    client().queryByProtocol(ServiceProtocol.WMS, "Beheer PDOK", 20, FilterMode.FILTERED);

    URI request = fetcher.requests().get(0);
    String text = request.toString();
    assertTrue(text.startsWith(CSW + "?service=CSW&version=2.0.2&request=GetRecords"), text);
    assertTrue(text.contains("constraintLanguage=CQL_TEXT"), text);
    assertTrue(text.contains("maxRecords=20"), text);
    assertTrue(text.contains("outputSchema=http%3A%2F%2Fwww.isotc211.org%2F2005%2Fgmd"), text);
    assertTrue(text.contains("constraint=type%3D%27service%27+AND+organisationName%3D%27Beheer+PDOK%27"
        + "+AND+protocol%3D%27OGC%3AWMS%27"), text);
  }

  @Test
  void buildsProtocolConstraints() {
    assertEquals("type='service' AND organisationName='Beheer PDOK' AND protocol='OGC:WFS'",
        CswCatalogueClient.protocolConstraint(ServiceProtocol.WFS, "Beheer PDOK"));
    assertEquals("type='service' AND organisationName='Beheer PDOK' AND anyText='OGC:API tiles'",
        CswCatalogueClient.protocolConstraint(ServiceProtocol.OGC_API_TILES, "Beheer PDOK"));
    assertEquals("type='service' AND organisationName='O''Neill' AND protocol='OGC:WMS'",
        CswCatalogueClient.protocolConstraint(ServiceProtocol.WMS, "O'Neill"));
  }

  @Test
  void catalogueExceptionOnFirstPagePropagates() {
    fetcher.whenContains(Fixtures.read("csw-exception.xml"), "request=GetRecords");

    DocumentParseException ex = assertThrows(DocumentParseException.class,
        () -> client().queryByProtocol(ServiceProtocol.WMS, "Beheer PDOK", 0, FilterMode.FILTERED));
    assertTrue(ex.getMessage().contains("Unable to parse CQL constraint"));
  }

  @Test
  void fetchesDatasetMetadataById() throws Exception {
    fetcher.whenContains(Fixtures.read("csw-getrecordbyid-dataset.xml"), "request=GetRecordById",
        "id=a29917b9-3426-4041-a11b-69bcb2256904");

    Optional<DatasetMetadataRecord> dataset = client().fetchDatasetMetadata("a29917b9-3426-4041-a11b-69bcb2256904");

    assertEquals(Optional.of(new DatasetMetadataRecord("Kadastrale Percelen", "Percelen van Nederland.",
        "a29917b9-3426-4041-a11b-69bcb2256904")), dataset);
    assertTrue(fetcher.requests().get(0).toString().contains("elementSetName=full"));
  }

  @Test
  void missingDatasetIsLoggedAndEmpty() throws Exception {
    fetcher.whenContains("<csw:GetRecordByIdResponse xmlns:csw=\"http://www.opengis.net/cat/csw/2.0.2\"/>",
        "request=GetRecordById");

    assertEquals(Optional.empty(), client().fetchDatasetMetadata("unknown"));
    assertTrue(logs.contains(Level.ERROR, "Could not find dataset with metadata id \"unknown\""));
  }

  @Test
  void failedDatasetLookupIsLoggedAndEmpty() throws Exception {
    assertEquals(Optional.empty(), client().fetchDatasetMetadata("unreachable"));
    assertTrue(logs.contains(Level.ERROR, "Dataset metadata lookup failed"));
  }

  @Test
  void listsSummaryRecords() throws Exception {
    fetcher.whenContains(Fixtures.read("csw-summary-records.xml"), "request=GetRecords", "elementSetName=summary");

    List<CatalogueListRecord> records = client().listByProtocol(ServiceProtocol.WMS, "Beheer PDOK", 0);

    assertEquals(List.of(
        new CatalogueListRecord("Kadastrale Kaart (WMS)", "Kaart met kadastrale percelen.", "service",
            "97cf6a64-9cfc-4ce6-9741-2db44fd27fca", List.of("kadaster", "Kadastrale percelen"), "2023-11-02"),
        new CatalogueListRecord("BAG WMS", "Adressen en gebouwen.", "service",
            "1c0dcc64-91aa-4d44-a9e3-54355556f5e7", List.of(), "")), records);
  }

  @Test
  void queriesSingleRecordByIdentifier() throws Exception {
    fetcher.whenContains(Fixtures.read("csw-getrecords-wms-page1.xml")
            .replace("numberOfRecordsMatched=\"3\"", "numberOfRecordsMatched=\"2\"")
            .replace("nextRecord=\"3\"", "nextRecord=\"0\""),
        "request=GetRecords", "identifier%3D%2797cf6a64");

    List<ServiceDescriptionRecord> records = client().queryById("97cf6a64-9cfc-4ce6-9741-2db44fd27fca");

    assertEquals(2, records.size());
    assertEquals(ServiceProtocol.WFS, records.get(0).serviceProtocol());
  }

  private CswCatalogueClient client() {
    return new CswCatalogueClient(URI.create(CSW), fetcher, new CataloguePaginator(logs.logger()),
        new ServiceRecordExtractor(logs.logger()), logs.logger());
  }
}
