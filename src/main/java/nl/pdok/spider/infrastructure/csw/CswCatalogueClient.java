package nl.pdok.spider.infrastructure.csw;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import nl.pdok.spider.application.pipeline.CataloguePaginator;
import nl.pdok.spider.application.pipeline.CataloguePaginator.Page;
import nl.pdok.spider.application.pipeline.ServiceRecordFilter;
import nl.pdok.spider.application.port.CatalogueClient;
import nl.pdok.spider.application.port.DocumentFetcher;
import nl.pdok.spider.domain.catalogue.CatalogueListRecord;
import nl.pdok.spider.domain.catalogue.DatasetMetadataRecord;
import nl.pdok.spider.domain.catalogue.FilterMode;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.infrastructure.parse.Namespaces;
import org.slf4j.Logger;
import org.w3c.dom.Element;

/**
 * <strong>What:</strong> {@link CatalogueClient} for CSW 2.0.2 catalogues such as GeoNetwork.
 * <p><strong>Why:</strong> Service discovery starts from the national metadata register; records are selected with
 * CQL constraints and read in the ISO 19139 output schema.</p>
 * <p><strong>Role:</strong> Driven adapter; uses KVP {@code GetRecords} and {@code GetRecordById} over HTTP GET.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from injected collaborators; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Logs record counts per query at INFO and failed dataset lookups at ERROR.</p>
 *
 * @since 0.1.0
 */
public final class CswCatalogueClient implements CatalogueClient {
  /** National georegister CSW endpoint. */
  public static final String DEFAULT_CSW_URL = "https://nationaalgeoregister.nl/geonetwork/srv/dut/csw";

  private final URI endpoint;
  private final DocumentFetcher fetcher;
  private final CataloguePaginator paginator;
  private final ServiceRecordExtractor extractor;
  private final Logger log;

  /**
   * Creates a client.
   *
   * @param endpoint CSW endpoint without query string
   * @param fetcher transport for catalogue requests
   * @param paginator pagination driver
   * @param extractor service record extractor
   * @param log logger receiving query diagnostics
   */
  public CswCatalogueClient(
      URI endpoint,
      DocumentFetcher fetcher,
      CataloguePaginator paginator,
      ServiceRecordExtractor extractor,
      Logger log) {
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.paginator = Objects.requireNonNull(paginator, "paginator");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.log = Objects.requireNonNull(log, "log");
  }

  @Override
  public List<ServiceDescriptionRecord> queryByProtocol(
      ServiceProtocol protocol, String owner, int maxResults, FilterMode filterMode)
      throws IOException, InterruptedException {
    Objects.requireNonNull(protocol, "protocol");
    Objects.requireNonNull(filterMode, "filterMode");
    String constraint = protocolConstraint(protocol, owner);
    List<ServiceDescriptionRecord> records =
        paginator.collect(constraint, maxResults, (start, size) -> serviceRecordPage(constraint, start, size,
            Optional.of(protocol)), ServiceDescriptionRecord::metadataId);
    List<ServiceDescriptionRecord> filtered = ServiceRecordFilter.apply(records, filterMode);
    log.info("Found {} {} service metadata record(s)", filtered.size(), protocol.catalogueValue());
    return filtered;
  }

  @Override
  public List<ServiceDescriptionRecord> queryById(String metadataId) throws IOException, InterruptedException {
    String constraint = "identifier='" + escape(metadataId) + "'";
    List<ServiceDescriptionRecord> records = paginator.collect(constraint, 0,
        (start, size) -> serviceRecordPage(constraint, start, size, Optional.empty()),
        ServiceDescriptionRecord::metadataId);
    return ServiceRecordFilter.apply(records, FilterMode.FILTERED);
  }

  @Override
  public Optional<DatasetMetadataRecord> fetchDatasetMetadata(String metadataId) throws InterruptedException {
    Map<String, String> params = baseParams("GetRecordById");
    params.put("id", metadataId);
    params.put("elementSetName", "full");
    params.put("outputSchema", Namespaces.GMD);
    try {
      for (Element element : CswResponses.recordsById(fetcher.fetch(uri(params)))) {
        if ("MD_Metadata".equals(element.getLocalName()) && Namespaces.GMD.equals(element.getNamespaceURI())) {
          return Optional.of(DatasetRecordExtractor.extract(element, metadataId));
        }
      }
      log.error("Could not find dataset with metadata id \"{}\"; linked services are not grouped", metadataId);
    } catch (IOException ex) {
      log.error("Dataset metadata lookup failed for \"{}\": {}", metadataId, ex.toString());
    }
    return Optional.empty();
  }

  @Override
  public List<CatalogueListRecord> listByProtocol(ServiceProtocol protocol, String owner, int maxResults)
      throws IOException, InterruptedException {
    String constraint = protocolConstraint(protocol, owner);
    List<CatalogueListRecord> records = paginator.collect(constraint, maxResults, (start, size) -> {
      Map<String, String> params = searchParams(constraint, start, size);
      params.put("typeNames", "csw:Record");
      params.put("elementSetName", "summary");
      params.put("outputSchema", Namespaces.CSW);
      CswResponses.SearchResults results = CswResponses.searchResults(fetcher.fetch(uri(params)));
      List<CatalogueListRecord> page = new ArrayList<>();
      for (Element element : results.records()) {
        page.add(ListRecordExtractor.extract(element));
      }
      return new Page<>(page, results.matched(), results.returned(), results.nextRecord());
    }, CatalogueListRecord::identifier);
    log.info("Found {} {} catalogue record(s)", records.size(), protocol.catalogueValue());
    return records;
  }

  /**
   * Builds the CQL constraint selecting one protocol of one publisher.
   *
   * @param protocol service protocol
   * @param owner organisation name
   * @return CQL text
   */
  static String protocolConstraint(ServiceProtocol protocol, String owner) {
    return "type='service' AND organisationName='" + escape(owner) + "' AND "
        + protocol.queryKey() + "='" + escape(protocol.catalogueValue()) + "'";
  }

  private Page<ServiceDescriptionRecord> serviceRecordPage(
      String constraint, int start, int size, Optional<ServiceProtocol> protocol)
      throws IOException, InterruptedException {
    Map<String, String> params = searchParams(constraint, start, size);
    params.put("typeNames", "gmd:MD_Metadata");
    params.put("elementSetName", "full");
    params.put("outputSchema", Namespaces.GMD);
    params.put("namespace", "xmlns(gmd=" + Namespaces.GMD + ")");
    CswResponses.SearchResults results = CswResponses.searchResults(fetcher.fetch(uri(params)));
    List<ServiceDescriptionRecord> page = new ArrayList<>();
    for (Element element : results.records()) {
      extractor.extract(element, protocol).ifPresent(page::add);
    }
    return new Page<>(page, results.matched(), results.returned(), results.nextRecord());
  }

  private static Map<String, String> searchParams(String constraint, int start, int size) {
    Map<String, String> params = baseParams("GetRecords");
    params.put("resultType", "results");
    params.put("constraintLanguage", "CQL_TEXT");
    params.put("constraint_language_version", "1.1.0");
    params.put("constraint", constraint);
    params.put("startPosition", Integer.toString(start));
    params.put("maxRecords", Integer.toString(size));
    return params;
  }

  private static Map<String, String> baseParams(String request) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("service", "CSW");
    params.put("version", "2.0.2");
    params.put("request", request);
    return params;
  }

  private URI uri(Map<String, String> params) {
    StringBuilder sb = new StringBuilder(endpoint.toString());
    char separator = endpoint.getRawQuery() == null ? '?' : '&';
    for (Map.Entry<String, String> entry : params.entrySet()) {
      sb.append(separator)
          .append(entry.getKey())
          .append('=')
          .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
      separator = '&';
    }
    return URI.create(sb.toString());
  }

  private static String escape(String value) {
    return Objects.requireNonNullElse(value, "").replace("'", "''");
  }
}
