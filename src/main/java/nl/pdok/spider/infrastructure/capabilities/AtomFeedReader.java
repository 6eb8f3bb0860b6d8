package nl.pdok.spider.infrastructure.capabilities;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import nl.pdok.spider.application.port.CapabilitiesReader;
import nl.pdok.spider.application.port.DocumentFetcher;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.ContentItem.FeedDataset;
import nl.pdok.spider.domain.service.FeedDownload;
import nl.pdok.spider.domain.service.FeedLink;
import nl.pdok.spider.domain.service.Service;
import nl.pdok.spider.domain.service.ServiceContent.FeedContent;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.infrastructure.parse.DocumentParseException;
import nl.pdok.spider.infrastructure.parse.Namespaces;
import nl.pdok.spider.infrastructure.parse.UrlQueries;
import nl.pdok.spider.infrastructure.parse.XmlDocuments;
import org.slf4j.Logger;
import org.w3c.dom.Element;

/**
 * <strong>What:</strong> Reads an INSPIRE download service feed and the dataset feeds it links to.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map the service feed title, subtitle and categories onto the service.</li>
 *   <li>Turn each entry into a {@link FeedDataset}, following its {@code alternate} Atom link.</li>
 *   <li>Turn each dataset feed entry into a {@link FeedDownload}.</li>
 * </ul>
 * <p><strong>Observability:</strong> A dataset feed that cannot be read is logged at WARN; the dataset is kept
 * without downloads.</p>
 *
 * @since 0.1.0
 */
public final class AtomFeedReader implements CapabilitiesReader {
  private static final String ATOM = Namespaces.ATOM;
  private static final String ATOM_TYPE = "application/atom+xml";

  private final DocumentFetcher fetcher;
  private final Logger log;

  /**
   * Creates the reader.
   *
   * @param fetcher transport for service and dataset feeds
   * @param log logger receiving skipped dataset feeds
   * @since 0.1.0
   */
  public AtomFeedReader(DocumentFetcher fetcher, Logger log) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.log = Objects.requireNonNull(log, "log");
  }

  @Override
  public ServiceProtocol protocol() {
    return ServiceProtocol.ATOM;
  }

  @Override
  public Service read(ServiceDescriptionRecord record) throws IOException, InterruptedException {
    URI feedUri = CapabilitiesRequests.toUri(record.serviceUrl());
    Element feed = feedRoot(fetcher.fetch(feedUri));

    List<String> keywords = new ArrayList<>();
    for (Element category : XmlDocuments.children(feed, ATOM, "category")) {
      String term = XmlDocuments.attribute(category, null, "term");
      String label = XmlDocuments.attribute(category, null, "label");
      String keyword = label.isEmpty() ? term : label;
      if (!keyword.isEmpty()) {
        keywords.add(keyword);
      }
    }

    List<FeedDataset> datasets = new ArrayList<>();
    for (Element entry : XmlDocuments.children(feed, ATOM, "entry")) {
      datasets.add(dataset(feedUri, entry, record.serviceUrl()));
    }

    return new Service(
        XmlDocuments.childText(feed, ATOM, "title"),
        XmlDocuments.childText(feed, ATOM, "subtitle"),
        record.metadataId(),
        record.datasetMetadataId(),
        record.serviceUrl(),
        keywords,
        ServiceProtocol.ATOM,
        new FeedContent(datasets));
  }

  private FeedDataset dataset(URI feedUri, Element entry, String serviceUrl) throws InterruptedException {
    List<FeedLink> links = links(entry);
    String datasetFeed = "";
    String datasetId = "";
    for (FeedLink link : links) {
      if (datasetFeed.isEmpty() && "alternate".equals(link.rel()) && link.type().startsWith(ATOM_TYPE)) {
        datasetFeed = link.href();
      } else if (datasetId.isEmpty() && "describedby".equals(link.rel())) {
        datasetId = UrlQueries.metadataId(link.href());
      }
    }
    String code = XmlDocuments.childText(entry, Namespaces.INSPIRE_DLS, "spatial_dataset_identifier_code");
    if (datasetId.isEmpty()) {
      datasetId = code;
    }

    List<FeedDownload> downloads = List.of();
    if (!datasetFeed.isEmpty()) {
      try {
        downloads = downloads(CapabilitiesRequests.resolve(feedUri, datasetFeed));
      } catch (IOException ex) {
        log.warn("Skipping downloads of dataset feed {} listed by {}: {}", datasetFeed, serviceUrl, ex.toString());
      }
    }

    return new FeedDataset(
        code.isEmpty() ? XmlDocuments.childText(entry, ATOM, "id") : code,
        XmlDocuments.childText(entry, ATOM, "title"),
        XmlDocuments.childText(entry, ATOM, "summary"),
        datasetId,
        datasetFeed,
        downloads);
  }

  private List<FeedDownload> downloads(URI datasetFeedUri) throws IOException, InterruptedException {
    Element feed = feedRoot(fetcher.fetch(datasetFeedUri));
    List<FeedDownload> downloads = new ArrayList<>();
    for (Element entry : XmlDocuments.children(feed, ATOM, "entry")) {
      String content = XmlDocuments.childText(entry, ATOM, "content");
      downloads.add(new FeedDownload(
          XmlDocuments.childText(entry, ATOM, "title"),
          content.isEmpty() ? XmlDocuments.childText(entry, ATOM, "summary") : content,
          links(entry)));
    }
    return downloads;
  }

  /**
   * Reads the links of an entry, dropping untyped links whose target also appears with a type.
   *
   * @param entry Atom entry
   * @return links in document order
   */
  static List<FeedLink> links(Element entry) {
    List<FeedLink> all = new ArrayList<>();
    Set<String> typed = new HashSet<>();
    for (Element link : XmlDocuments.children(entry, ATOM, "link")) {
      FeedLink feedLink = new FeedLink(
          XmlDocuments.attribute(link, null, "href"),
          XmlDocuments.attribute(link, null, "rel"),
          XmlDocuments.attribute(link, null, "type"),
          XmlDocuments.attribute(link, null, "title"),
          XmlDocuments.attribute(link, null, "length"));
      if (!feedLink.type().isEmpty()) {
        typed.add(feedLink.href());
      }
      all.add(feedLink);
    }
    List<FeedLink> kept = new ArrayList<>();
    for (FeedLink link : all) {
      if (!link.type().isEmpty() || !typed.contains(link.href())) {
        kept.add(link);
      }
    }
    return kept;
  }

  private static Element feedRoot(String xml) throws DocumentParseException {
    Element root = XmlDocuments.parse(xml).getDocumentElement();
    if (!"feed".equals(root.getLocalName()) || !ATOM.equals(root.getNamespaceURI())) {
      throw new DocumentParseException("Not an Atom feed: " + root.getTagName());
    }
    return root;
  }
}
