package nl.pdok.spider.infrastructure.output;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import nl.pdok.spider.application.pipeline.DatasetGroup;
import nl.pdok.spider.domain.catalogue.CatalogueListRecord;
import nl.pdok.spider.domain.catalogue.DatasetMetadataRecord;
import nl.pdok.spider.domain.catalogue.ServiceDescriptionRecord;
import nl.pdok.spider.domain.service.ContentItem;
import nl.pdok.spider.domain.service.FeedDownload;
import nl.pdok.spider.domain.service.FeedLink;
import nl.pdok.spider.domain.service.FlatLayerRow;
import nl.pdok.spider.domain.service.Service;
import nl.pdok.spider.domain.service.ServiceContent;
import nl.pdok.spider.domain.service.Style;
import nl.pdok.spider.domain.service.TileSet;
import nl.pdok.spider.domain.service.TileSetGroup;
import nl.pdok.spider.domain.service.VectorTileStyle;

/**
 * <strong>What:</strong> Maps domain values onto ordered maps with snake_case keys.
 * <p><strong>Why:</strong> Both JSON and YAML writers serialize plain maps and lists; keeping the key order fixed
 * here makes the two formats and both key styles agree.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class OutputDocumentMapper {

  private OutputDocumentMapper() {
    // Utility
  }

  /**
   * Maps services as written in {@code services} output.
   *
   * @param services harvested services
   * @return {@code {services: [...]}}
   */
  public static Map<String, Object> services(List<Service> services) {
    List<Object> entries = new ArrayList<>(services.size());
    for (Service service : services) {
      entries.add(service(service, true));
    }
    return document("services", entries);
  }

  /**
   * Maps dataset groups; nested services omit {@code dataset_metadata_id}.
   *
   * @param groups dataset groups
   * @return {@code {datasets: [...]}}
   */
  public static Map<String, Object> datasets(List<DatasetGroup<Service>> groups) {
    List<Object> entries = new ArrayList<>(groups.size());
    for (DatasetGroup<Service> group : groups) {
      Map<String, Object> dataset = dataset(group.dataset());
      List<Object> services = new ArrayList<>();
      for (Service service : group.services()) {
        services.add(service(service, false));
      }
      dataset.put("services", services);
      entries.add(dataset);
    }
    return document("datasets", entries);
  }

  /**
   * Maps flat rows.
   *
   * @param rows flat layer rows
   * @return {@code {layers: [...]}}
   */
  public static Map<String, Object> layers(List<FlatLayerRow> rows) {
    List<Object> entries = new ArrayList<>(rows.size());
    for (FlatLayerRow row : rows) {
      Map<String, Object> map = item(row.item());
      if (row.item() instanceof ContentItem.MapLayer) {
        map.put("imgformats", row.imgFormats());
      }
      map.put("service_url", row.serviceUrl());
      map.put("service_title", row.serviceTitle());
      map.put("service_abstract", row.serviceAbstract());
      map.put("service_protocol", row.serviceProtocol().catalogueValue());
      map.put("service_metadata_id", row.serviceMetadataId());
      entries.add(map);
    }
    return document("layers", entries);
  }

  /**
   * Maps catalogue service records as written by the {@code services} command.
   *
   * @param records service records
   * @return {@code {services: [...]}}
   */
  public static Map<String, Object> serviceRecords(List<ServiceDescriptionRecord> records) {
    List<Object> entries = new ArrayList<>(records.size());
    for (ServiceDescriptionRecord record : records) {
      entries.add(serviceRecord(record, true));
    }
    return document("services", entries);
  }

  /**
   * Maps catalogue service records grouped by dataset; nested records omit {@code dataset_metadata_id}.
   *
   * @param groups resolved datasets with their records, in dataset order
   * @return {@code {datasets: [...]}}
   */
  public static Map<String, Object> serviceRecordsByDataset(List<DatasetGroup<ServiceDescriptionRecord>> groups) {
    List<Object> entries = new ArrayList<>(groups.size());
    for (DatasetGroup<ServiceDescriptionRecord> group : groups) {
      Map<String, Object> dataset = dataset(group.dataset());
      List<Object> services = new ArrayList<>();
      for (ServiceDescriptionRecord record : group.services()) {
        services.add(serviceRecord(record, false));
      }
      dataset.put("services", services);
      entries.add(dataset);
    }
    return document("datasets", entries);
  }

  /**
   * Maps summary catalogue records.
   *
   * @param records summary records
   * @return {@code {records: [...]}}
   */
  public static Map<String, Object> listRecords(List<CatalogueListRecord> records) {
    List<Object> entries = new ArrayList<>(records.size());
    for (CatalogueListRecord record : records) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("title", record.title());
      map.put("abstract", record.abstractText());
      map.put("type", record.recordType());
      map.put("identifier", record.identifier());
      map.put("keywords", record.keywords());
      map.put("modified", record.modifiedDate());
      entries.add(map);
    }
    return document("records", entries);
  }

  static Map<String, Object> service(Service service, boolean includeDatasetId) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("title", service.title());
    map.put("abstract", service.abstractText());
    map.put("metadata_id", service.metadataId());
    if (includeDatasetId) {
      map.put("dataset_metadata_id", service.datasetMetadataId());
    }
    map.put("url", service.url());
    map.put("keywords", service.keywords());
    map.put("protocol", service.protocol().catalogueValue());

    ServiceContent content = service.content();
    if (content instanceof ServiceContent.MapContent wms) {
      map.put("imgformats", wms.imgFormats());
    } else if (content instanceof ServiceContent.FeatureContent features) {
      map.put("output_formats", features.outputFormats());
    }
    List<Object> items = new ArrayList<>();
    for (ContentItem item : service.items()) {
      items.add(item(item));
    }
    map.put(service.protocol().contentKey(), items);
    return map;
  }

  static Map<String, Object> item(ContentItem item) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("name", item.name());
    map.put("title", item.title());
    map.put("abstract", item.abstractText());
    map.put("dataset_metadata_id", item.datasetMetadataId());
    if (item instanceof ContentItem.MapLayer layer) {
      map.put("styles", styles(layer.styles()));
      map.put("crs", layer.crs());
      map.put("minscale", layer.minScale());
      map.put("maxscale", layer.maxScale());
    } else if (item instanceof ContentItem.TileLayer layer) {
      map.put("styles", styles(layer.styles()));
      map.put("tilematrixsets", layer.tileMatrixSets());
      map.put("imgformats", layer.imgFormats());
    } else if (item instanceof ContentItem.VectorTileLayer layer) {
      map.put("styles", vectorTileStyles(layer.styles()));
      map.put("tiles", tileSetGroups(layer.tiles()));
    } else if (item instanceof ContentItem.FeedDataset dataset) {
      map.put("url", dataset.url());
      map.put("downloads", downloads(dataset.downloads()));
    }
    return map;
  }

  private static Map<String, Object> serviceRecord(ServiceDescriptionRecord record, boolean includeDatasetId) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("title", record.title());
    map.put("abstract", record.abstractText());
    map.put("use_limitation", record.useLimitation());
    map.put("keywords", record.keywords());
    map.put("operates_on", record.operatesOnRef());
    map.put("metadata_id", record.metadataId());
    if (includeDatasetId) {
      map.put("dataset_metadata_id", record.datasetMetadataId());
    }
    map.put("service_url", record.serviceUrl());
    map.put("service_protocol", record.serviceProtocol().catalogueValue());
    map.put("service_description", record.serviceDescription());
    return map;
  }

  private static Map<String, Object> dataset(DatasetMetadataRecord dataset) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("title", dataset.title());
    map.put("abstract", dataset.abstractText());
    map.put("metadata_id", dataset.metadataId());
    return map;
  }

  private static List<Object> styles(List<Style> styles) {
    List<Object> list = new ArrayList<>(styles.size());
    for (Style style : styles) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("title", style.title());
      map.put("name", style.name());
      map.put("legend_url", style.legendUrl());
      list.add(map);
    }
    return list;
  }

  private static List<Object> vectorTileStyles(List<VectorTileStyle> styles) {
    List<Object> list = new ArrayList<>(styles.size());
    for (VectorTileStyle style : styles) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("name", style.name());
      map.put("title", style.title());
      map.put("url", style.url());
      list.add(map);
    }
    return list;
  }

  private static List<Object> tileSetGroups(List<TileSetGroup> groups) {
    List<Object> list = new ArrayList<>(groups.size());
    for (TileSetGroup group : groups) {
      List<Object> tileSets = new ArrayList<>();
      for (TileSet tileSet : group.tileSets()) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("tileset_id", tileSet.id());
        map.put("tileset_crs", tileSet.crs());
        // An unknown maximum zoom level is written as "" like every other absent field.
        map.put("tileset_max_zoomlevel",
            tileSet.maxZoomLevel().isPresent() ? (Object) tileSet.maxZoomLevel().getAsInt() : "");
        tileSets.add(map);
      }
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("title", group.title());
      map.put("abstract", group.abstractText());
      map.put("tilesets", tileSets);
      list.add(map);
    }
    return list;
  }

  private static List<Object> downloads(List<FeedDownload> downloads) {
    List<Object> list = new ArrayList<>(downloads.size());
    for (FeedDownload download : downloads) {
      List<Object> links = new ArrayList<>();
      for (FeedLink link : download.links()) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("href", link.href());
        map.put("rel", link.rel());
        map.put("type", link.type());
        map.put("title", link.title());
        map.put("length", link.length());
        links.add(map);
      }
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("title", download.title());
      map.put("content", download.content());
      map.put("links", links);
      list.add(map);
    }
    return list;
  }

  private static Map<String, Object> document(String key, List<Object> entries) {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put(key, entries);
    return document;
  }
}
