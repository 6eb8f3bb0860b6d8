package nl.pdok.spider.domain.service;

import java.util.List;
import java.util.Objects;

/**
 * A layer, feature type, coverage, or feed dataset nested under a {@link Service}.
 *
 * <p>All implementations normalize absent text to the empty string and absent lists to empty lists.</p>
 *
 * @since 0.1.0
 */
public sealed interface ContentItem
    permits ContentItem.MapLayer,
        ContentItem.TileLayer,
        ContentItem.FeatureType,
        ContentItem.Coverage,
        ContentItem.VectorTileLayer,
        ContentItem.FeedDataset {

  /** @return machine name of the item */
  String name();

  /** @return human readable title */
  String title();

  /** @return abstract or description */
  String abstractText();

  /** @return metadata identifier of the dataset the item publishes, or empty */
  String datasetMetadataId();

  /**
   * WMS layer.
   *
   * @param crs comma separated coordinate reference systems, own and inherited
   * @param minScale minimum scale denominator, or empty
   * @param maxScale maximum scale denominator, or empty
   */
  record MapLayer(
      String name,
      String title,
      String abstractText,
      String datasetMetadataId,
      List<Style> styles,
      String crs,
      String minScale,
      String maxScale) implements ContentItem {
    public MapLayer {
      name = Objects.requireNonNullElse(name, "");
      title = Objects.requireNonNullElse(title, "");
      abstractText = Objects.requireNonNullElse(abstractText, "");
      datasetMetadataId = Objects.requireNonNullElse(datasetMetadataId, "");
      styles = styles == null ? List.of() : List.copyOf(styles);
      crs = Objects.requireNonNullElse(crs, "");
      minScale = Objects.requireNonNullElse(minScale, "");
      maxScale = Objects.requireNonNullElse(maxScale, "");
    }
  }

  /**
   * WMTS layer.
   *
   * @param tileMatrixSets comma separated tile matrix set identifiers
   * @param imgFormats comma separated tile formats
   */
  record TileLayer(
      String name,
      String title,
      String abstractText,
      String datasetMetadataId,
      List<Style> styles,
      String tileMatrixSets,
      String imgFormats) implements ContentItem {
    public TileLayer {
      name = Objects.requireNonNullElse(name, "");
      title = Objects.requireNonNullElse(title, "");
      abstractText = Objects.requireNonNullElse(abstractText, "");
      datasetMetadataId = Objects.requireNonNullElse(datasetMetadataId, "");
      styles = styles == null ? List.of() : List.copyOf(styles);
      tileMatrixSets = Objects.requireNonNullElse(tileMatrixSets, "");
      imgFormats = Objects.requireNonNullElse(imgFormats, "");
    }
  }

  /** WFS feature type or OGC API Features collection. */
  record FeatureType(String name, String title, String abstractText, String datasetMetadataId)
      implements ContentItem {
    public FeatureType {
      name = Objects.requireNonNullElse(name, "");
      title = Objects.requireNonNullElse(title, "");
      abstractText = Objects.requireNonNullElse(abstractText, "");
      datasetMetadataId = Objects.requireNonNullElse(datasetMetadataId, "");
    }
  }

  /** WCS coverage summary. */
  record Coverage(String name, String title, String abstractText, String datasetMetadataId)
      implements ContentItem {
    public Coverage {
      name = Objects.requireNonNullElse(name, "");
      title = Objects.requireNonNullElse(title, "");
      abstractText = Objects.requireNonNullElse(abstractText, "");
      datasetMetadataId = Objects.requireNonNullElse(datasetMetadataId, "");
    }
  }

  /** OGC API Tiles layer, named after the tiles document. */
  record VectorTileLayer(
      String name,
      String title,
      String abstractText,
      String datasetMetadataId,
      List<VectorTileStyle> styles,
      List<TileSetGroup> tiles) implements ContentItem {
    public VectorTileLayer {
      name = Objects.requireNonNullElse(name, "");
      title = Objects.requireNonNullElse(title, "");
      abstractText = Objects.requireNonNullElse(abstractText, "");
      datasetMetadataId = Objects.requireNonNullElse(datasetMetadataId, "");
      styles = styles == null ? List.of() : List.copyOf(styles);
      tiles = tiles == null ? List.of() : List.copyOf(tiles);
    }
  }

  /**
   * Dataset entry of an INSPIRE Atom service feed.
   *
   * @param url URL of the dataset feed
   * @param downloads entries of the dataset feed
   */
  record FeedDataset(
      String name,
      String title,
      String abstractText,
      String datasetMetadataId,
      String url,
      List<FeedDownload> downloads) implements ContentItem {
    public FeedDataset {
      name = Objects.requireNonNullElse(name, "");
      title = Objects.requireNonNullElse(title, "");
      abstractText = Objects.requireNonNullElse(abstractText, "");
      datasetMetadataId = Objects.requireNonNullElse(datasetMetadataId, "");
      url = Objects.requireNonNullElse(url, "");
      downloads = downloads == null ? List.of() : List.copyOf(downloads);
    }
  }
}
