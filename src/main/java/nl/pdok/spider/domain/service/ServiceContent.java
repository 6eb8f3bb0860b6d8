package nl.pdok.spider.domain.service;

import java.util.List;
import java.util.Objects;

/**
 * Protocol specific payload of a {@link Service}.
 *
 * @since 0.1.0
 */
public sealed interface ServiceContent
    permits ServiceContent.MapContent,
        ServiceContent.TileContent,
        ServiceContent.FeatureContent,
        ServiceContent.CoverageContent,
        ServiceContent.VectorTileContent,
        ServiceContent.FeedContent {

  /** @return nested content items in document order */
  List<? extends ContentItem> items();

  /**
   * WMS payload.
   *
   * @param imgFormats comma separated GetMap output formats
   * @param layers named layers
   */
  record MapContent(String imgFormats, List<ContentItem.MapLayer> layers) implements ServiceContent {
    public MapContent {
      imgFormats = Objects.requireNonNullElse(imgFormats, "");
      layers = layers == null ? List.of() : List.copyOf(layers);
    }

    @Override
    public List<ContentItem.MapLayer> items() {
      return layers;
    }
  }

  /** WMTS payload. */
  record TileContent(List<ContentItem.TileLayer> layers) implements ServiceContent {
    public TileContent {
      layers = layers == null ? List.of() : List.copyOf(layers);
    }

    @Override
    public List<ContentItem.TileLayer> items() {
      return layers;
    }
  }

  /**
   * WFS and OGC API Features payload.
   *
   * @param outputFormats comma separated GetFeature output formats
   * @param featureTypes advertised feature types or collections
   */
  record FeatureContent(String outputFormats, List<ContentItem.FeatureType> featureTypes)
      implements ServiceContent {
    public FeatureContent {
      outputFormats = Objects.requireNonNullElse(outputFormats, "");
      featureTypes = featureTypes == null ? List.of() : List.copyOf(featureTypes);
    }

    @Override
    public List<ContentItem.FeatureType> items() {
      return featureTypes;
    }
  }

  /** WCS payload. */
  record CoverageContent(List<ContentItem.Coverage> coverages) implements ServiceContent {
    public CoverageContent {
      coverages = coverages == null ? List.of() : List.copyOf(coverages);
    }

    @Override
    public List<ContentItem.Coverage> items() {
      return coverages;
    }
  }

  /** OGC API Tiles payload. */
  record VectorTileContent(List<ContentItem.VectorTileLayer> layers) implements ServiceContent {
    public VectorTileContent {
      layers = layers == null ? List.of() : List.copyOf(layers);
    }

    @Override
    public List<ContentItem.VectorTileLayer> items() {
      return layers;
    }
  }

  /** INSPIRE Atom payload. */
  record FeedContent(List<ContentItem.FeedDataset> datasets) implements ServiceContent {
    public FeedContent {
      datasets = datasets == null ? List.of() : List.copyOf(datasets);
    }

    @Override
    public List<ContentItem.FeedDataset> items() {
      return datasets;
    }
  }
}
