package nl.pdok.spider.application.pipeline;

import java.util.ArrayList;
import java.util.List;
import nl.pdok.spider.domain.service.ContentItem;
import nl.pdok.spider.domain.service.FlatLayerRow;
import nl.pdok.spider.domain.service.Service;
import nl.pdok.spider.domain.service.ServiceContent;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.domain.service.UnsupportedModeException;

/**
 * Expands services into one row per layer, feature type, or coverage.
 */
public final class LayerFlattener {

  private LayerFlattener() {
    // Utility
  }

  /**
   * Rejects protocols that have no flat representation.
   *
   * @param protocol protocol to check
   * @throws UnsupportedModeException for INSPIRE Atom
   */
  public static void requireSupported(ServiceProtocol protocol) {
    if (protocol == ServiceProtocol.ATOM) {
      throw new UnsupportedModeException(protocol, OutputMode.FLAT.cliName());
    }
  }

  /**
   * Flattens {@code services} in order.
   *
   * @param services services to flatten
   * @return rows, grouped per service in service order
   * @throws UnsupportedModeException when a service is an Atom feed
   */
  public static List<FlatLayerRow> flatten(List<Service> services) {
    List<FlatLayerRow> rows = new ArrayList<>();
    for (Service service : services) {
      requireSupported(service.protocol());
      String imgFormats = service.content() instanceof ServiceContent.MapContent map ? map.imgFormats() : "";
      for (ContentItem item : service.items()) {
        rows.add(new FlatLayerRow(
            item,
            service.url(),
            service.title(),
            service.abstractText(),
            service.protocol(),
            service.metadataId(),
            imgFormats));
      }
    }
    return rows;
  }
}
