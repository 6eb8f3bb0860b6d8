package nl.pdok.spider.infrastructure.parse;

import java.util.Map;

/**
 * XML namespace URIs of the catalogue and capability documents.
 */
public final class Namespaces {
  public static final String CSW = "http://www.opengis.net/cat/csw/2.0.2";
  public static final String GMD = "http://www.isotc211.org/2005/gmd";
  public static final String SRV = "http://www.isotc211.org/2005/srv";
  public static final String GMX = "http://www.isotc211.org/2005/gmx";
  public static final String GCO = "http://www.isotc211.org/2005/gco";
  public static final String XLINK = "http://www.w3.org/1999/xlink";
  public static final String DC = "http://purl.org/dc/elements/1.1/";
  public static final String DCT = "http://purl.org/dc/terms/";
  public static final String OWS_11 = "http://www.opengis.net/ows/1.1";
  public static final String OWS_LEGACY = "http://www.opengis.net/ows";
  public static final String WMS = "http://www.opengis.net/wms";
  public static final String WFS_20 = "http://www.opengis.net/wfs/2.0";
  public static final String WCS_11 = "http://www.opengis.net/wcs/1.1";
  public static final String WCS_111 = "http://www.opengis.net/wcs/1.1.1";
  public static final String WMTS = "http://www.opengis.net/wmts/1.0";
  public static final String ATOM = "http://www.w3.org/2005/Atom";
  public static final String INSPIRE_DLS = "http://inspire.ec.europa.eu/schemas/inspire_dls/1.0";

  /** Prefix bindings for XPath queries over catalogue records. */
  public static final Map<String, String> CATALOGUE = Map.of(
      "csw", CSW,
      "gmd", GMD,
      "srv", SRV,
      "gmx", GMX,
      "gco", GCO,
      "xlink", XLINK,
      "dc", DC,
      "dct", DCT);

  private Namespaces() {
    // Utility
  }
}
