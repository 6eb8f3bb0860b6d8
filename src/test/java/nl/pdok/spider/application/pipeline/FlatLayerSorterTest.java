package nl.pdok.spider.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import java.util.List;
import nl.pdok.spider.domain.service.ContentItem;
import nl.pdok.spider.domain.service.FlatLayerRow;
import nl.pdok.spider.domain.service.ServiceProtocol;
import nl.pdok.spider.testing.CapturedLogs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class FlatLayerSorterTest {
  private final CapturedLogs logs = CapturedLogs.create("sorter");

  @AfterEach
  void tearDown() {
    logs.close();
  }

  @Test
  void wmtsBaseLayerMovesFirstWhileWfsBaseIsUnaffected() {
    FlatLayerRow wfsBase = row("base", ServiceProtocol.WFS);
    FlatLayerRow wmsRoads = row("wegen", ServiceProtocol.WMS);
    FlatLayerRow wmtsBase = row("base", ServiceProtocol.WMTS);
    FlatLayerSorter sorter = new FlatLayerSorter(
        List.of(SortRule.of(0, List.of("wmts"), List.of("^base$"))), logs.logger());

    List<FlatLayerRow> sorted = sorter.sort(List.of(wfsBase, wmsRoads, wmtsBase));

    assertSame(wmtsBase, sorted.get(0));
    assertSame(wfsBase, sorted.get(1));
    assertSame(wmsRoads, sorted.get(2));
    assertEquals(FlatLayerSorter.UNMATCHED, sorter.key(wfsBase));
  }

  @Test
  void unmatchedTilesSortBeforeOtherUnmatchedRowsAndUnnamedRowsLast() {
    FlatLayerSorter sorter = new FlatLayerSorter(List.of(), logs.logger());
    FlatLayerRow unnamed = row("", ServiceProtocol.WMS);
    FlatLayerRow wms = row("luchtfoto", ServiceProtocol.WMS);
    FlatLayerRow wmts = row("standaard", ServiceProtocol.WMTS);

    List<FlatLayerRow> sorted = sorter.sort(List.of(unnamed, wms, wmts));

    assertEquals(List.of(wmts, wms, unnamed), sorted);
    assertEquals(FlatLayerSorter.UNMATCHED_TILES, sorter.key(wmts));
    assertEquals(FlatLayerSorter.UNNAMED, sorter.key(unnamed));
  }

  @Test
  void firstRuleInIndexOrderWins() {
    FlatLayerSorter sorter = new FlatLayerSorter(List.of(
        SortRule.of(5, List.of("OGC:WMS"), List.of("grens")),
        SortRule.of(2, List.of("wms"), List.of("gemeente"))), logs.logger());

    assertEquals(2, sorter.key(row("gemeentegrenzen", ServiceProtocol.WMS)));
    assertEquals(5, sorter.key(row("provinciegrenzen", ServiceProtocol.WMS)));
  }

  @Test
  void namePatternsAreCaseInsensitive() {
    FlatLayerSorter sorter = new FlatLayerSorter(
        List.of(SortRule.of(1, List.of("wfs"), List.of("KADASTRALE"))), logs.logger());

    assertEquals(1, sorter.key(row("Kadastrale_Percelen", ServiceProtocol.WFS)));
  }

  @Test
  void sortIsStableWithinABucket() {
    FlatLayerSorter sorter = new FlatLayerSorter(
        List.of(SortRule.of(1, List.of("wms"), List.of("^a"))), logs.logger());
    FlatLayerRow first = row("a1", ServiceProtocol.WMS);
    FlatLayerRow second = row("a2", ServiceProtocol.WMS);
    FlatLayerRow third = row("a3", ServiceProtocol.WMS);

    assertEquals(List.of(first, second, third), sorter.sort(List.of(first, second, third)));
  }

  @Test
  void rulesWithoutMatchesAreLogged() {
    FlatLayerSorter sorter = new FlatLayerSorter(
        List.of(SortRule.of(7, List.of("wcs"), List.of("hoogte"))), logs.logger());

    sorter.sort(List.of(row("wegen", ServiceProtocol.WMS)));

    assertTrue(logs.contains(Level.INFO, "No layers found for sort rule 7"));
  }

  @Test
  void unusedRuleIsLoggedEvenWhenItsBucketIsFilled() {
    FlatLayerSorter sorter = new FlatLayerSorter(List.of(
        SortRule.of(3, List.of("wms"), List.of("wegen")),
        SortRule.of(3, List.of("wcs"), List.of("hoogte")),
        SortRule.of(100, List.of("wfs"), List.of("^nergens$"))), logs.logger());

    List<FlatLayerRow> sorted = sorter.sort(List.of(
        row("luchtfoto", ServiceProtocol.WMS), row("wegen", ServiceProtocol.WMS)));

    assertEquals(List.of("wegen", "luchtfoto"), sorted.stream().map(FlatLayerRow::name).toList());
    List<String> unused = logs.messages(Level.INFO).stream()
        .filter(message -> message.startsWith("No layers found for sort rule"))
        .toList();
    assertEquals(2, unused.size(), unused.toString());
    assertTrue(unused.get(0).startsWith("No layers found for sort rule 3") && unused.get(0).contains("hoogte"),
        unused.toString());
    assertTrue(unused.get(1).startsWith("No layers found for sort rule 100"), unused.toString());
  }

  @Test
  void invalidPatternIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> SortRule.of(1, List.of("wms"), List.of("(unclosed")));
  }

  private static FlatLayerRow row(String name, ServiceProtocol protocol) {
    return new FlatLayerRow(new ContentItem.FeatureType(name, name, "", ""),
        "https://service.pdok.nl/" + protocol.shortName(), "Service", "", protocol, "md", "");
  }
}
