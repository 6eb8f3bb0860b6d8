package nl.pdok.spider.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import nl.pdok.spider.application.pipeline.CataloguePaginator.Page;
import nl.pdok.spider.testing.CapturedLogs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class CataloguePaginatorTest {
  private final CapturedLogs logs = CapturedLogs.create("paginator");
  private final CataloguePaginator paginator = new CataloguePaginator(logs.logger());
  private final List<int[]> requests = new ArrayList<>();

  @AfterEach
  void tearDown() {
    logs.close();
  }

  @Test
  void pagesThroughAllMatchesInPagesOfHundred() throws Exception {
    List<String> ids = paginator.collect("protocol='OGC:WMS'", 0, (start, size) -> {
      requests.add(new int[] {start, size});
      return page(250, start, size);
    }, id -> id);

    assertEquals(3, requests.size());
    assertEquals(List.of(1, 101, 201), requests.stream().map(r -> r[0]).collect(Collectors.toList()));
    assertEquals(250, ids.size());
    assertEquals("rec-1", ids.get(0));
    assertEquals("rec-250", ids.get(249));
  }

  @Test
  void pageSizeFollowsMaxResults() {
    assertEquals(100, CataloguePaginator.pageSize(0));
    assertEquals(25, CataloguePaginator.pageSize(25));
    assertEquals(100, CataloguePaginator.pageSize(400));
    assertThrows(IllegalArgumentException.class, () -> CataloguePaginator.pageSize(-1));
  }

  @Test
  void stopsAtMaxResults() throws Exception {
    List<String> ids = paginator.collect("q", 150, (start, size) -> {
      requests.add(new int[] {start, size});
      return page(250, start, size);
    }, id -> id);

    assertEquals(150, ids.size());
    assertEquals(2, requests.size());
    assertEquals(50, requests.get(1)[1]);
  }

  @Test
  void matchCountDriftKeepsEarlierPagesAndWarns() throws Exception {
    List<String> ids = paginator.collect("drifting", 0, (start, size) -> {
      int matched = start == 1 ? 250 : 249;
      return page(matched, start, size);
    }, id -> id);

    assertEquals(100, ids.size());
    assertTrue(logs.contains(Level.WARN, "match count changed from 250 to 249"));
  }

  @Test
  void stalledNextRecordStopsLoop() throws Exception {
    List<String> ids = paginator.collect("stalled", 0, (start, size) -> {
      requests.add(new int[] {start, size});
      Page<String> page = page(250, start, size);
      return new Page<>(page.records(), page.matched(), page.returned(), 1);
    }, id -> id);

    assertEquals(1, requests.size());
    assertEquals(100, ids.size());
  }

  @Test
  void emptyPageStopsLoop() throws Exception {
    List<String> ids = paginator.collect("empty", 0, (start, size) -> {
      requests.add(new int[] {start, size});
      return new Page<String>(List.of(), 250, 0, start + size);
    }, id -> id);

    assertEquals(1, requests.size());
    assertTrue(ids.isEmpty());
  }

  @Test
  void duplicateIdentifiersAcrossPagesAreDropped() throws Exception {
    List<String> ids = paginator.collect("overlap", 0, (start, size) -> {
      if (start == 1) {
        return new Page<>(List.of("a", "b", "c"), 5, 3, 3);
      }
      return new Page<>(List.of("c", "d", "e"), 5, 3, 0);
    }, id -> id);

    assertEquals(List.of("a", "b", "c", "d", "e"), ids);
  }

  @Test
  void firstPageFailurePropagates() {
    CataloguePaginator.PageSource<String> source = (start, size) -> {
      throw new IOException("catalogue unavailable");
    };

    assertThrows(IOException.class, () -> paginator.collect("down", 0, source, id -> id));
  }

  @Test
  void laterPageFailureKeepsCollectedRecords() throws Exception {
    List<String> ids = paginator.collect("flaky", 0, (start, size) -> {
      if (start > 1) {
        throw new IOException("timeout");
      }
      return page(250, start, size);
    }, id -> id);

    assertEquals(100, ids.size());
    assertTrue(logs.contains(Level.WARN, "failed at position 101"));
  }

  private static Page<String> page(int matched, int start, int size) {
    int end = Math.min(matched, start + size - 1);
    List<String> records = IntStream.rangeClosed(start, end).mapToObj(i -> "rec-" + i).collect(Collectors.toList());
    int next = end >= matched ? 0 : end + 1;
    return new Page<>(records, matched, records.size(), next);
  }
}
