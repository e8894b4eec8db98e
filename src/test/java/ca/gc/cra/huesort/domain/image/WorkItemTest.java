package ca.gc.cra.huesort.domain.image;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.huesort.domain.color.ColorTriple;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class WorkItemTest {
  @Test
  void freshItemHasNoHue() {
    WorkItem item = new WorkItem(Path.of("a.png"));
    assertFalse(item.hasHue());
    assertFalse(item.failed());
    assertTrue(item.averageColor().isEmpty());
    assertThrows(IllegalStateException.class, item::key);
  }

  @Test
  void averageColorReleasesSamples() {
    WorkItem item = new WorkItem(Path.of("a.png"));
    item.samples(List.of(new ColorTriple(1, 2, 3)));
    assertEquals(1, item.samples().size());

    item.averageColor(new ColorTriple(1, 2, 3));
    assertTrue(item.samples().isEmpty());
    assertEquals(new ColorTriple(1, 2, 3), item.averageColor().orElseThrow());
  }

  @Test
  void samplesAreCopied() {
    List<ColorTriple> source = new ArrayList<>(List.of(new ColorTriple(1, 1, 1)));
    WorkItem item = new WorkItem(Path.of("a.png"));
    item.samples(source);
    source.clear();
    assertEquals(1, item.samples().size());
  }

  @Test
  void hueOutsideRangeIsRejected() {
    WorkItem item = new WorkItem(Path.of("a.png"));
    assertThrows(IllegalArgumentException.class, () -> item.hue(360d));
    assertThrows(IllegalArgumentException.class, () -> item.hue(-0.5d));
    assertThrows(IllegalArgumentException.class, () -> item.hue(Double.NaN));
    item.hue(359.99d);
    assertEquals(new HueKey(359.99d, "a.png"), item.key());
  }

  @Test
  void failedItemSortsFirstAndKeepsFirstReason() {
    WorkItem item = new WorkItem(Path.of("broken.png"));
    item.samples(List.of(new ColorTriple(1, 1, 1)));
    item.markFailed("load failed");
    item.markFailed("second reason");

    assertTrue(item.failed());
    assertEquals("load failed", item.failure().orElseThrow());
    assertEquals(WorkItem.FAILED_HUE, item.hue());
    assertTrue(item.samples().isEmpty());
    assertThrows(IllegalStateException.class, () -> item.hue(10d));

    WorkItem healthy = new WorkItem(Path.of("a.png"));
    healthy.hue(0d);
    assertTrue(WorkItem.ORDERING.compare(item, healthy) < 0);
  }

  @Test
  void blankFailureReasonIsReplaced() {
    WorkItem item = new WorkItem(Path.of("x.png"));
    item.markFailed("  ");
    assertEquals("unknown failure", item.failure().orElseThrow());
  }
}
