package ca.gc.cra.huesort.domain.image;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class HueKeyTest {
  @Test
  void ordersByHueThenPath() {
    List<HueKey> keys = new ArrayList<>(List.of(
        new HueKey(200.5d, "b.png"),
        new HueKey(10d, "c.png"),
        new HueKey(10d, "a.png"),
        new HueKey(WorkItem.FAILED_HUE, "z.png")));
    Collections.sort(keys);

    assertEquals(List.of(
        new HueKey(WorkItem.FAILED_HUE, "z.png"),
        new HueKey(10d, "a.png"),
        new HueKey(10d, "c.png"),
        new HueKey(200.5d, "b.png")), keys);
  }

  @Test
  void equalHuesWithDifferentPathsAreDistinct() {
    HueKey a = new HueKey(10d, "a.png");
    HueKey c = new HueKey(10d, "c.png");
    assertNotEquals(a, c);
    assertTrue(a.compareTo(c) < 0);
    assertEquals(0, a.compareTo(new HueKey(10d, "a.png")));
  }

  @Test
  void rejectsNanAndNullPath() {
    assertThrows(IllegalArgumentException.class, () -> new HueKey(Double.NaN, "a.png"));
    assertThrows(NullPointerException.class, () -> new HueKey(1d, null));
  }
}
