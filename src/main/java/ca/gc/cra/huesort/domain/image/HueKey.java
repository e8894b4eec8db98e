package ca.gc.cra.huesort.domain.image;

import java.util.Comparator;
import java.util.Objects;

/**
 * Compound ordering key of the result set.
 * <p>The path takes part in the key so two distinct images with the same hue stay two entries.</p>
 *
 * @param hue hue in degrees, or {@link WorkItem#FAILED_HUE}
 * @param path string form of the image path
 * @since 0.1.0
 */
public record HueKey(double hue, String path) implements Comparable<HueKey> {
  /** Ascending hue, then ascending path. */
  public static final Comparator<HueKey> ORDER =
      Comparator.comparingDouble(HueKey::hue).thenComparing(HueKey::path);

  /**
   * Validates the key components.
   *
   * @throws NullPointerException if {@code path} is {@code null}
   * @throws IllegalArgumentException if {@code hue} is {@code NaN}
   */
  public HueKey {
    Objects.requireNonNull(path, "path");
    if (Double.isNaN(hue)) {
      throw new IllegalArgumentException("hue must not be NaN");
    }
  }

  @Override
  public int compareTo(HueKey other) {
    return ORDER.compare(this, other);
  }
}
