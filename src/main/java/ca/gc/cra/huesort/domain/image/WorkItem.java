package ca.gc.cra.huesort.domain.image;

import ca.gc.cra.huesort.domain.color.ColorTriple;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One image travelling through the hue pipeline.
 * <p><strong>Why:</strong> Each stage fills in exactly one field (samples, average color, hue) and forwards the
 * item, so the item itself records how far it has progressed.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Ownership is handed from stage to stage through piles, so
 * at any instant a single thread holds the item; the pile locks provide the happens-before edges between
 * owners.</p>
 * <p><strong>Failure:</strong> an item that cannot be processed is {@linkplain #markFailed(String) marked failed}
 * and keeps moving; its hue becomes {@link #FAILED_HUE} so it still lands in the ordering exactly once.</p>
 *
 * @since 0.1.0
 */
public final class WorkItem {
  /** Hue assigned to items whose pixels could not be loaded or averaged; sorts before every valid hue. */
  public static final double FAILED_HUE = -1d;

  /** Ascending hue, ties broken by the path's string form. */
  public static final Comparator<WorkItem> ORDERING =
      Comparator.comparing(WorkItem::key, HueKey.ORDER);

  private final Path path;
  private List<ColorTriple> samples = List.of();
  private ColorTriple averageColor;
  private double hue = Double.NaN;
  private String failure;

  /**
   * Creates a freshly discovered item with only its path set.
   *
   * @param path image location; must not be {@code null}
   */
  public WorkItem(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  public Path path() {
    return path;
  }

  /**
   * Returns the extracted pixel samples; empty before extraction or after a load failure.
   *
   * @return immutable sample list
   */
  public List<ColorTriple> samples() {
    return samples;
  }

  /**
   * Stores the extracted samples. An immutable list such as one from {@link List#copyOf} is kept as is; any other
   * list is copied.
   *
   * @param samples extracted samples; must not be {@code null}
   */
  public void samples(List<ColorTriple> samples) {
    this.samples = List.copyOf(Objects.requireNonNull(samples, "samples"));
  }

  public Optional<ColorTriple> averageColor() {
    return Optional.ofNullable(averageColor);
  }

  /**
   * Stores the average color and releases the raw samples, which are no longer needed downstream.
   *
   * @param averageColor computed average; must not be {@code null}
   */
  public void averageColor(ColorTriple averageColor) {
    this.averageColor = Objects.requireNonNull(averageColor, "averageColor");
    this.samples = List.of();
  }

  /**
   * Returns the hue in degrees; {@code NaN} until the conversion stage has run.
   *
   * @return hue, {@link #FAILED_HUE} for failed items
   */
  public double hue() {
    return hue;
  }

  public void hue(double hue) {
    if (failure != null) {
      throw new IllegalStateException("hue cannot be assigned to failed item " + path);
    }
    if (Double.isNaN(hue) || hue < 0d || hue >= 360d) {
      throw new IllegalArgumentException("hue must be in [0, 360) (was " + hue + ")");
    }
    this.hue = hue;
  }

  public boolean hasHue() {
    return !Double.isNaN(hue);
  }

  /**
   * Flags the item as failed and pins its hue to {@link #FAILED_HUE}. The first reason wins.
   *
   * @param reason human readable failure reason
   */
  public void markFailed(String reason) {
    if (failure == null) {
      failure = (reason == null || reason.isBlank()) ? "unknown failure" : reason;
    }
    samples = List.of();
    hue = FAILED_HUE;
  }

  public boolean failed() {
    return failure != null;
  }

  public Optional<String> failure() {
    return Optional.ofNullable(failure);
  }

  /**
   * Returns the ordering key of this item.
   *
   * @return {@code (hue, path)} key
   * @throws IllegalStateException if the hue has not been assigned yet
   */
  public HueKey key() {
    if (!hasHue()) {
      throw new IllegalStateException("hue not assigned for " + path);
    }
    return new HueKey(hue, path.toString());
  }

  @Override
  public String toString() {
    return "WorkItem{"
        + "path=" + path
        + ", samples=" + samples.size()
        + ", averageColor=" + averageColor
        + ", hue=" + hue
        + (failure == null ? "" : ", failure=" + failure)
        + '}';
  }
}
