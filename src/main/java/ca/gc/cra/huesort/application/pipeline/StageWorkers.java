package ca.gc.cra.huesort.application.pipeline;

import ca.gc.cra.huesort.application.port.MetricsPort;
import ca.gc.cra.huesort.application.port.PixelLoadException;
import ca.gc.cra.huesort.application.port.PixelLoader;
import ca.gc.cra.huesort.domain.color.ColorFeatures;
import ca.gc.cra.huesort.domain.color.ColorTriple;
import ca.gc.cra.huesort.domain.color.EmptyInputException;
import ca.gc.cra.huesort.domain.image.WorkItem;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the four stage loops of a run and wires each one to the next structure.
 *
 * @since 0.1.0
 */
public final class StageWorkers {
  private static final Logger log = LoggerFactory.getLogger(StageWorkers.class);

  private StageWorkers() {}

  /**
   * Creates the extract, average, convert and insert loops for {@code state}.
   *
   * @param state run state shared by the loops
   * @param loader pixel loader used by the extract stage
   * @param metrics metrics sink
   * @param pollInterval poll park interval
   * @return the loops in pipeline order
   */
  public static List<StageWorker> create(
      PipelineState state, PixelLoader loader, MetricsPort metrics, Duration pollInterval) {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(loader, "loader");
    return List.of(
        new StageWorker(
            Stage.EXTRACT, state, item -> extract(item, loader),
            state.inputOf(Stage.AVERAGE)::put, metrics, pollInterval),
        new StageWorker(
            Stage.AVERAGE, state, StageWorkers::average,
            state.inputOf(Stage.CONVERT)::put, metrics, pollInterval),
        new StageWorker(
            Stage.CONVERT, state, StageWorkers::convert,
            state.inputOf(Stage.INSERT)::put, metrics, pollInterval),
        new StageWorker(
            Stage.INSERT, state, StageWorkers::prepareInsert,
            item -> insert(state, item), metrics, pollInterval));
  }

  static void extract(WorkItem item, PixelLoader loader) {
    try {
      List<ColorTriple> samples = loader.load(item.path());
      if (samples == null || samples.isEmpty()) {
        item.markFailed("no pixel samples in " + item.path());
        log.warn("Image {} produced no pixel samples", item.path());
        return;
      }
      item.samples(samples);
    } catch (PixelLoadException ex) {
      item.markFailed("load failed: " + ex.getMessage());
      log.warn("Unable to load pixels from {}: {}", item.path(), ex.getMessage());
    }
  }

  static void average(WorkItem item) {
    if (item.failed()) {
      return;
    }
    try {
      item.averageColor(ColorFeatures.averageColor(item.samples()));
    } catch (EmptyInputException ex) {
      item.markFailed(ex.getMessage());
    }
  }

  static void convert(WorkItem item) {
    if (item.failed()) {
      return;
    }
    ColorTriple average = item.averageColor()
        .orElseThrow(() -> new IllegalStateException("average color missing for " + item.path()));
    item.hue(ColorFeatures.rgbToHsl(average));
  }

  static void prepareInsert(WorkItem item) {
    if (!item.hasHue()) {
      item.markFailed("no hue assigned before insert");
    }
  }

  static void insert(PipelineState state, WorkItem item) {
    if (!state.results().insert(item)) {
      log.warn("Duplicate result key for {}; entry already present", item.path());
    }
    state.signalIfComplete();
  }
}
