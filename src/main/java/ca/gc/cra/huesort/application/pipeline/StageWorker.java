package ca.gc.cra.huesort.application.pipeline;

import ca.gc.cra.huesort.application.port.MetricsPort;
import ca.gc.cra.huesort.domain.image.WorkItem;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> One independently scheduled stage loop (polling, processing, done).
 * <p>The loop drains its input pile, applies the stage transform, and hands the item to the next structure
 * until the run's termination predicate holds. The predicate is re-evaluated on every iteration, whether or not
 * an item was taken.</p>
 * <p><strong>Failure handling:</strong> a transform that throws marks the item failed; the item is still
 * forwarded so the completion count stays reachable.</p>
 * <p><strong>Thread-safety:</strong> Each instance runs on exactly one thread.</p>
 *
 * @since 0.1.0
 */
public final class StageWorker implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(StageWorker.class);

  /** Per-item transform applied by a stage. */
  @FunctionalInterface
  public interface Transform {
    /**
     * Fills in the stage's field of {@code item}.
     *
     * @param item item owned by the calling stage
     */
    void apply(WorkItem item);
  }

  private final Stage stage;
  private final PipelineState state;
  private final ConcurrentPile<WorkItem> input;
  private final Transform transform;
  private final Consumer<WorkItem> output;
  private final MetricsPort metrics;
  private final Duration pollInterval;
  private long processed;

  /**
   * Creates a stage loop.
   *
   * @param stage stage identity used for logs and metrics
   * @param state run state providing the input pile and the termination predicate
   * @param transform per-item transform
   * @param output receives every item after the transform, failed or not
   * @param metrics metrics sink
   * @param pollInterval longest time a poll parks before re-checking the predicate
   */
  public StageWorker(
      Stage stage,
      PipelineState state,
      Transform transform,
      Consumer<WorkItem> output,
      MetricsPort metrics,
      Duration pollInterval) {
    this.stage = Objects.requireNonNull(stage, "stage");
    this.state = Objects.requireNonNull(state, "state");
    this.input = state.inputOf(stage);
    this.transform = Objects.requireNonNull(transform, "transform");
    this.output = Objects.requireNonNull(output, "output");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
  }

  public Stage stage() {
    return stage;
  }

  @Override
  public void run() {
    MDC.put("stage", stage.label());
    try {
      log.debug("Stage {} polling {}", stage.label(), input.name());
      while (!state.isComplete()) {
        Optional<WorkItem> next = input.take(pollInterval);
        if (next.isPresent()) {
          process(next.get());
        }
      }
      log.debug("Stage {} done after {} items", stage.label(), processed);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      metrics.increment(stage.metricKey("interrupted"));
      log.debug("Stage {} interrupted after {} items", stage.label(), processed);
    } finally {
      MDC.remove("stage");
    }
  }

  void process(WorkItem item) {
    long startNanos = System.nanoTime();
    boolean failedBefore = item.failed();
    try {
      transform.apply(item);
    } catch (RuntimeException ex) {
      item.markFailed(stage.label() + ": " + ex.getMessage());
      log.warn("Stage {} failed on {}; forwarding as failed", stage.label(), item.path(), ex);
    }
    if (!failedBefore && item.failed()) {
      metrics.increment(stage.metricKey("failed"));
    }
    output.accept(item);
    processed++;
    metrics.increment(stage.metricKey("processed"));
    metrics.observe(stage.metricKey("latencyNanos"), System.nanoTime() - startNanos);
    metrics.observe(stage.metricKey("queue.depth"), input.count());
    if (log.isDebugEnabled()) {
      log.debug("Stage {} processed {}", stage.label(), item);
    }
  }
}
