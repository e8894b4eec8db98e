package ca.gc.cra.huesort.application.pipeline;

import ca.gc.cra.huesort.application.port.ImageDiscovery;
import ca.gc.cra.huesort.application.port.MetricsPort;
import ca.gc.cra.huesort.application.port.PixelLoader;
import ca.gc.cra.huesort.domain.image.WorkItem;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one hue ordering pass to completion on the calling thread.
 * <p><strong>Why:</strong> The controller starts asynchronously for display-style consumers; batch callers such
 * as the CLI and tests need a blocking run that returns the final ordering.</p>
 * <p><strong>Role:</strong> Application use case wiring discovery, pixel loading and metrics into a
 * {@link PipelineController}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; each {@link #run()} creates a fresh controller, so an
 * instance may be run repeatedly but not concurrently.</p>
 *
 * @since 0.1.0
 */
public final class HueSortUseCase {
  private static final Logger log = LoggerFactory.getLogger(HueSortUseCase.class);

  private final Supplier<PipelineController> controllerFactory;
  private final MetricsPort metrics;
  private final Duration completionTimeout;

  /**
   * Creates the use case.
   *
   * @param discovery image enumeration
   * @param pixelLoader pixel loader for the extract stage
   * @param metrics metrics sink
   * @param settings pipeline tuning
   * @param completionTimeout maximum run time; zero or negative waits without limit
   */
  public HueSortUseCase(
      ImageDiscovery discovery,
      PixelLoader pixelLoader,
      MetricsPort metrics,
      PipelineSettings settings,
      Duration completionTimeout) {
    Objects.requireNonNull(discovery, "discovery");
    Objects.requireNonNull(pixelLoader, "pixelLoader");
    Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.completionTimeout = Objects.requireNonNullElse(completionTimeout, Duration.ZERO);
    this.controllerFactory = () -> new PipelineController(discovery, pixelLoader, metrics, settings);
  }

  /**
   * Starts a run, waits for it to complete, and returns the final ordering.
   *
   * @return ordering and run statistics
   * @throws PipelineTimeoutException if the completion timeout expires first
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public HueSortResult run() throws PipelineTimeoutException, InterruptedException {
    MDC.put("pipeline", "huesort");
    long startNanos = System.nanoTime();
    try (PipelineController controller = controllerFactory.get()) {
      controller.start();
      boolean unbounded = completionTimeout.isZero() || completionTimeout.isNegative();
      Duration wait = unbounded ? Duration.ofNanos(Long.MAX_VALUE) : completionTimeout;
      if (!controller.awaitCompletion(wait)) {
        metrics.increment("pipeline.run.timeout");
        throw new PipelineTimeoutException(completionTimeout, controller.progress());
      }
      List<WorkItem> ordering = controller.currentOrdering();
      PipelineProgress progress = controller.progress();
      Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
      metrics.observe("pipeline.run.durationMillis", elapsed.toMillis());
      metrics.increment("pipeline.run.completed");
      log.info("Pipeline completed; ordered {} images ({} failed) in {} ms",
          ordering.size(), progress.failed(), TimeUnit.NANOSECONDS.toMillis(elapsed.toNanos()));
      return new HueSortResult(ordering, progress.failed(), controller.discoveryFailure(), elapsed);
    } finally {
      MDC.remove("pipeline");
    }
  }
}
