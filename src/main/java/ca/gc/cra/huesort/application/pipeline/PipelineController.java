package ca.gc.cra.huesort.application.pipeline;

import ca.gc.cra.huesort.application.port.ImageDiscovery;
import ca.gc.cra.huesort.application.port.MetricsPort;
import ca.gc.cra.huesort.application.port.PixelLoader;
import ca.gc.cra.huesort.domain.image.WorkItem;
import ca.gc.cra.huesort.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.lang.Thread.UncaughtExceptionHandler;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Owns one processing run: starts discovery and the four stage loops, exposes the
 * termination predicate and the growing hue ordering, and shuts the workers down.
 * <p><strong>Workers:</strong> discovery plus one thread per {@link Stage}, hosted on a dedicated non-daemon pool
 * (threads named after the worker they host, such as <code>huesort-1a2b-discover</code> or
 * <code>huesort-1a2b-extract</code>). Each worker has a completion handle so {@link #close()} can tell when the
 * run has fully ended.</p>
 * <p><strong>Liveness:</strong> discovery always finalizes the total, even when enumeration fails part way, and
 * stages forward failed items instead of dropping them, so {@link #isComplete()} becomes {@code true} for every
 * run whose workers stay alive.</p>
 * <p><strong>Thread-safety:</strong> {@link #isComplete()}, {@link #currentOrdering()} and {@link #progress()}
 * may be called from any thread. {@link #start()} may be called once.</p>
 *
 * @since 0.1.0
 */
public final class PipelineController implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PipelineController.class);
  private static final String DISCOVERY_LABEL = "discover";
  private static final int WORKER_COUNT = Stage.values().length + 1;
  private static final Duration FAILURE_CHECK_INTERVAL = Duration.ofMillis(100);

  private final ImageDiscovery discovery;
  private final PixelLoader pixelLoader;
  private final MetricsPort metrics;
  private final PipelineSettings settings;
  private final PipelineState state;
  private final String threadPrefix;
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicReference<IOException> discoveryFailure = new AtomicReference<>();
  private final AtomicReference<Throwable> workerFailure = new AtomicReference<>();
  private final List<CompletableFuture<Void>> workers = new ArrayList<>(WORKER_COUNT);

  private volatile ExecutorService executor;

  /**
   * Creates a controller for a fresh run with its own {@link PipelineState}.
   *
   * @param discovery image enumeration, invoked once
   * @param pixelLoader pixel loader used by the extract stage
   * @param metrics metrics sink
   * @param settings tuning parameters
   */
  public PipelineController(
      ImageDiscovery discovery,
      PixelLoader pixelLoader,
      MetricsPort metrics,
      PipelineSettings settings) {
    this(discovery, pixelLoader, metrics, settings, new PipelineState());
  }

  /**
   * Creates a controller over an explicitly supplied run state.
   *
   * @param discovery image enumeration, invoked once
   * @param pixelLoader pixel loader used by the extract stage
   * @param metrics metrics sink
   * @param settings tuning parameters
   * @param state run state; must be fresh
   * @throws IllegalArgumentException if {@code state} already holds discovered images or a finalized total
   */
  public PipelineController(
      ImageDiscovery discovery,
      PixelLoader pixelLoader,
      MetricsPort metrics,
      PipelineSettings settings,
      PipelineState state) {
    this.discovery = Objects.requireNonNull(discovery, "discovery");
    this.pixelLoader = Objects.requireNonNull(pixelLoader, "pixelLoader");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.state = Objects.requireNonNull(state, "state");
    if (state.totalImageCount().isPresent() || state.discoveredCount() > 0) {
      throw new IllegalArgumentException("pipeline state was already used by another run");
    }
    this.threadPrefix = "huesort-" + Integer.toHexString(System.identityHashCode(this));
  }

  /**
   * Launches discovery and the stage loops and returns immediately.
   *
   * @throws IllegalStateException if the controller was already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Pipeline already started");
    }
    UncaughtExceptionHandler crashHandler = this::handleWorkerCrash;
    List<StageWorker> stageWorkers =
        StageWorkers.create(state, pixelLoader, metrics, settings.pollInterval());
    List<String> labels = new ArrayList<>(WORKER_COUNT);
    labels.add(DISCOVERY_LABEL);
    stageWorkers.forEach(worker -> labels.add(worker.stage().label()));
    ExecutorService pool = ExecutorFactories.newStagePool(threadPrefix, labels, crashHandler);
    executor = pool;

    // submission order must follow the label order
    launch(pool, this::discover);
    for (StageWorker worker : stageWorkers) {
      launch(pool, worker);
    }
    log.info("Pipeline started with {} workers (poll {} ms)",
        WORKER_COUNT, settings.pollInterval().toMillis());
  }

  /**
   * Evaluates the termination predicate: total known and every image inserted.
   *
   * @return {@code true} once the run is complete
   */
  public boolean isComplete() {
    return state.isComplete();
  }

  /**
   * Returns the current hue ordering; partial results are valid before completion.
   *
   * @return immutable ordered snapshot
   */
  public List<WorkItem> currentOrdering() {
    return state.results().snapshotOrdered();
  }

  /**
   * Returns discovery counters, result counts and pile depths.
   *
   * @return progress snapshot
   */
  public PipelineProgress progress() {
    OrderedResultSet results = state.results();
    return new PipelineProgress(
        state.discoveredCount(),
        state.totalImageCount(),
        results.size(),
        results.failedCount(),
        state.inputOf(Stage.EXTRACT).count(),
        state.inputOf(Stage.AVERAGE).count(),
        state.inputOf(Stage.CONVERT).count(),
        state.inputOf(Stage.INSERT).count());
  }

  /**
   * Returns the exception that ended discovery early, if any.
   *
   * @return discovery failure
   */
  public Optional<IOException> discoveryFailure() {
    return Optional.ofNullable(discoveryFailure.get());
  }

  /**
   * Waits until the run completes.
   *
   * @param timeout maximum wait
   * @return {@code true} if the run completed within {@code timeout}
   * @throws InterruptedException if interrupted while waiting
   * @throws IllegalStateException if the controller was not started or a worker died
   */
  public boolean awaitCompletion(Duration timeout) throws InterruptedException {
    if (!started.get()) {
      throw new IllegalStateException("Pipeline not started");
    }
    long deadline = System.nanoTime() + timeout.toNanos();
    while (true) {
      Throwable crash = workerFailure.get();
      if (crash != null) {
        throw new IllegalStateException("Pipeline worker failed", crash);
      }
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0L) {
        return state.isComplete();
      }
      Duration slice = Duration.ofNanos(Math.min(remaining, FAILURE_CHECK_INTERVAL.toNanos()));
      if (state.awaitCompletion(slice)) {
        return true;
      }
    }
  }

  /**
   * Stops the workers. A complete run shuts down gracefully; an incomplete one is interrupted.
   */
  @Override
  public void close() {
    ExecutorService pool = executor;
    if (pool == null) {
      return;
    }
    executor = null;
    boolean complete = state.isComplete();
    if (complete) {
      pool.shutdown();
    } else {
      String total = state.totalImageCount().isPresent()
          ? Long.toString(state.totalImageCount().getAsLong())
          : "unknown";
      log.warn("Closing pipeline before completion ({} of {} images ordered)",
          state.results().size(), total);
      metrics.increment("pipeline.shutdown.incomplete");
      pool.shutdownNow();
    }
    boolean terminated = false;
    try {
      terminated = pool.awaitTermination(settings.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
      if (!terminated) {
        metrics.increment("pipeline.shutdown.force");
        log.warn("Pipeline workers active after {} ms; forcing shutdown",
            settings.shutdownTimeout().toMillis());
        pool.shutdownNow();
        terminated = pool.awaitTermination(settings.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException ie) {
      metrics.increment("pipeline.shutdown.interrupted");
      Thread.currentThread().interrupt();
    }
    if (!terminated) {
      log.error("Pipeline workers failed to terminate cleanly");
    } else {
      log.debug("Pipeline workers terminated ({} handles done)",
          workers.stream().filter(CompletableFuture::isDone).count());
    }
  }

  private void launch(ExecutorService pool, Runnable task) {
    CompletableFuture<Void> handle = new CompletableFuture<>();
    workers.add(handle);
    pool.execute(() -> {
      try {
        task.run();
        handle.complete(null);
      } catch (RuntimeException | Error ex) {
        handle.completeExceptionally(ex);
        throw ex;
      }
    });
  }

  private void discover() {
    MDC.put("stage", DISCOVERY_LABEL);
    try {
      List<Path> paths = discovery.discover();
      Set<Path> seen = new HashSet<>();
      for (Path path : paths) {
        if (path == null || !seen.add(path)) {
          metrics.increment("pipeline.discover.duplicate");
          log.warn("Skipping duplicate or null discovery entry {}", path);
          continue;
        }
        state.submitDiscovered(new WorkItem(path));
      }
    } catch (IOException ex) {
      discoveryFailure.set(ex);
      metrics.increment("pipeline.discover.error");
      log.error("Image discovery failed after {} images", state.discoveredCount(), ex);
    } finally {
      long total = state.finalizeTotal();
      metrics.observe("pipeline.discover.total", total);
      log.info("Discovery finalized {} images", total);
      MDC.remove("stage");
    }
  }

  private void handleWorkerCrash(Thread thread, Throwable throwable) {
    metrics.increment("pipeline.worker.uncaught");
    log.error("Pipeline worker {} threw an uncaught exception", thread.getName(), throwable);
    workerFailure.compareAndSet(null, throwable);
  }
}
