package ca.gc.cra.huesort.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executors that host pipeline workers.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a pool with exactly one thread per pipeline worker, each named after the worker it hosts.
   * <p>Threads are named {@code <runPrefix>-<label>}, with labels handed out in submission order, so the first
   * task submitted runs on the thread named after {@code workerLabels.get(0)}. A thread created to replace a
   * crashed worker is named {@code <runPrefix>-respawn-<n>}. Submitting more tasks than there are labels is
   * rejected.</p>
   *
   * @param runPrefix prefix identifying the run, such as {@code huesort-1f2e3d}
   * @param workerLabels distinct worker labels such as {@code discover} or {@code extract}
   * @param handler uncaught exception handler installed on each worker thread; {@code null} ignores crashes
   * @return configured executor service
   * @throws IllegalArgumentException if the labels are empty, blank or repeated
   */
  public static ExecutorService newStagePool(
      String runPrefix, List<String> workerLabels, UncaughtExceptionHandler handler) {
    List<String> labels = List.copyOf(Objects.requireNonNull(workerLabels, "workerLabels"));
    if (labels.isEmpty()) {
      throw new IllegalArgumentException("at least one worker label is required");
    }
    Set<String> seen = new HashSet<>();
    for (String label : labels) {
      if (label.isBlank() || !seen.add(label)) {
        throw new IllegalArgumentException("worker labels must be distinct and non-blank: " + labels);
      }
    }
    String prefix = (runPrefix == null || runPrefix.isBlank()) ? "huesort" : runPrefix;
    ThreadFactory factory = new StageThreadFactory(prefix, labels,
        Objects.requireNonNullElse(handler, (t, ex) -> {}));

    return new ThreadPoolExecutor(
        labels.size(),
        labels.size(),
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Names threads after pipeline workers. Core threads of a queueless pool are created synchronously on
   * {@code execute}, so creation order equals submission order.
   */
  private static final class StageThreadFactory implements ThreadFactory {
    private final String prefix;
    private final List<String> labels;
    private final UncaughtExceptionHandler handler;
    private final AtomicInteger created = new AtomicInteger();

    StageThreadFactory(String prefix, List<String> labels, UncaughtExceptionHandler handler) {
      this.prefix = prefix;
      this.labels = labels;
      this.handler = handler;
    }

    @Override
    public Thread newThread(Runnable runnable) {
      int index = created.getAndIncrement();
      String suffix = index < labels.size()
          ? labels.get(index)
          : "respawn-" + (index - labels.size());
      Thread thread = new Thread(runnable, prefix + "-" + suffix);
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler(handler);
      return thread;
    }
  }
}
