package ca.gc.cra.huesort.application.pipeline;

import ca.gc.cra.huesort.domain.image.WorkItem;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> Shared state of one processing run: the four hand-off piles, the ordered result set,
 * the discovery counter and the completion barrier.
 * <p><strong>Termination:</strong> the run is complete once the total image count is known and the result set
 * holds that many entries. Whichever of {@link #finalizeTotal()} or {@link #signalIfComplete()} first observes
 * the condition releases the barrier and wakes every parked stage.</p>
 * <p><strong>Thread-safety:</strong> All members are thread-safe; each pile and the result set lock
 * independently.</p>
 * <p>Instances belong to a single run and are not reset.</p>
 *
 * @since 0.1.0
 */
public final class PipelineState {
  private static final long UNKNOWN = -1L;

  private final ConcurrentPile<WorkItem> extractInput = new ConcurrentPile<>("extract");
  private final ConcurrentPile<WorkItem> averageInput = new ConcurrentPile<>("average");
  private final ConcurrentPile<WorkItem> convertInput = new ConcurrentPile<>("convert");
  private final ConcurrentPile<WorkItem> insertInput = new ConcurrentPile<>("insert");
  private final OrderedResultSet results = new OrderedResultSet();
  private final AtomicLong discovered = new AtomicLong();
  private final AtomicLong total = new AtomicLong(UNKNOWN);
  private final CountDownLatch completed = new CountDownLatch(1);

  /**
   * Returns the input pile of {@code stage}.
   *
   * @param stage pipeline stage
   * @return the pile the stage drains
   */
  public ConcurrentPile<WorkItem> inputOf(Stage stage) {
    return switch (Objects.requireNonNull(stage, "stage")) {
      case EXTRACT -> extractInput;
      case AVERAGE -> averageInput;
      case CONVERT -> convertInput;
      case INSERT -> insertInput;
    };
  }

  public OrderedResultSet results() {
    return results;
  }

  /**
   * Pushes a newly discovered item into the extract pile and counts it.
   *
   * @param item freshly created item
   * @throws IllegalStateException if the total has already been finalized
   */
  public void submitDiscovered(WorkItem item) {
    Objects.requireNonNull(item, "item");
    if (total.get() != UNKNOWN) {
      throw new IllegalStateException("image total already finalized");
    }
    extractInput.put(item);
    discovered.incrementAndGet();
  }

  public long discoveredCount() {
    return discovered.get();
  }

  /**
   * Fixes the total image count to the number of items submitted so far.
   *
   * @return the finalized total
   * @throws IllegalStateException if called more than once
   */
  public long finalizeTotal() {
    long count = discovered.get();
    if (!total.compareAndSet(UNKNOWN, count)) {
      throw new IllegalStateException("image total already finalized");
    }
    signalIfComplete();
    return count;
  }

  /**
   * Returns the total image count.
   *
   * @return the total, or empty while discovery is still enumerating
   */
  public OptionalLong totalImageCount() {
    long value = total.get();
    return value == UNKNOWN ? OptionalLong.empty() : OptionalLong.of(value);
  }

  /**
   * Evaluates the termination predicate.
   *
   * @return {@code true} once the total is known and every image is in the result set
   */
  public boolean isComplete() {
    long value = total.get();
    return value != UNKNOWN && results.size() == value;
  }

  /**
   * Releases the completion barrier if the termination predicate holds.
   *
   * @return {@code true} if the run is complete
   */
  public boolean signalIfComplete() {
    if (!isComplete()) {
      return false;
    }
    if (completed.getCount() > 0) {
      completed.countDown();
      for (Stage stage : Stage.values()) {
        inputOf(stage).wakeAll();
      }
    }
    return true;
  }

  /**
   * Waits for the completion barrier.
   *
   * @param timeout maximum wait
   * @return {@code true} if the run completed within {@code timeout}
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitCompletion(Duration timeout) throws InterruptedException {
    return completed.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  List<ConcurrentPile<WorkItem>> piles() {
    return List.of(extractInput, averageInput, convertInput, insertInput);
  }
}
