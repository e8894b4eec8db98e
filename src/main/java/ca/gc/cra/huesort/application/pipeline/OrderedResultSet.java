package ca.gc.cra.huesort.application.pipeline;

import ca.gc.cra.huesort.domain.image.HueKey;
import ca.gc.cra.huesort.domain.image.WorkItem;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> Thread-safe, hue-ordered sink of the pipeline.
 * <p>Entries are keyed by {@link HueKey} {@code (hue, path)}: re-inserting an identical key is a no-op, while
 * two images sharing a hue are kept apart by their paths.</p>
 * <p><strong>Thread-safety:</strong> Guarded by a private lock; {@link #snapshotOrdered()} returns an
 * immutable copy that may be read while inserts continue.</p>
 *
 * @since 0.1.0
 */
public final class OrderedResultSet {
  private final ReentrantLock lock = new ReentrantLock();
  private final TreeMap<HueKey, WorkItem> entries = new TreeMap<>(HueKey.ORDER);

  /**
   * Inserts an item under its {@code (hue, path)} key.
   *
   * @param item item with an assigned hue
   * @return {@code true} if the item was added, {@code false} if the key was already present
   * @throws IllegalStateException if the item has no hue yet
   */
  public boolean insert(WorkItem item) {
    HueKey key = Objects.requireNonNull(item, "item").key();
    lock.lock();
    try {
      return entries.putIfAbsent(key, item) == null;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Copies the entries in ascending hue, then path order.
   *
   * @return immutable ordered copy
   */
  public List<WorkItem> snapshotOrdered() {
    lock.lock();
    try {
      return List.copyOf(entries.values());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Counts entries flagged as failed.
   *
   * @return number of failed items currently held
   */
  public int failedCount() {
    lock.lock();
    try {
      int failed = 0;
      for (WorkItem item : entries.values()) {
        if (item.failed()) {
          failed++;
        }
      }
      return failed;
    } finally {
      lock.unlock();
    }
  }
}
