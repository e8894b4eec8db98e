package ca.gc.cra.huesort.application.pipeline;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> Unordered, thread-safe hand-off buffer between two pipeline stages.
 * <p><strong>Why:</strong> Each pile has its own lock so adjacent stages never contend with unrelated ones.</p>
 * <p><strong>Thread-safety:</strong> {@link #put}, {@link #take}, {@link #count} and {@link #snapshot} are
 * mutually exclusive on the same pile. Items are taken most-recent-first; callers must not rely on any order.</p>
 * <p><strong>Blocking:</strong> {@link #take()} never blocks. {@link #take(Duration)} parks on the pile's
 * condition until an item arrives, {@link #wakeAll()} is called, or the wait elapses.</p>
 *
 * @param <T> item type
 * @since 0.1.0
 */
public final class ConcurrentPile<T> {
  private final String name;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final Deque<T> items = new ArrayDeque<>();
  private long wakeGeneration;

  /**
   * Creates an empty pile.
   *
   * @param name label used in logs and metrics
   */
  public ConcurrentPile(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public String name() {
    return name;
  }

  /**
   * Adds an item and wakes one waiting consumer.
   *
   * @param item item to add; must not be {@code null}
   */
  public void put(T item) {
    Objects.requireNonNull(item, "item");
    lock.lock();
    try {
      items.addLast(item);
      changed.signal();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes an item if one is available.
   *
   * @return the item, or empty when the pile is empty
   */
  public Optional<T> take() {
    lock.lock();
    try {
      return Optional.ofNullable(items.pollLast());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes an item, waiting up to {@code timeout} for one to arrive.
   * Returns early and empty when {@link #wakeAll()} is called during the wait.
   *
   * @param timeout maximum wait
   * @return the item, or empty when none arrived in time
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public Optional<T> take(Duration timeout) throws InterruptedException {
    long remaining = Objects.requireNonNull(timeout, "timeout").toNanos();
    lock.lockInterruptibly();
    try {
      long generation = wakeGeneration;
      while (items.isEmpty()) {
        if (remaining <= 0L || generation != wakeGeneration) {
          return Optional.empty();
        }
        remaining = changed.awaitNanos(remaining);
      }
      return Optional.of(items.pollLast());
    } finally {
      lock.unlock();
    }
  }

  public int count() {
    lock.lock();
    try {
      return items.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Copies the current contents for diagnostics. Never used for stage hand-off.
   *
   * @return point-in-time copy in insertion order
   */
  public List<T> snapshot() {
    lock.lock();
    try {
      return List.copyOf(new ArrayList<>(items));
    } finally {
      lock.unlock();
    }
  }

  /** Releases every consumer currently parked in {@link #take(Duration)}. */
  public void wakeAll() {
    lock.lock();
    try {
      wakeGeneration++;
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "ConcurrentPile{" + name + ", count=" + count() + '}';
  }
}
