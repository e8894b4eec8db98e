package ca.gc.cra.huesort.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {
  private static final List<String> WORKERS = List.of("discover", "extract", "average", "convert", "insert");

  @Test
  void threadsAreNamedAfterWorkersInSubmissionOrder() throws Exception {
    ExecutorService pool = ExecutorFactories.newStagePool("huesort-run", WORKERS, null);
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch started = new CountDownLatch(WORKERS.size());
    List<String> names = new CopyOnWriteArrayList<>();
    List<Boolean> daemons = new CopyOnWriteArrayList<>();
    try {
      for (int i = 0; i < WORKERS.size(); i++) {
        pool.execute(() -> {
          names.add(Thread.currentThread().getName());
          daemons.add(Thread.currentThread().isDaemon());
          started.countDown();
          try {
            release.await();
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
          }
        });
      }
      assertTrue(started.await(5, TimeUnit.SECONDS));
      assertEquals(
          List.of("huesort-run-average", "huesort-run-convert", "huesort-run-discover",
              "huesort-run-extract", "huesort-run-insert"),
          names.stream().sorted().toList());
      assertFalse(daemons.contains(Boolean.TRUE));
      assertThrows(RejectedExecutionException.class, () -> pool.execute(() -> { }));
    } finally {
      release.countDown();
      pool.shutdown();
      assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }
  }

  @Test
  void crashedWorkerIsReportedAndReplacementIsNamedRespawn() throws Exception {
    AtomicReference<Throwable> crash = new AtomicReference<>();
    CountDownLatch crashed = new CountDownLatch(1);
    ExecutorService pool = ExecutorFactories.newStagePool("huesort-run", List.of("extract"), (thread, ex) -> {
      crash.set(ex);
      crashed.countDown();
    });
    try {
      AtomicReference<String> first = new AtomicReference<>();
      pool.execute(() -> {
        first.set(Thread.currentThread().getName());
        throw new IllegalStateException("boom");
      });
      assertTrue(crashed.await(5, TimeUnit.SECONDS));
      assertEquals("huesort-run-extract", first.get());
      assertSame(IllegalStateException.class, crash.get().getClass());

      AtomicReference<String> second = new AtomicReference<>();
      CountDownLatch ran = new CountDownLatch(1);
      executeWhenIdle(pool, () -> {
        second.set(Thread.currentThread().getName());
        ran.countDown();
      });
      assertTrue(ran.await(5, TimeUnit.SECONDS));
      assertEquals("huesort-run-respawn-0", second.get());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void labelsMustBeDistinctAndPresent() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newStagePool("x", List.of(), null));
    assertThrows(IllegalArgumentException.class,
        () -> ExecutorFactories.newStagePool("x", List.of("extract", "extract"), null));
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newStagePool("x", List.of(" "), null));
  }

  private static void executeWhenIdle(ExecutorService pool, Runnable task) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (true) {
      try {
        pool.execute(task);
        return;
      } catch (RejectedExecutionException busy) {
        if (System.nanoTime() > deadline) {
          throw busy;
        }
        Thread.sleep(10);
      }
    }
  }
}
