package ca.gc.cra.huesort.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import org.junit.jupiter.api.Test;

class HueSortUseCaseTest {
  private static final PipelineSettings SETTINGS =
      new PipelineSettings(Duration.ofMillis(5), Duration.ofSeconds(2));

  @Test
  void runReturnsCompleteOrdering() throws Exception {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    HueSortUseCase useCase = new HueSortUseCase(
        () -> FakeImages.paths("blue.png", "red.png", "broken.png"),
        FakeImages.solid(Map.of("blue.png", FakeImages.AZURE, "red.png", FakeImages.ORANGE_RED)),
        metrics,
        SETTINGS,
        Duration.ofSeconds(20));

    HueSortResult result = useCase.run();

    assertEquals(
        List.of("broken.png", "red.png", "blue.png"),
        OrderedResultSetTest.paths(result.ordering()));
    assertEquals(1, result.failedCount());
    assertTrue(result.discoveryFailure().isEmpty());
    assertEquals(1, metrics.count("pipeline.run.completed"));
    assertEquals(1, metrics.observed("pipeline.run.durationMillis").size());
  }

  @Test
  void useCaseCanRunRepeatedly() throws Exception {
    HueSortUseCase useCase = new HueSortUseCase(
        () -> FakeImages.paths("red.png"),
        FakeImages.solid(Map.of("red.png", FakeImages.ORANGE_RED)),
        new RecordingMetricsPort(),
        SETTINGS,
        Duration.ZERO);

    assertEquals(1, useCase.run().ordering().size());
    assertEquals(1, useCase.run().ordering().size());
  }

  @Test
  void discoveryFailureIsReportedInResult() throws Exception {
    HueSortUseCase useCase = new HueSortUseCase(
        () -> {
          throw new IOException("permission denied");
        },
        FakeImages.solid(Map.of()),
        new RecordingMetricsPort(),
        SETTINGS,
        Duration.ofSeconds(20));

    HueSortResult result = useCase.run();

    assertTrue(result.ordering().isEmpty());
    assertEquals("permission denied", result.discoveryFailure().orElseThrow().getMessage());
  }

  @Test
  void timeoutRaisesWithProgress() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    HueSortUseCase useCase = new HueSortUseCase(
        () -> FakeImages.paths("slow.png"),
        FakeImages.blockingUntil(new CountDownLatch(1)),
        metrics,
        SETTINGS,
        Duration.ofMillis(150));

    PipelineTimeoutException ex = assertThrows(PipelineTimeoutException.class, useCase::run);

    assertEquals(1L, ex.progress().discovered());
    assertEquals(0, ex.progress().completed());
    assertEquals(1, metrics.count("pipeline.run.timeout"));
    assertEquals(1, metrics.count("pipeline.shutdown.incomplete"));
  }
}
