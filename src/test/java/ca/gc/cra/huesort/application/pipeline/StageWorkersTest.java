package ca.gc.cra.huesort.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.huesort.domain.color.ColorTriple;
import ca.gc.cra.huesort.domain.image.WorkItem;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StageWorkersTest {
  @Test
  void extractStoresSamples() {
    WorkItem item = new WorkItem(Path.of("a.png"));
    StageWorkers.extract(item, FakeImages.solid(Map.of("a.png", FakeImages.AZURE)));
    assertEquals(3, item.samples().size());
    assertFalse(item.failed());
  }

  @Test
  void extractFlagsLoadFailure() {
    WorkItem item = new WorkItem(Path.of("missing.png"));
    StageWorkers.extract(item, FakeImages.solid(Map.of()));
    assertTrue(item.failed());
    assertTrue(item.failure().orElseThrow().startsWith("load failed:"));
  }

  @Test
  void extractFlagsImageWithoutPixels() {
    WorkItem item = new WorkItem(Path.of("empty.png"));
    StageWorkers.extract(item, path -> List.of());
    assertTrue(item.failed());
  }

  @Test
  void averageAndConvertProduceHue() {
    WorkItem item = new WorkItem(Path.of("a.png"));
    item.samples(List.of(new ColorTriple(0, 0, 255), new ColorTriple(0, 0, 255)));
    StageWorkers.average(item);
    StageWorkers.convert(item);
    assertEquals(240d, item.hue(), 1e-9);
  }

  @Test
  void averageOfNoSamplesFlagsItem() {
    WorkItem item = new WorkItem(Path.of("a.png"));
    StageWorkers.average(item);
    assertTrue(item.failed());
  }

  @Test
  void failedItemsPassThroughAverageAndConvert() {
    WorkItem item = new WorkItem(Path.of("a.png"));
    item.markFailed("load failed");
    StageWorkers.average(item);
    StageWorkers.convert(item);
    assertEquals(WorkItem.FAILED_HUE, item.hue());
    assertEquals("load failed", item.failure().orElseThrow());
  }

  @Test
  void convertWithoutAverageIsAnError() {
    WorkItem item = new WorkItem(Path.of("a.png"));
    assertThrows(IllegalStateException.class, () -> StageWorkers.convert(item));
  }

  @Test
  void prepareInsertFlagsItemsWithoutHue() {
    WorkItem item = new WorkItem(Path.of("a.png"));
    StageWorkers.prepareInsert(item);
    assertTrue(item.failed());
    assertTrue(item.hasHue());
  }

  @Test
  void createBuildsOneWorkerPerStageInOrder() {
    List<StageWorker> workers = StageWorkers.create(
        new PipelineState(), FakeImages.solid(Map.of()), new RecordingMetricsPort(), Duration.ofMillis(5));
    assertEquals(List.of(Stage.EXTRACT, Stage.AVERAGE, Stage.CONVERT, Stage.INSERT),
        workers.stream().map(StageWorker::stage).toList());
  }
}
