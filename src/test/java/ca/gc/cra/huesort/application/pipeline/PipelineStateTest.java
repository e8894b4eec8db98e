package ca.gc.cra.huesort.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.huesort.domain.image.WorkItem;
import java.nio.file.Path;
import java.time.Duration;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class PipelineStateTest {
  @Test
  void totalIsUnknownUntilFinalized() {
    PipelineState state = new PipelineState();
    state.submitDiscovered(new WorkItem(Path.of("a.png")));

    assertEquals(OptionalLong.empty(), state.totalImageCount());
    assertFalse(state.isComplete());
    assertEquals(1, state.inputOf(Stage.EXTRACT).count());

    assertEquals(1L, state.finalizeTotal());
    assertEquals(OptionalLong.of(1L), state.totalImageCount());
  }

  @Test
  void emptyRunCompletesOnFinalize() throws InterruptedException {
    PipelineState state = new PipelineState();
    assertEquals(0L, state.finalizeTotal());
    assertTrue(state.isComplete());
    assertTrue(state.awaitCompletion(Duration.ZERO));
  }

  @Test
  void finalizeTwiceIsRejected() {
    PipelineState state = new PipelineState();
    state.finalizeTotal();
    assertThrows(IllegalStateException.class, state::finalizeTotal);
  }

  @Test
  void submitAfterFinalizeIsRejected() {
    PipelineState state = new PipelineState();
    state.finalizeTotal();
    assertThrows(IllegalStateException.class, () -> state.submitDiscovered(new WorkItem(Path.of("late.png"))));
  }

  @Test
  void insertOfLastItemReleasesBarrier() throws InterruptedException {
    PipelineState state = new PipelineState();
    state.submitDiscovered(new WorkItem(Path.of("a.png")));
    state.finalizeTotal();
    assertFalse(state.signalIfComplete());
    assertFalse(state.awaitCompletion(Duration.ofMillis(5)));

    state.results().insert(OrderedResultSetTest.item("a.png", 12d));
    assertTrue(state.signalIfComplete());
    assertTrue(state.awaitCompletion(Duration.ZERO));
  }

  @Test
  void completionRequiresFinalizedTotal() {
    PipelineState state = new PipelineState();
    state.results().insert(OrderedResultSetTest.item("a.png", 12d));
    assertFalse(state.isComplete());
    assertFalse(state.signalIfComplete());
  }

  @Test
  void eachStageOwnsItsPile() {
    PipelineState state = new PipelineState();
    assertEquals("extract", state.inputOf(Stage.EXTRACT).name());
    assertEquals("average", state.inputOf(Stage.AVERAGE).name());
    assertEquals("convert", state.inputOf(Stage.CONVERT).name());
    assertEquals("insert", state.inputOf(Stage.INSERT).name());
    assertEquals(4, state.piles().size());
  }
}
