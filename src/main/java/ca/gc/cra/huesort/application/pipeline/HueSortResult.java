package ca.gc.cra.huesort.application.pipeline;

import ca.gc.cra.huesort.domain.image.WorkItem;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a completed run.
 *
 * @param ordering every discovered image in ascending hue, then path order
 * @param failedCount number of images flagged as failed
 * @param discoveryFailure exception that ended discovery early, if any
 * @param elapsed wall-clock duration of the run
 * @since 0.1.0
 */
public record HueSortResult(
    List<WorkItem> ordering,
    int failedCount,
    Optional<IOException> discoveryFailure,
    Duration elapsed) {

  /**
   * Copies the ordering defensively.
   */
  public HueSortResult {
    ordering = List.copyOf(ordering);
    discoveryFailure = discoveryFailure == null ? Optional.empty() : discoveryFailure;
  }
}
