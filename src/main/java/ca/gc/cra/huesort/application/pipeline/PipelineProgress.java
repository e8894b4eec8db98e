package ca.gc.cra.huesort.application.pipeline;

import java.util.OptionalLong;

/**
 * Point-in-time view of a run for progress reporting.
 *
 * @param discovered images submitted by discovery so far
 * @param total finalized image total, empty while discovery is running
 * @param completed entries in the result set
 * @param failed failed entries in the result set
 * @param extractDepth items waiting for extraction
 * @param averageDepth items waiting for averaging
 * @param convertDepth items waiting for conversion
 * @param insertDepth items waiting for insertion
 * @since 0.1.0
 */
public record PipelineProgress(
    long discovered,
    OptionalLong total,
    int completed,
    int failed,
    int extractDepth,
    int averageDepth,
    int convertDepth,
    int insertDepth) {

  /**
   * Indicates whether every discovered image has been inserted.
   *
   * @return {@code true} when the total is known and reached
   */
  public boolean complete() {
    return total.isPresent() && completed == total.getAsLong();
  }
}
