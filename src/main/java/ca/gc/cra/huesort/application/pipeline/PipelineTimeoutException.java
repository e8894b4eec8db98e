package ca.gc.cra.huesort.application.pipeline;

import java.time.Duration;

/**
 * Raised when a run does not complete within its configured completion timeout.
 *
 * @since 0.1.0
 */
public final class PipelineTimeoutException extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient PipelineProgress progress;

  /**
   * Creates the exception.
   *
   * @param timeout the timeout that expired
   * @param progress progress at the time the timeout expired
   */
  public PipelineTimeoutException(Duration timeout, PipelineProgress progress) {
    super("pipeline did not complete within " + timeout.toMillis() + " ms (" + progress.completed()
        + " of " + (progress.total().isPresent() ? progress.total().getAsLong() : "?")
        + " images ordered)");
    this.progress = progress;
  }

  public PipelineProgress progress() {
    return progress;
  }
}
