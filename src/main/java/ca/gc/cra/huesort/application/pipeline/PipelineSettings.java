package ca.gc.cra.huesort.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Pipeline tuning parameters.
 *
 * @param pollInterval longest time an idle stage parks before re-checking the termination predicate
 * @param shutdownTimeout how long {@link PipelineController#close()} waits for workers to exit
 * @since 0.1.0
 */
public record PipelineSettings(Duration pollInterval, Duration shutdownTimeout) {
  private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(25);
  private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  /**
   * Normalizes settings, substituting defaults for missing or non-positive values.
   *
   * @param pollInterval requested poll interval
   * @param shutdownTimeout requested shutdown timeout
   */
  public PipelineSettings {
    pollInterval = positiveOrDefault(pollInterval, DEFAULT_POLL_INTERVAL);
    shutdownTimeout = positiveOrDefault(shutdownTimeout, DEFAULT_SHUTDOWN_TIMEOUT);
  }

  /**
   * Returns the default settings (25 ms poll, 5 s shutdown).
   *
   * @return default settings
   */
  public static PipelineSettings defaults() {
    return new PipelineSettings(DEFAULT_POLL_INTERVAL, DEFAULT_SHUTDOWN_TIMEOUT);
  }

  private static Duration positiveOrDefault(Duration value, Duration fallback) {
    Duration effective = Objects.requireNonNullElse(value, fallback);
    return effective.isNegative() || effective.isZero() ? fallback : effective;
  }
}
