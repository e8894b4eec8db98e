package ca.gc.cra.huesort.api;

/**
 * <strong>What:</strong> Canonical exit codes returned by the huesort command line.
 * <p><strong>Why:</strong> Gives scripts a stable process status for each failure class.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Every discovered image was ordered and the report written. */
  SUCCESS(0),
  /** Command-line arguments or configuration values were invalid. */
  INVALID_ARGS(2),
  /** Discovery ended early or the report could not be written. */
  IO_ERROR(3),
  /** Configuration was rejected while wiring adapters. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** The completion timeout expired before every image was ordered. */
  TIMEOUT(124),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
