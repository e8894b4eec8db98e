package ca.gc.cra.huesort.domain.color;

/**
 * Raised when a color aggregate is requested over zero samples.
 *
 * @since 0.1.0
 */
public final class EmptyInputException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception with a diagnostic message.
   *
   * @param message description of the empty input
   */
  public EmptyInputException(String message) {
    super(message);
  }
}
