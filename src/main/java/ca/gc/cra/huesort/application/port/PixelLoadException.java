package ca.gc.cra.huesort.application.port;

import java.nio.file.Path;

/**
 * Signals that a {@link PixelLoader} could not produce samples for an image.
 *
 * @since 0.1.0
 */
public class PixelLoadException extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient Path path;

  /**
   * Creates a load failure.
   *
   * @param path image that failed to load
   * @param message failure description
   */
  public PixelLoadException(Path path, String message) {
    super(message);
    this.path = path;
  }

  /**
   * Creates a load failure caused by another exception.
   *
   * @param path image that failed to load
   * @param message failure description
   * @param cause underlying cause
   */
  public PixelLoadException(Path path, String message, Throwable cause) {
    super(message, cause);
    this.path = path;
  }

  /**
   * Returns the image that failed to load.
   *
   * @return image path, possibly {@code null}
   */
  public Path path() {
    return path;
  }
}
