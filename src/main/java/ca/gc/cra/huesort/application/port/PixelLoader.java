package ca.gc.cra.huesort.application.port;

import ca.gc.cra.huesort.domain.color.ColorTriple;
import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> Port that decodes an image file into per-pixel color samples.
 * <p><strong>Role:</strong> Consumed by the extract stage; implemented by {@code ImageIoPixelLoader}.</p>
 * <p><strong>Thread-safety:</strong> Called from the extract worker thread only.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface PixelLoader {
  /**
   * Loads the pixel samples of {@code path}.
   *
   * @param path image location
   * @return samples in row-major order; never {@code null}
   * @throws PixelLoadException if the file is missing, unreadable, or cannot be decoded
   */
  List<ColorTriple> load(Path path) throws PixelLoadException;
}
