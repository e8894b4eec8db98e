package ca.gc.cra.huesort.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> Port enumerating the images of one processing run.
 * <p><strong>Role:</strong> Implemented by {@code DirectoryImageDiscovery}; tests supply fixed lists.</p>
 * <p><strong>Thread-safety:</strong> Invoked from the single discovery worker, exactly once per run.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ImageDiscovery {
  /**
   * Enumerates image paths.
   *
   * @return every image of the run, without duplicates
   * @throws IOException if enumeration fails
   */
  List<Path> discover() throws IOException;
}
