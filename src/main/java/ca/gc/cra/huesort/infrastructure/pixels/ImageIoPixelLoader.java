package ca.gc.cra.huesort.infrastructure.pixels;

import ca.gc.cra.huesort.application.port.PixelLoadException;
import ca.gc.cra.huesort.application.port.PixelLoader;
import ca.gc.cra.huesort.domain.color.ColorTriple;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;

/**
 * <strong>What:</strong> Decodes images with {@link ImageIO} and emits one color sample per pixel.
 * <p>Samples are produced in row-major order. With a {@code sampleStride} above one, only every
 * {@code sampleStride}-th pixel of every {@code sampleStride}-th row is kept, which bounds memory for large
 * images at the cost of an approximate average.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable configuration.</p>
 *
 * @since 0.1.0
 */
public final class ImageIoPixelLoader implements PixelLoader {
  private static final long MAX_INITIAL_CAPACITY = 1L << 24;

  private final int sampleStride;

  /** Creates a loader that samples every pixel. */
  public ImageIoPixelLoader() {
    this(1);
  }

  /**
   * Creates a loader with the given sampling stride.
   *
   * @param sampleStride distance between sampled pixels in both axes; must be positive
   */
  public ImageIoPixelLoader(int sampleStride) {
    if (sampleStride <= 0) {
      throw new IllegalArgumentException("sampleStride must be positive (was " + sampleStride + ")");
    }
    this.sampleStride = sampleStride;
  }

  @Override
  public List<ColorTriple> load(Path path) throws PixelLoadException {
    if (!Files.isRegularFile(path)) {
      throw new PixelLoadException(path, "not a readable file: " + path);
    }
    BufferedImage image;
    try {
      image = ImageIO.read(path.toFile());
    } catch (IOException | RuntimeException ex) {
      throw new PixelLoadException(path, "unable to decode " + path + ": " + ex.getMessage(), ex);
    }
    if (image == null) {
      throw new PixelLoadException(path, "no image decoder for " + path);
    }

    int width = image.getWidth();
    int height = image.getHeight();
    long expected = (long) ceilDiv(width, sampleStride) * ceilDiv(height, sampleStride);
    List<ColorTriple> samples = new ArrayList<>((int) Math.min(expected, MAX_INITIAL_CAPACITY));
    for (int y = 0; y < height; y += sampleStride) {
      for (int x = 0; x < width; x += sampleStride) {
        samples.add(ColorTriple.fromArgb(image.getRGB(x, y)));
      }
    }
    // immutable so WorkItem adopts it without a second copy
    return List.copyOf(samples);
  }

  private static int ceilDiv(int value, int divisor) {
    return (value + divisor - 1) / divisor;
  }
}
