package ca.gc.cra.huesort.domain.color;

/**
 * <strong>What:</strong> Immutable 8-bit RGB color sample.
 * <p><strong>Why:</strong> Gives pixel loaders and the averaging stage one validated value type instead of
 * loose integer arrays.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent sharing.</p>
 *
 * @param r red channel in {@code [0, 255]}
 * @param g green channel in {@code [0, 255]}
 * @param b blue channel in {@code [0, 255]}
 * @since 0.1.0
 */
public record ColorTriple(int r, int g, int b) {
  /** Largest value a channel may hold. */
  public static final int MAX_CHANNEL = 255;

  /**
   * Validates that every channel lies within {@code [0, 255]}.
   *
   * @throws IllegalArgumentException if a channel is out of range
   */
  public ColorTriple {
    requireChannel("r", r);
    requireChannel("g", g);
    requireChannel("b", b);
  }

  /**
   * Unpacks a packed {@code 0xAARRGGBB} value as returned by {@code BufferedImage#getRGB}.
   * Alpha is ignored.
   *
   * @param argb packed pixel
   * @return color triple holding the RGB channels
   */
  public static ColorTriple fromArgb(int argb) {
    return new ColorTriple((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF);
  }

  private static void requireChannel(String name, int value) {
    if (value < 0 || value > MAX_CHANNEL) {
      throw new IllegalArgumentException(
          "channel " + name + " must be between 0 and " + MAX_CHANNEL + " (was " + value + ")");
    }
  }
}
