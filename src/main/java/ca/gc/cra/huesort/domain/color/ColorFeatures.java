package ca.gc.cra.huesort.domain.color;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Pure color feature functions used by the averaging and conversion stages.
 * <p><strong>Role:</strong> Domain service; holds no state.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> {@link #averageColor(List)} is a single O(n) pass; conversions are constant
 * time.</p>
 *
 * @since 0.1.0
 */
public final class ColorFeatures {
  private static final double CHANNEL_SCALE = 255d;
  private static final double DEGREES = 360d;
  private static final double SECTORS = 6d;

  private ColorFeatures() {
    // Utility
  }

  /**
   * Computes the per-channel arithmetic mean, truncated toward zero.
   *
   * @param samples pixel samples; must not be {@code null}
   * @return the average color
   * @throws EmptyInputException if {@code samples} is empty
   */
  public static ColorTriple averageColor(List<ColorTriple> samples) {
    Objects.requireNonNull(samples, "samples");
    if (samples.isEmpty()) {
      throw new EmptyInputException("cannot average zero color samples");
    }
    long r = 0;
    long g = 0;
    long b = 0;
    for (ColorTriple sample : samples) {
      r += sample.r();
      g += sample.g();
      b += sample.b();
    }
    int count = samples.size();
    return new ColorTriple((int) (r / count), (int) (g / count), (int) (b / count));
  }

  /**
   * Returns the hue of {@code color} in degrees.
   *
   * @param color color to convert; must not be {@code null}
   * @return hue in {@code [0, 360)}; {@code 0} for greys
   */
  public static double rgbToHsl(ColorTriple color) {
    return rgbToHslColor(color).hue();
  }

  /**
   * Converts an RGB color to HSL using the six-sector hue formula.
   *
   * @param color color to convert; must not be {@code null}
   * @return hue, saturation and lightness of {@code color}
   */
  public static HslColor rgbToHslColor(ColorTriple color) {
    Objects.requireNonNull(color, "color");
    double r = color.r() / CHANNEL_SCALE;
    double g = color.g() / CHANNEL_SCALE;
    double b = color.b() / CHANNEL_SCALE;

    double max = Math.max(Math.max(r, g), b);
    double min = Math.min(Math.min(r, g), b);
    double delta = max - min;
    double lightness = (max + min) / 2d;

    if (max == min) {
      return new HslColor(0d, 0d, lightness);
    }

    double sector;
    if (max == r) {
      sector = (g - b) / delta + (g < b ? 6d : 0d);
    } else if (max == g) {
      sector = (b - r) / delta + 2d;
    } else {
      sector = (r - g) / delta + 4d;
    }
    double hue = (sector / SECTORS) * DEGREES;
    if (hue >= DEGREES) {
      hue -= DEGREES;
    }

    double saturation = lightness > 0.5d
        ? delta / (2d - max - min)
        : delta / (max + min);
    return new HslColor(hue, saturation, lightness);
  }
}
