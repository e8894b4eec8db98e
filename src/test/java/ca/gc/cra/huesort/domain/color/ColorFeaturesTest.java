package ca.gc.cra.huesort.domain.color;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class ColorFeaturesTest {
  private static final double EPSILON = 1e-9;

  @Test
  void primaryAndSecondaryColorsMapToSectorBoundaries() {
    assertEquals(0d, ColorFeatures.rgbToHsl(new ColorTriple(255, 0, 0)), EPSILON);
    assertEquals(60d, ColorFeatures.rgbToHsl(new ColorTriple(255, 255, 0)), EPSILON);
    assertEquals(120d, ColorFeatures.rgbToHsl(new ColorTriple(0, 255, 0)), EPSILON);
    assertEquals(180d, ColorFeatures.rgbToHsl(new ColorTriple(0, 255, 255)), EPSILON);
    assertEquals(240d, ColorFeatures.rgbToHsl(new ColorTriple(0, 0, 255)), EPSILON);
    assertEquals(300d, ColorFeatures.rgbToHsl(new ColorTriple(255, 0, 255)), EPSILON);
  }

  @Test
  void greysHaveZeroHueAndSaturation() {
    for (int v = 0; v <= 255; v += 17) {
      HslColor hsl = ColorFeatures.rgbToHslColor(new ColorTriple(v, v, v));
      assertEquals(0d, hsl.hue(), EPSILON, "grey " + v);
      assertEquals(0d, hsl.saturation(), EPSILON, "grey " + v);
      assertEquals(v / 255d, hsl.lightness(), EPSILON, "grey " + v);
    }
  }

  @Test
  void redWithTraceOfBlueStaysBelow360() {
    double hue = ColorFeatures.rgbToHsl(new ColorTriple(255, 0, 1));
    assertTrue(hue > 359d && hue < 360d, "hue was " + hue);
  }

  @Test
  void hueIsAlwaysWithinHalfOpenRange() {
    for (int r = 0; r <= 255; r += 15) {
      for (int g = 0; g <= 255; g += 15) {
        for (int b = 0; b <= 255; b += 15) {
          double hue = ColorFeatures.rgbToHsl(new ColorTriple(r, g, b));
          assertTrue(hue >= 0d && hue < 360d, "hue " + hue + " for " + r + "," + g + "," + b);
        }
      }
    }
  }

  @Test
  void saturationAndLightnessFollowHslFormula() {
    HslColor red = ColorFeatures.rgbToHslColor(new ColorTriple(255, 0, 0));
    assertEquals(1d, red.saturation(), EPSILON);
    assertEquals(0.5d, red.lightness(), EPSILON);

    HslColor pale = ColorFeatures.rgbToHslColor(new ColorTriple(255, 204, 204));
    assertEquals(0d, pale.hue(), EPSILON);
    assertEquals((1d + 0.8d) / 2d, pale.lightness(), EPSILON);
    assertEquals(0.2d / (2d - 1d - 0.8d), pale.saturation(), 1e-6);
  }

  @Test
  void averageTruncatesPerChannelMeans() {
    ColorTriple avg = ColorFeatures.averageColor(List.of(
        new ColorTriple(1, 10, 0),
        new ColorTriple(2, 20, 255)));
    assertEquals(new ColorTriple(1, 15, 127), avg);
  }

  @Test
  void averageOfSingleSampleIsThatSample() {
    ColorTriple only = new ColorTriple(12, 34, 56);
    assertEquals(only, ColorFeatures.averageColor(List.of(only)));
  }

  @Test
  void averageStaysWithinChannelBounds() {
    List<ColorTriple> samples = new ArrayList<>();
    for (int i = 0; i < 500; i++) {
      samples.add(new ColorTriple((i * 7) % 256, (i * 13) % 200 + 10, 100));
    }
    ColorTriple avg = ColorFeatures.averageColor(samples);
    int minG = samples.stream().mapToInt(ColorTriple::g).min().orElseThrow();
    int maxG = samples.stream().mapToInt(ColorTriple::g).max().orElseThrow();
    assertTrue(avg.g() >= minG && avg.g() <= maxG);
    assertEquals(100, avg.b());
  }

  @Test
  void averageHandlesSampleCountsThatWouldOverflowIntSums() {
    List<ColorTriple> samples = Collections.nCopies(10_000_000, new ColorTriple(255, 255, 255));
    assertEquals(new ColorTriple(255, 255, 255), ColorFeatures.averageColor(samples));
  }

  @Test
  void averageOfNothingIsRejected() {
    EmptyInputException ex = assertThrows(EmptyInputException.class, () -> ColorFeatures.averageColor(List.of()));
    assertTrue(ex.getMessage().contains("zero"));
  }
}
