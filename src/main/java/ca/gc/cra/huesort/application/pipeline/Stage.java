package ca.gc.cra.huesort.application.pipeline;

import java.util.Locale;

/**
 * The four transform stages, in pipeline order.
 *
 * @since 0.1.0
 */
public enum Stage {
  /** Loads pixel samples for the item's path. */
  EXTRACT,
  /** Averages the samples into one color. */
  AVERAGE,
  /** Converts the average color to a hue. */
  CONVERT,
  /** Inserts the item into the ordered result set. */
  INSERT;

  /**
   * Lowercase name used for thread names, MDC values and metric keys.
   *
   * @return label such as {@code extract}
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  String metricKey(String suffix) {
    return "pipeline." + label() + "." + suffix;
  }
}
