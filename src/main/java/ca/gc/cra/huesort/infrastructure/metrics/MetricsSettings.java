package ca.gc.cra.huesort.infrastructure.metrics;

import java.util.Locale;

/**
 * Metrics exporter settings resolved from configuration.
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP endpoint; blank falls back to {@code OTEL_EXPORTER_OTLP_ENDPOINT} or the default
 * @param resourceAttributes comma-separated {@code key=value} resource attributes; may be blank
 * @since 0.1.0
 */
public record MetricsSettings(String exporter, String endpoint, String resourceAttributes) {
  /**
   * Normalizes blank and {@code null} values.
   */
  public MetricsSettings {
    exporter = exporter == null ? "" : exporter.trim().toLowerCase(Locale.ROOT);
    endpoint = endpoint == null ? "" : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /**
   * Settings that disable export.
   *
   * @return exporter {@code none}
   */
  public static MetricsSettings disabled() {
    return new MetricsSettings("none", "", "");
  }
}
