package ca.gc.cra.huesort.config;

import ca.gc.cra.huesort.infrastructure.discovery.DirectoryImageDiscovery;
import ca.gc.cra.huesort.infrastructure.metrics.MetricsSettings;
import ca.gc.cra.huesort.validation.Numbers;
import ca.gc.cra.huesort.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Validated settings for one {@code sort} run.
 * <p><strong>Why:</strong> Converts the merged flat key/value map into typed values once, so adapters never
 * see raw strings.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param inputDirectory directory scanned for images
 * @param outputFile report destination; empty writes to standard output
 * @param extensions accepted file extensions, lower case without dots
 * @param recursive whether sub-directories are scanned
 * @param sampleStride pixel sampling stride in both axes
 * @param pollInterval idle wait of each stage loop
 * @param completionTimeout maximum run time; {@link Duration#ZERO} means unbounded
 * @param shutdownTimeout how long closing waits for workers to exit
 * @param metrics OpenTelemetry exporter settings
 * @since 0.1.0
 */
public record HueSortConfig(
    Path inputDirectory,
    Optional<Path> outputFile,
    Set<String> extensions,
    boolean recursive,
    int sampleStride,
    Duration pollInterval,
    Duration completionTimeout,
    Duration shutdownTimeout,
    MetricsSettings metrics) {

  static final int MAX_SAMPLE_STRIDE = 64;
  static final long MAX_POLL_MILLIS = 1_000;
  static final long MAX_COMPLETION_SECONDS = 86_400;
  static final long MAX_SHUTDOWN_SECONDS = 300;

  /**
   * Validates components.
   */
  public HueSortConfig {
    Objects.requireNonNull(inputDirectory, "inputDirectory");
    outputFile = outputFile == null ? Optional.empty() : outputFile;
    extensions = Set.copyOf(Objects.requireNonNull(extensions, "extensions"));
    Numbers.requireRange("sampleStride", sampleStride, 1, MAX_SAMPLE_STRIDE);
    Objects.requireNonNull(pollInterval, "pollInterval");
    Objects.requireNonNull(completionTimeout, "completionTimeout");
    Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    metrics = metrics == null ? MetricsSettings.disabled() : metrics;
  }

  /**
   * Builds a configuration from a merged flat map.
   *
   * @param map merged key/value settings; see {@link DefaultsForMode#asFlatMap(String)} for the keys
   * @return validated configuration
   * @throws IllegalArgumentException when a key is missing or out of range; the message names the key
   */
  public static HueSortConfig fromMap(Map<String, String> map) {
    Objects.requireNonNull(map, "map");
    String in = map.getOrDefault("in", "");
    if (in.isBlank()) {
      throw new IllegalArgumentException("in is required (directory of images to order)");
    }
    Path input = Path.of(Strings.requireNonBlank("in", in));
    String out = map.getOrDefault("out", "").trim();
    Optional<Path> output = out.isEmpty()
        ? Optional.empty()
        : Optional.of(Path.of(Strings.requireNonBlank("out", out)));

    String rawExtensions = map.getOrDefault("extensions", "");
    Set<String> extensions = rawExtensions.isBlank()
        ? DirectoryImageDiscovery.DEFAULT_EXTENSIONS
        : Strings.parseExtensions("extensions", rawExtensions);

    boolean recursive = parseBoolean("recursive", map.get("recursive"), false);
    int stride = (int) longValue(map, "sampleStride", 1, 1, MAX_SAMPLE_STRIDE);
    long pollMillis = longValue(map, "pollMillis", 25, 1, MAX_POLL_MILLIS);
    long completionSeconds = longValue(map, "completionTimeoutSeconds", 0, 0, MAX_COMPLETION_SECONDS);
    long shutdownSeconds = longValue(map, "shutdownTimeoutSeconds", 5, 1, MAX_SHUTDOWN_SECONDS);

    String exporter = map.getOrDefault("metricsExporter", "none").trim().toLowerCase(Locale.ROOT);
    if (!exporter.equals("none") && !exporter.equals("otlp")) {
      throw new IllegalArgumentException("metricsExporter must be otlp or none (was '" + exporter + "')");
    }
    MetricsSettings metrics = new MetricsSettings(
        exporter, map.get("otelEndpoint"), map.get("otelResourceAttributes"));

    return new HueSortConfig(
        input,
        output,
        extensions,
        recursive,
        stride,
        Duration.ofMillis(pollMillis),
        Duration.ofSeconds(completionSeconds),
        Duration.ofSeconds(shutdownSeconds),
        metrics);
  }

  private static long longValue(Map<String, String> map, String key, long defaultValue, long min, long max) {
    String raw = map.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return Numbers.parseInRange(key, raw, min, max);
  }

  private static boolean parseBoolean(String key, String raw, boolean defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + raw + "')");
    };
  }
}
