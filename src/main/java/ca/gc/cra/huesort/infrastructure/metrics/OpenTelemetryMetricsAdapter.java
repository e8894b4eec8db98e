package ca.gc.cra.huesort.infrastructure.metrics;

import ca.gc.cra.huesort.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} that forwards pipeline counters and observations to OpenTelemetry.
 * <p><strong>Why:</strong> Stage throughput, failures and latencies become exportable over OTLP.</p>
 * <p><strong>Thread-safety:</strong> Instruments are cached in concurrent maps; safe for all stage threads.</p>
 * <p><strong>Observability:</strong> Every data point carries a {@code huesort.metric.key} attribute with the
 * unsanitized key.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("huesort.metric.key");
  private static final String FALLBACK_METRIC_NAME = "huesort.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final MetricsPort delegate;

  /**
   * Creates an adapter for the given exporter settings.
   *
   * @param settings exporter settings; {@code none} yields an adapter that drops everything
   */
  public OpenTelemetryMetricsAdapter(MetricsSettings settings) {
    this(OpenTelemetryBootstrap.initialize(settings));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    if (bootstrap.isNoop()) {
      log.debug("OpenTelemetry metrics adapter running in noop mode");
      this.delegate = MetricsPort.NO_OP;
    } else {
      this.delegate = new Instruments(bootstrap.meter());
    }
  }

  @Override
  public void increment(String key) {
    delegate.increment(Objects.requireNonNull(key, "key"));
  }

  @Override
  public void observe(String key, long value) {
    delegate.observe(Objects.requireNonNull(key, "key"), value);
  }

  /**
   * Reports whether metrics are being dropped.
   *
   * @return {@code true} when no exporter is active
   */
  public boolean isNoop() {
    return bootstrap.isNoop();
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /**
   * Flushes pending metrics and shuts the meter provider down.
   */
  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      boolean allowed = Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
      result.append(allowed ? c : '_');
    }
    return result.toString();
  }

  private static final class Instruments implements MetricsPort {
    private final Meter meter;
    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

    private Instruments(Meter meter) {
      this.meter = Objects.requireNonNull(meter, "meter");
    }

    @Override
    public void increment(String key) {
      Counter counter = counters.computeIfAbsent(key, this::createCounter);
      counter.instrument().add(1, counter.attributes());
    }

    @Override
    public void observe(String key, long value) {
      Histogram histogram = histograms.computeIfAbsent(key, this::createHistogram);
      histogram.instrument().record(value, histogram.attributes());
    }

    private Counter createCounter(String key) {
      String name = sanitizeName(key);
      if (!name.equals(key)) {
        log.debug("Sanitized counter name '{}' -> '{}'", key, name);
      }
      LongCounter counter = meter.counterBuilder(name)
          .setUnit("1")
          .setDescription("huesort counter for " + key)
          .build();
      return new Counter(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }

    private Histogram createHistogram(String key) {
      String name = sanitizeName(key);
      if (!name.equals(key)) {
        log.debug("Sanitized histogram name '{}' -> '{}'", key, name);
      }
      LongHistogram histogram = meter.histogramBuilder(name)
          .ofLongs()
          .setDescription("huesort observation for " + key)
          .build();
      return new Histogram(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}
