package ca.gc.cra.huesort.config;

import ca.gc.cra.huesort.application.pipeline.HueSortUseCase;
import ca.gc.cra.huesort.application.pipeline.PipelineSettings;
import ca.gc.cra.huesort.application.port.ImageDiscovery;
import ca.gc.cra.huesort.application.port.MetricsPort;
import ca.gc.cra.huesort.application.port.PixelLoader;
import ca.gc.cra.huesort.infrastructure.discovery.DirectoryImageDiscovery;
import ca.gc.cra.huesort.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.huesort.infrastructure.pixels.ImageIoPixelLoader;
import ca.gc.cra.huesort.infrastructure.report.OrderingReportWriter;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the hue sort use case to concrete adapters.
 * <p><strong>Why:</strong> Keeps configuration-to-adapter translation in one place so the CLI and tests share
 * the same graph.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build directory discovery and the ImageIO pixel loader from {@link HueSortConfig}.</li>
 *   <li>Own the OpenTelemetry metrics adapter and flush it on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @since 0.1.0
 * @see HueSortUseCase
 */
public final class CompositionRoot implements AutoCloseable {
  private final HueSortConfig config;
  private final OpenTelemetryMetricsAdapter metrics;

  /**
   * Creates a composition root, initializing metrics export according to {@code config}.
   *
   * @param config validated run configuration
   */
  public CompositionRoot(HueSortConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = new OpenTelemetryMetricsAdapter(config.metrics());
  }

  /**
   * Returns the shared metrics port.
   *
   * @return metrics adapter
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds the directory discovery adapter.
   *
   * @return discovery over the configured input directory
   */
  public ImageDiscovery imageDiscovery() {
    return new DirectoryImageDiscovery(config.inputDirectory(), config.extensions(), config.recursive());
  }

  /**
   * Builds the pixel loader.
   *
   * @return ImageIO loader with the configured sampling stride
   */
  public PixelLoader pixelLoader() {
    return new ImageIoPixelLoader(config.sampleStride());
  }

  /**
   * Builds the report writer.
   *
   * @return tab separated report writer
   */
  public OrderingReportWriter reportWriter() {
    return new OrderingReportWriter();
  }

  /**
   * Builds the synchronous use case for one run.
   *
   * @return use case wired to this root's adapters
   */
  public HueSortUseCase hueSortUseCase() {
    return new HueSortUseCase(
        imageDiscovery(),
        pixelLoader(),
        metrics,
        new PipelineSettings(config.pollInterval(), config.shutdownTimeout()),
        config.completionTimeout());
  }

  /**
   * Flushes and shuts down metrics export.
   */
  @Override
  public void close() {
    metrics.close();
  }
}
