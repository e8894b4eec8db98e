/**
 * <strong>Purpose:</strong> Ports consumed by the hue pipeline: image discovery, pixel loading, and metrics.
 * <p><strong>Pipeline role:</strong> Keep the concurrent core independent of filesystem, codec, and telemetry
 * adapters.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.huesort.application.port;
