/**
 * OpenTelemetry metrics export for pipeline counters and latency observations.
 */
package ca.gc.cra.huesort.infrastructure.metrics;
