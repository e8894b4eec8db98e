/**
 * Filesystem adapters that enumerate the images of a run.
 *
 * @since 0.1.0
 */
package ca.gc.cra.huesort.infrastructure.discovery;
