/**
 * The per-image work item and its ordering key.
 *
 * @since 0.1.0
 */
package ca.gc.cra.huesort.domain.image;
