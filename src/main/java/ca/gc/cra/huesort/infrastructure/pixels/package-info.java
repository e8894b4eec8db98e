/**
 * Pixel loading adapters backed by {@code javax.imageio}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.huesort.infrastructure.pixels;
