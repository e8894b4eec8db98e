/**
 * Color value types and the pure feature functions (averaging, RGB to HSL) applied by the pipeline stages.
 *
 * @since 0.1.0
 */
package ca.gc.cra.huesort.domain.color;
