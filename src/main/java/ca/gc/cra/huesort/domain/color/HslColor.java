package ca.gc.cra.huesort.domain.color;

/**
 * HSL representation of a color.
 *
 * @param hue angle in degrees, {@code [0, 360)}
 * @param saturation fraction in {@code [0, 1]}
 * @param lightness fraction in {@code [0, 1]}
 * @since 0.1.0
 */
public record HslColor(double hue, double saturation, double lightness) {}
