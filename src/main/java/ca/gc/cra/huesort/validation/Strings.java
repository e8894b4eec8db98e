package ca.gc.cra.huesort.validation;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through the CLI or YAML.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Normalize comma separated file extension lists.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private static final Pattern EXTENSION_PATTERN = Pattern.compile("^[a-z0-9]{1,10}$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Parses a comma separated list of file extensions such as {@code "png, .JPG,gif"}.
   *
   * @param name logical parameter name for diagnostics
   * @param value comma separated extensions; a leading dot per entry is tolerated
   * @return lower-cased extensions without dots, in declaration order
   * @throws IllegalArgumentException if the list is empty or an entry is not 1-10 letters or digits
   */
  public static Set<String> parseExtensions(String name, String value) {
    String text = requireNonBlank(name, value);
    Set<String> extensions = new LinkedHashSet<>();
    for (String token : text.split(",")) {
      String ext = token.trim().toLowerCase(Locale.ROOT);
      if (ext.startsWith(".")) {
        ext = ext.substring(1);
      }
      if (ext.isEmpty()) {
        continue;
      }
      if (!EXTENSION_PATTERN.matcher(ext).matches()) {
        throw new IllegalArgumentException(message(name, "contains invalid extension '" + token.trim() + "'"));
      }
      extensions.add(ext);
    }
    if (extensions.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must list at least one extension"));
    }
    return Set.copyOf(extensions);
  }

  static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
