package ca.gc.cra.huesort.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for the CLI.
 * <p><strong>Why:</strong> Fails fast on a missing input directory or an output file that would be silently
 * overwritten, before any worker thread starts.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize user-provided paths to real, canonical locations.</li>
 *   <li>Guard against overwriting an existing report unless explicitly approved.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless methods; filesystem state may change between checks.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a readable input directory.
   *
   * @param path candidate directory; must not be {@code null}
   * @return real path of the directory
   * @throws IllegalArgumentException if the directory is missing, not a directory, or unreadable
   */
  public static Path validateReadableDir(Path path) {
    Path normalized = normalize(path);
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("input directory does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("input directory is not readable: " + normalized);
    }
    try {
      return normalized.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to resolve directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates the target of a report file, optionally creating missing parent directories.
   *
   * @param path candidate file; must not be {@code null}
   * @param createParents whether to create the parent directories when absent
   * @param allowOverwrite when {@code false}, an existing file is rejected
   * @return absolute normalized file path
   * @throws IllegalArgumentException if the file exists without approval, is a directory, or the parent is unusable
   */
  public static Path validateWritableFile(Path path, boolean createParents, boolean allowOverwrite) {
    Path normalized = normalize(path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("output path is a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
      if (!allowOverwrite) {
        throw new IllegalArgumentException(
            "output file " + normalized + " already exists; re-run with --allow-overwrite to replace it");
      }
      if (!Files.isWritable(normalized)) {
        throw new IllegalArgumentException("output file is not writable: " + normalized);
      }
      return normalized;
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException("path has no parent to validate: " + normalized);
    }
    try {
      if (!Files.exists(parent)) {
        if (!createParents) {
          throw new IllegalArgumentException("parent directory does not exist: " + parent);
        }
        Files.createDirectories(parent);
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to create directory " + parent + ": " + ex.getMessage(), ex);
    }
    if (!Files.isDirectory(parent)) {
      throw new IllegalArgumentException("parent is not a directory: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException("parent directory is not writable: " + parent);
    }
    return normalized;
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    if (Strings.containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }
}
