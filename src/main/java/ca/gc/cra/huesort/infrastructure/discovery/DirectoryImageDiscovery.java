package ca.gc.cra.huesort.infrastructure.discovery;

import ca.gc.cra.huesort.application.port.ImageDiscovery;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Enumerates image files in a directory.
 * <p>Regular files whose extension is in the allow-list are returned in sorted path order; an empty allow-list
 * accepts every regular file. Sub-directories are descended only when {@code recursive} is set.</p>
 * <p><strong>Thread-safety:</strong> Immutable; each call walks the filesystem afresh.</p>
 *
 * @since 0.1.0
 */
public final class DirectoryImageDiscovery implements ImageDiscovery {
  private static final Logger log = LoggerFactory.getLogger(DirectoryImageDiscovery.class);

  /** Extensions accepted when none are configured explicitly. */
  public static final Set<String> DEFAULT_EXTENSIONS = Set.of("png", "jpg", "jpeg", "bmp", "gif");

  private final Path directory;
  private final Set<String> extensions;
  private final boolean recursive;

  /**
   * Creates a discovery over {@code directory}.
   *
   * @param directory directory to enumerate
   * @param extensions case-insensitive extensions without the dot; empty accepts every file
   * @param recursive whether to descend into sub-directories
   */
  public DirectoryImageDiscovery(Path directory, Set<String> extensions, boolean recursive) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.extensions = Objects.requireNonNull(extensions, "extensions").stream()
        .map(ext -> ext.trim().toLowerCase(Locale.ROOT))
        .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
        .filter(ext -> !ext.isEmpty())
        .collect(Collectors.toUnmodifiableSet());
    this.recursive = recursive;
  }

  @Override
  public List<Path> discover() throws IOException {
    if (!Files.isDirectory(directory)) {
      throw new IOException("image directory does not exist: " + directory);
    }
    List<Path> found = new ArrayList<>();
    try (Stream<Path> entries = recursive ? Files.walk(directory) : Files.list(directory)) {
      entries
          .filter(Files::isRegularFile)
          .filter(this::accepts)
          .sorted()
          .forEach(found::add);
    } catch (UncheckedIOException ex) {
      throw ex.getCause();
    }
    log.debug("Discovered {} images under {} (recursive={})", found.size(), directory, recursive);
    return found;
  }

  boolean accepts(Path file) {
    if (extensions.isEmpty()) {
      return true;
    }
    Path name = file.getFileName();
    if (name == null) {
      return false;
    }
    String fileName = name.toString();
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return false;
    }
    return extensions.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
  }
}
