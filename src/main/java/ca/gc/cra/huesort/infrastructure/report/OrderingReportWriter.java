package ca.gc.cra.huesort.infrastructure.report;

import ca.gc.cra.huesort.domain.image.WorkItem;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes a final ordering as tab-separated lines.
 * <p>Each line is {@code path<TAB>hue} with the hue to three decimals; failed images print
 * {@code path<TAB>FAILED<TAB>reason}.</p>
 *
 * @since 0.1.0
 */
public final class OrderingReportWriter {

  /**
   * Writes {@code ordering} to {@code out}.
   *
   * @param ordering ordered items
   * @param out destination; not closed
   * @throws IOException if writing fails
   */
  public void write(List<WorkItem> ordering, Writer out) throws IOException {
    Objects.requireNonNull(ordering, "ordering");
    Objects.requireNonNull(out, "out");
    for (WorkItem item : ordering) {
      out.write(formatLine(item));
      out.write(System.lineSeparator());
    }
    out.flush();
  }

  /**
   * Writes {@code ordering} to {@code file}, replacing any existing content.
   *
   * @param ordering ordered items
   * @param file destination file
   * @throws IOException if the file cannot be written
   */
  public void write(List<WorkItem> ordering, Path file) throws IOException {
    try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
      write(ordering, out);
    }
  }

  static String formatLine(WorkItem item) {
    if (item.failed()) {
      return item.path() + "\tFAILED\t" + item.failure().orElse("");
    }
    return item.path() + "\t" + String.format(Locale.ROOT, "%.3f", item.hue());
  }
}
