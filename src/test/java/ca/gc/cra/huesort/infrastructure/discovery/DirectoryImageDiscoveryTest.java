package ca.gc.cra.huesort.infrastructure.discovery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectoryImageDiscoveryTest {
  @TempDir Path dir;

  @Test
  void listsMatchingFilesInSortedOrder() throws IOException {
    touch(dir.resolve("c.png"));
    touch(dir.resolve("A.JPG"));
    touch(dir.resolve("b.gif"));
    touch(dir.resolve("notes.txt"));
    Files.createDirectories(dir.resolve("nested.png"));

    List<Path> found =
        new DirectoryImageDiscovery(dir, DirectoryImageDiscovery.DEFAULT_EXTENSIONS, false).discover();

    assertEquals(List.of(dir.resolve("A.JPG"), dir.resolve("b.gif"), dir.resolve("c.png")), found);
  }

  @Test
  void recursionIsOptIn() throws IOException {
    touch(dir.resolve("top.png"));
    Path sub = Files.createDirectories(dir.resolve("sub"));
    touch(sub.resolve("deep.png"));

    assertEquals(List.of(dir.resolve("top.png")),
        new DirectoryImageDiscovery(dir, Set.of("png"), false).discover());
    assertEquals(List.of(sub.resolve("deep.png"), dir.resolve("top.png")),
        new DirectoryImageDiscovery(dir, Set.of("png"), true).discover());
  }

  @Test
  void extensionsAreNormalized() {
    DirectoryImageDiscovery discovery = new DirectoryImageDiscovery(dir, Set.of(".PNG", " bmp "), false);
    assertTrue(discovery.accepts(dir.resolve("x.png")));
    assertTrue(discovery.accepts(dir.resolve("x.Bmp")));
    assertFalse(discovery.accepts(dir.resolve("x.jpg")));
    assertFalse(discovery.accepts(dir.resolve("png")));
  }

  @Test
  void emptyAllowListAcceptsEveryRegularFile() throws IOException {
    touch(dir.resolve("raw.data"));
    touch(dir.resolve("README"));
    assertEquals(2, new DirectoryImageDiscovery(dir, Set.of(), false).discover().size());
  }

  @Test
  void missingDirectoryRaisesIoException() {
    DirectoryImageDiscovery discovery =
        new DirectoryImageDiscovery(dir.resolve("absent"), Set.of("png"), false);
    assertThrows(IOException.class, discovery::discover);
  }

  private static void touch(Path file) throws IOException {
    Files.write(file, new byte[] {1});
  }
}
