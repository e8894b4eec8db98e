package ca.gc.cra.huesort.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class HueSortConfigTest {
  @Test
  void defaultsProduceUnboundedRun() {
    HueSortConfig config = HueSortConfig.fromMap(withIn(DefaultsForMode.asFlatMap("sort")));

    assertEquals(Path.of("photos"), config.inputDirectory());
    assertTrue(config.outputFile().isEmpty());
    assertEquals(Set.of("png", "jpg", "jpeg", "bmp", "gif"), config.extensions());
    assertFalse(config.recursive());
    assertEquals(1, config.sampleStride());
    assertEquals(Duration.ofMillis(25), config.pollInterval());
    assertEquals(Duration.ZERO, config.completionTimeout());
    assertEquals(Duration.ofSeconds(5), config.shutdownTimeout());
    assertEquals("none", config.metrics().exporter());
  }

  @Test
  void parsesExplicitValues() {
    Map<String, String> map = withIn(DefaultsForMode.asFlatMap("sort"));
    map.put("out", "report.tsv");
    map.put("extensions", ".PNG, tiff");
    map.put("recursive", "yes");
    map.put("sampleStride", "4");
    map.put("completionTimeoutSeconds", "30");
    map.put("metricsExporter", "OTLP");
    map.put("otelEndpoint", "http://collector:4317");

    HueSortConfig config = HueSortConfig.fromMap(map);

    assertEquals(Path.of("report.tsv"), config.outputFile().orElseThrow());
    assertEquals(Set.of("png", "tiff"), config.extensions());
    assertTrue(config.recursive());
    assertEquals(4, config.sampleStride());
    assertEquals(Duration.ofSeconds(30), config.completionTimeout());
    assertEquals("otlp", config.metrics().exporter());
    assertEquals("http://collector:4317", config.metrics().endpoint());
  }

  @Test
  void missingInputIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> HueSortConfig.fromMap(DefaultsForMode.asFlatMap("sort")));
    assertTrue(ex.getMessage().startsWith("in "));
  }

  @Test
  void outOfRangeValuesNameTheKey() {
    assertRejected("sampleStride", "65");
    assertRejected("sampleStride", "0");
    assertRejected("pollMillis", "1001");
    assertRejected("shutdownTimeoutSeconds", "0");
    assertRejected("completionTimeoutSeconds", "-1");
    assertRejected("pollMillis", "fast");
    assertRejected("recursive", "maybe");
    assertRejected("metricsExporter", "prometheus");
    assertRejected("extensions", "png,../x");
  }

  private static void assertRejected(String key, String value) {
    Map<String, String> map = withIn(DefaultsForMode.asFlatMap("sort"));
    map.put(key, value);
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> HueSortConfig.fromMap(map), key + "=" + value);
    assertTrue(ex.getMessage().contains(key), ex.getMessage());
  }

  private static Map<String, String> withIn(Map<String, String> defaults) {
    Map<String, String> map = new HashMap<>(defaults);
    map.put("in", "photos");
    return map;
  }
}
