package ca.gc.cra.huesort.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Set;
import org.junit.jupiter.api.Test;

class StringsTest {
  @Test
  void requireNonBlankTrims() {
    assertEquals("photos", Strings.requireNonBlank("in", "  photos "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("in", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("in", "a\tb"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("in", null));
  }

  @Test
  void parseExtensionsNormalizesAndDeduplicates() {
    assertEquals(Set.of("png", "jpg"), Strings.parseExtensions("extensions", "PNG, .jpg,png,,"));
  }

  @Test
  void parseExtensionsRejectsOddEntries() {
    assertThrows(IllegalArgumentException.class, () -> Strings.parseExtensions("extensions", ",,"));
    assertThrows(IllegalArgumentException.class, () -> Strings.parseExtensions("extensions", "p*g"));
    assertThrows(IllegalArgumentException.class, () -> Strings.parseExtensions("extensions", "averyverylongext"));
  }

  @Test
  void numbersParseWithinRange() {
    assertEquals(8L, Numbers.parseInRange("sampleStride", " 8 ", 1, 64));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseInRange("sampleStride", "eight", 1, 64));
    assertEquals("sampleStride must be an integer (was 'eight')", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("pollMillis", 0, 1, 1000));
  }
}
