package ca.gc.cra.logship.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("workers", 10, 1, 64));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 0, 1, 64));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 65, 1, 64));
  }

  @Test
  void parseIntTrimsAndValidates() {
    assertEquals(8192, Numbers.parseInt("bufferLimit", " 8192 ", 1, Integer.MAX_VALUE));
  }

  @Test
  void parseIntRejectsNonNumericInput() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> Numbers.parseInt("port", "24224x", 1, 65535));
    assertEquals("port must be an integer (was 24224x)", ex.getMessage());
  }

  @Test
  void parseIntRejectsNull() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("port", null, 1, 65535));
  }
}
