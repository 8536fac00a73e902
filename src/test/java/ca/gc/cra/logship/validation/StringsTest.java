package ca.gc.cra.logship.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("value", Strings.requireNonBlank("name", "  value "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "a\u0000b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
  }

  @Test
  void sanitizeTagAcceptsRoutingTags() {
    assertEquals("app.logs-1_a", Strings.sanitizeTag("tag", "app.logs-1_a"));
  }

  @Test
  void sanitizeTagRejectsWhitespaceAndPunctuation() {
    assertThrows(IllegalArgumentException.class, () -> Strings.sanitizeTag("tag", "app logs"));
    assertThrows(IllegalArgumentException.class, () -> Strings.sanitizeTag("tag", "app/logs"));
  }

  @Test
  void trimToNullCollapsesBlank() {
    assertNull(Strings.trimToNull(null));
    assertNull(Strings.trimToNull("  "));
    assertEquals("x", Strings.trimToNull(" x "));
  }
}
