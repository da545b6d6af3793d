package ca.gc.cra.qaops.validation;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void trimsValidValues() {
    assertEquals("SEND", Strings.requireNonBlank("product", "  SEND "));
  }

  @Test
  void rejectsBlankAndControlCharacters() {
    IllegalArgumentException blank =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("product", "   "));
    assertEquals("product must not be blank", blank.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("product", "SE\nND"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("product", null));
  }
}
