package ca.gc.cra.qaops.logging;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("DB-Timeout", Logs.truncate("DB-Timeout", 64));
    assertEquals("<null>", Logs.truncate(null, 64));
  }

  @Test
  void longValuesAreCutAtByteBoundary() {
    assertEquals("abc... (truncated, 3 of 6)", Logs.truncate("abcdef", 3));
    // "è" is two bytes in UTF-8; a cut inside it drops the partial character
    assertEquals("a... (truncated, 2 of 6)", Logs.truncate("aèèx", 2));
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("value", 0));
  }
}
