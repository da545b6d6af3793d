package ca.gc.cra.qaops.domain.time;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

class DateTimePeriodTest {

  @Test
  void dateOnlyEndCoversWholeDay() {
    DateTimePeriod period = DateTimePeriod.parse("2025-01-01", "2025-01-31");
    assertTrue(period.startDateOnly());
    assertTrue(period.endDateOnly());
    assertTrue(period.contains(LocalDateTime.of(2025, 1, 1, 0, 0)));
    assertTrue(period.contains(LocalDateTime.of(2025, 1, 31, 23, 59, 59)));
    assertFalse(period.contains(LocalDateTime.of(2025, 2, 1, 0, 0)));
    assertFalse(period.contains(LocalDateTime.of(2024, 12, 31, 23, 59)));
  }

  @Test
  void timedBoundsCompareToTheSecond() {
    DateTimePeriod period = DateTimePeriod.parse("2025-01-10 08:00", "2025-01-10 12:30:15");
    assertFalse(period.startDateOnly());
    assertTrue(period.contains(LocalDateTime.of(2025, 1, 10, 8, 0)));
    assertTrue(period.contains(LocalDateTime.of(2025, 1, 10, 12, 30, 15)));
    assertFalse(period.contains(LocalDateTime.of(2025, 1, 10, 12, 30, 16)));
    assertFalse(period.contains(LocalDateTime.of(2025, 1, 10, 7, 59)));
  }

  @Test
  void acceptsIsoSeparator() {
    DateTimePeriod period = DateTimePeriod.parse("2025-01-10T08:00:00", null);
    assertEquals(LocalDateTime.of(2025, 1, 10, 8, 0), period.start());
  }

  @Test
  void openBoundsAreUnlimited() {
    DateTimePeriod openEnd = DateTimePeriod.parse("2025-01-01", null);
    assertNull(openEnd.end());
    assertTrue(openEnd.contains(LocalDateTime.of(2030, 1, 1, 0, 0)));

    DateTimePeriod openStart = DateTimePeriod.parse("", "2025-01-01");
    assertTrue(openStart.contains(LocalDateTime.of(1999, 1, 1, 0, 0)));
    assertEquals("* -> 2025-01-01 00:00:00", openStart.toString());
  }

  @Test
  void rejectsInvertedAndMalformedPeriods() {
    assertThrows(IllegalArgumentException.class, () -> DateTimePeriod.parse("2025-02-01", "2025-01-01"));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> DateTimePeriod.parse("01/02/2025", null));
    assertTrue(ex.getMessage().startsWith("Invalid datetime format"));
  }
}
