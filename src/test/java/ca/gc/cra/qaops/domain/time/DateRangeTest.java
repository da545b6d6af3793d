package ca.gc.cra.qaops.domain.time;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class DateRangeTest {

  @Test
  void parsesSingleDay() {
    DateRange range = DateRange.parse("24-06-25");
    assertTrue(range.isSingleDay());
    assertEquals(LocalDate.of(2025, 6, 24), range.start());
    assertEquals("24-06-25", range.label());
    assertEquals("24-06-2025", range.displayLabel());
  }

  @Test
  void parsesInclusiveRange() {
    DateRange range = DateRange.parse("30-12-24:02-01-25");
    assertEquals(
        List.of(LocalDate.of(2024, 12, 30), LocalDate.of(2024, 12, 31), LocalDate.of(2025, 1, 1),
            LocalDate.of(2025, 1, 2)),
        range.days());
    assertEquals("30-12-24:02-01-25", range.label());
    assertEquals("30-12-2024 - 02-01-2025", range.displayLabel());
  }

  @Test
  void rejectsInvalidDates() {
    IllegalArgumentException format =
        assertThrows(IllegalArgumentException.class, () -> DateRange.parse("2025-06-24"));
    assertTrue(format.getMessage().contains("dd-mm-yy"));
    assertThrows(IllegalArgumentException.class, () -> DateRange.parse("31-02-25"));
    assertThrows(IllegalArgumentException.class, () -> DateRange.parse(" "));
    assertThrows(IllegalArgumentException.class, () -> DateRange.parse("02-01-25:01-01-25"));
  }

  @Test
  void analysisWindowIsInclusive() {
    Instant start = Instant.parse("2025-06-23T16:00:00Z");
    Instant end = Instant.parse("2025-06-24T16:00:00Z");
    AnalysisWindow window = new AnalysisWindow(start, end);
    assertTrue(window.contains(start));
    assertTrue(window.contains(end));
    assertFalse(window.contains(end.plusNanos(1)));
    assertFalse(window.contains(null));
    assertThrows(IllegalArgumentException.class, () -> new AnalysisWindow(end, start));
  }
}
