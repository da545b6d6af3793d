package ca.gc.cra.qaops.application.classify;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.qaops.config.BusinessHours;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class OnCallClassifierTest {
  private static final ZoneId ROME = ZoneId.of("Europe/Rome");
  private final OnCallClassifier classifier = new OnCallClassifier(ROME, BusinessHours.DEFAULT);

  @Test
  void businessHoursAreHalfOpen() {
    assertTrue(classifier.isOutsideBusinessHours(rome(8, 59)));
    assertFalse(classifier.isOutsideBusinessHours(rome(9, 0)));
    assertFalse(classifier.isOutsideBusinessHours(rome(17, 59)));
    assertTrue(classifier.isOutsideBusinessHours(rome(18, 0)));
    assertTrue(classifier.isOutsideBusinessHours(rome(23, 30)));
  }

  @Test
  void usesLocalClockAcrossDaylightSaving() {
    // 08:30 UTC is 09:30 Rome in winter and 10:30 in summer
    assertFalse(classifier.isOutsideBusinessHours(Instant.parse("2025-01-15T08:30:00Z")));
    assertFalse(classifier.isOutsideBusinessHours(Instant.parse("2025-06-15T08:30:00Z")));
    // 07:30 UTC is 08:30 Rome in winter but 09:30 in summer
    assertTrue(classifier.isOutsideBusinessHours(Instant.parse("2025-01-15T07:30:00Z")));
    assertFalse(classifier.isOutsideBusinessHours(Instant.parse("2025-06-15T07:30:00Z")));
  }

  @Test
  void unknownTimestampIsNotOutside() {
    assertFalse(classifier.isOutsideBusinessHours((Instant) null));
    assertFalse(classifier.isOutsideBusinessHours(null, ZoneOffset.UTC));
  }

  @Test
  void convertsFromSourceZone() {
    LocalDateTime utcMorning = LocalDateTime.of(2025, 6, 24, 6, 30);
    assertTrue(classifier.isOutsideBusinessHours(utcMorning, ZoneOffset.UTC));
    assertFalse(classifier.isOutsideBusinessHours(utcMorning.plusHours(2), ZoneOffset.UTC));
  }

  private static Instant rome(int hour, int minute) {
    return LocalDateTime.of(2025, 6, 24, hour, minute).atZone(ROME).toInstant();
  }
}
