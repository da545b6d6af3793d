package ca.gc.cra.qaops.domain.time;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Time-of-day range with inclusive bounds. A range whose start is after its end wraps past midnight,
 * so {@code 22:00-02:00} covers late evening and early morning.
 *
 * @param start first minute covered by the range; never {@code null}
 * @param end last minute covered by the range; never {@code null}
 * @since 0.1.0
 */
public record TimeRange(LocalTime start, LocalTime end) {
  private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("H:mm");

  public TimeRange {
    start = Objects.requireNonNull(start, "start");
    end = Objects.requireNonNull(end, "end");
  }

  /**
   * Parses a range from {@code HH:mm} strings (24-hour clock).
   *
   * @param start range start, e.g. {@code "22:00"}
   * @param end range end, e.g. {@code "02:00"}
   * @return parsed range
   * @throws IllegalArgumentException when either bound is not a valid {@code HH:mm} value
   */
  public static TimeRange parse(String start, String end) {
    return new TimeRange(parseClock(start), parseClock(end));
  }

  /**
   * Tests whether the supplied time of day falls inside the range.
   *
   * @param time local time of day; never {@code null}
   * @return {@code true} when covered, honouring midnight wrap-around
   */
  public boolean contains(LocalTime time) {
    Objects.requireNonNull(time, "time");
    if (!start.isAfter(end)) {
      return !time.isBefore(start) && !time.isAfter(end);
    }
    return !time.isBefore(start) || !time.isAfter(end);
  }

  /**
   * @return {@code true} when the range crosses midnight
   */
  public boolean wrapsMidnight() {
    return start.isAfter(end);
  }

  private static LocalTime parseClock(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Invalid time format: <blank>. Expected HH:MM (24-hour format)");
    }
    try {
      return LocalTime.parse(value.trim(), CLOCK);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(
          "Invalid time format: " + value + ". Expected HH:MM (24-hour format)", ex);
    }
  }

  @Override
  public String toString() {
    return CLOCK.format(start) + "-" + CLOCK.format(end);
  }
}
