package ca.gc.cra.qaops.domain.time;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Calendar period with optional open ends. Each bound is either a full local date-time or a date only;
 * date-only bounds are compared by calendar date, so an end of {@code 2025-01-31} covers the whole of that day.
 *
 * @param start lower bound; {@code null} for an open start
 * @param startDateOnly whether {@code start} was given without a time of day
 * @param end upper bound; {@code null} for an open end
 * @param endDateOnly whether {@code end} was given without a time of day
 * @since 0.1.0
 */
public record DateTimePeriod(
    LocalDateTime start,
    boolean startDateOnly,
    LocalDateTime end,
    boolean endDateOnly) {

  private static final DateTimeFormatter INPUT = DateTimeFormatter.ofPattern("uuuu-MM-dd[[' ']['T']HH:mm[:ss]]");
  private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  /**
   * Rejects periods whose start lies after their end.
   */
  public DateTimePeriod {
    if (start != null && end != null && start.isAfter(end)) {
      throw new IllegalArgumentException("start (" + start + ") must be before end (" + end + ")");
    }
  }

  /**
   * Parses a period from {@code yyyy-MM-dd}, {@code yyyy-MM-dd HH:mm} or {@code yyyy-MM-dd HH:mm:ss} strings.
   *
   * @param start lower bound text; {@code null} or blank for an open start
   * @param end upper bound text; {@code null} or blank for an open end
   * @return parsed period
   * @throws IllegalArgumentException when a bound cannot be parsed or start is after end
   */
  public static DateTimePeriod parse(String start, String end) {
    Bound lower = parseBound(start);
    Bound upper = parseBound(end);
    return new DateTimePeriod(lower.value(), lower.dateOnly(), upper.value(), upper.dateOnly());
  }

  /**
   * Tests whether the supplied local date-time lies within the period (bounds inclusive).
   *
   * @param dateTime local wall-clock value
   * @return {@code true} when inside the period
   */
  public boolean contains(LocalDateTime dateTime) {
    if (start != null) {
      if (startDateOnly) {
        if (dateTime.toLocalDate().isBefore(start.toLocalDate())) {
          return false;
        }
      } else if (dateTime.isBefore(start)) {
        return false;
      }
    }
    if (end != null) {
      if (endDateOnly) {
        return !dateTime.toLocalDate().isAfter(end.toLocalDate());
      }
      return !dateTime.isAfter(end);
    }
    return true;
  }

  private static Bound parseBound(String raw) {
    if (raw == null || raw.isBlank()) {
      return new Bound(null, false);
    }
    try {
      TemporalAccessor parsed = INPUT.parseBest(raw.trim(), LocalDateTime::from, LocalDate::from);
      if (parsed instanceof LocalDateTime dateTime) {
        return new Bound(dateTime, false);
      }
      return new Bound(((LocalDate) parsed).atStartOfDay(), true);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(
          "Invalid datetime format: " + raw + ". Expected YYYY-MM-DD or YYYY-MM-DD HH:MM:SS", ex);
    }
  }

  @Override
  public String toString() {
    String from = start == null ? "*" : DISPLAY.format(start);
    String to = end == null ? "*" : DISPLAY.format(end);
    return from + " -> " + to;
  }

  private record Bound(LocalDateTime value, boolean dateOnly) {}
}
