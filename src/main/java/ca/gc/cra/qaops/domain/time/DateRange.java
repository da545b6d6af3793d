package ca.gc.cra.qaops.domain.time;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Inclusive range of calendar days named on the command line as {@code dd-MM-yy} or {@code dd-MM-yy:dd-MM-yy}.
 *
 * @param start first day; never {@code null}
 * @param end last day; never before {@code start}
 * @since 0.1.0
 */
public record DateRange(LocalDate start, LocalDate end) {
  private static final DateTimeFormatter SHORT_DATE =
      DateTimeFormatter.ofPattern("dd-MM-uu").withResolverStyle(ResolverStyle.STRICT);
  private static final DateTimeFormatter LONG_DATE = DateTimeFormatter.ofPattern("dd-MM-uuuu");

  public DateRange {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (start.isAfter(end)) {
      throw new IllegalArgumentException(
          "Start date " + SHORT_DATE.format(start) + " must be before or equal to end date " + SHORT_DATE.format(end));
    }
  }

  /**
   * Creates a single-day range.
   *
   * @param day the day
   * @return range covering exactly {@code day}
   */
  public static DateRange of(LocalDate day) {
    return new DateRange(day, day);
  }

  /**
   * Parses {@code dd-MM-yy} or {@code dd-MM-yy:dd-MM-yy}.
   *
   * @param text date argument
   * @return parsed range
   * @throws IllegalArgumentException when the text is malformed or start is after end
   */
  public static DateRange parse(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Date argument must not be blank");
    }
    int colon = text.indexOf(':');
    if (colon < 0) {
      return of(parseDay(text));
    }
    return new DateRange(parseDay(text.substring(0, colon)), parseDay(text.substring(colon + 1)));
  }

  /**
   * Expands the range into its individual days, in calendar order.
   *
   * @return every day from {@code start} to {@code end}
   */
  public List<LocalDate> days() {
    List<LocalDate> days = new ArrayList<>();
    for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
      days.add(day);
    }
    return List.copyOf(days);
  }

  public boolean isSingleDay() {
    return start.equals(end);
  }

  /**
   * @return label in {@code dd-MM-yy} or {@code dd-MM-yy:dd-MM-yy} form
   */
  public String label() {
    return isSingleDay() ? SHORT_DATE.format(start) : SHORT_DATE.format(start) + ":" + SHORT_DATE.format(end);
  }

  /**
   * @return human-friendly label using four-digit years
   */
  public String displayLabel() {
    return isSingleDay() ? LONG_DATE.format(start) : LONG_DATE.format(start) + " - " + LONG_DATE.format(end);
  }

  private static LocalDate parseDay(String raw) {
    try {
      return LocalDate.parse(raw.trim(), SHORT_DATE);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("Invalid date format: '" + raw.trim() + "'. Please use dd-mm-yy (e.g., 24-06-25)", ex);
    }
  }
}
