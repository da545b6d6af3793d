package ca.gc.cra.qaops.domain.time;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Composite time predicate combining calendar periods, weekdays and hour ranges.
 * <p><strong>Why:</strong> Lets ignore rules be active only during maintenance windows, nights or weekends.</p>
 * <p><strong>Semantics:</strong>
 * <ul>
 *   <li>An empty constraint matches every instant.</li>
 *   <li>Each configured kind must be satisfied (AND across periods, weekdays and hours).</li>
 *   <li>Within one kind a single satisfied entry is enough (OR).</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent use.</p>
 *
 * @param periods calendar periods; empty when unconstrained
 * @param weekdays weekday numbers where {@code 0} is Monday and {@code 6} is Sunday; empty when unconstrained
 * @param hours time-of-day ranges; empty when unconstrained
 * @since 0.1.0
 */
public record TimeConstraint(List<DateTimePeriod> periods, List<Integer> weekdays, List<TimeRange> hours) {
  private static final TimeConstraint EMPTY = new TimeConstraint(List.of(), List.of(), List.of());
  private static final Map<String, Integer> WEEKDAY_NAMES = Map.ofEntries(
      Map.entry("monday", 0), Map.entry("mon", 0),
      Map.entry("tuesday", 1), Map.entry("tue", 1),
      Map.entry("wednesday", 2), Map.entry("wed", 2),
      Map.entry("thursday", 3), Map.entry("thu", 3),
      Map.entry("friday", 4), Map.entry("fri", 4),
      Map.entry("saturday", 5), Map.entry("sat", 5),
      Map.entry("sunday", 6), Map.entry("sun", 6));

  /**
   * Validates weekday numbers and copies the supplied lists.
   */
  public TimeConstraint {
    periods = periods == null ? List.of() : List.copyOf(periods);
    weekdays = weekdays == null ? List.of() : List.copyOf(weekdays);
    hours = hours == null ? List.of() : List.copyOf(hours);
    for (Integer day : weekdays) {
      if (day < 0 || day > 6) {
        throw new IllegalArgumentException(
            "Invalid weekday number: " + day + ". Must be 0-6 (0=Monday, 6=Sunday)");
      }
    }
  }

  /**
   * Returns the constraint that matches unconditionally.
   *
   * @return shared empty constraint
   */
  public static TimeConstraint empty() {
    return EMPTY;
  }

  /**
   * Resolves a weekday from a number ({@code 0..6}) or an English name / three-letter abbreviation.
   *
   * @param value integer or name such as {@code "monday"} or {@code "Sat"}
   * @return weekday number, {@code 0} for Monday
   * @throws IllegalArgumentException when the value is not a recognised weekday
   */
  public static int weekdayNumber(Object value) {
    if (value instanceof Number number) {
      int day = number.intValue();
      if (day < 0 || day > 6) {
        throw new IllegalArgumentException(
            "Invalid weekday number: " + day + ". Must be 0-6 (0=Monday, 6=Sunday)");
      }
      return day;
    }
    if (value instanceof String name) {
      Integer day = WEEKDAY_NAMES.get(name.trim().toLowerCase(Locale.ROOT));
      if (day == null) {
        throw new IllegalArgumentException("Invalid weekday name: " + name + ". Expected: monday, tuesday, etc.");
      }
      return day;
    }
    throw new IllegalArgumentException("Invalid weekday: " + value);
  }

  /**
   * @return {@code true} when no periods, weekdays or hour ranges are configured
   */
  public boolean isEmpty() {
    return periods.isEmpty() && weekdays.isEmpty() && hours.isEmpty();
  }

  /**
   * Evaluates the constraint against a local wall-clock value.
   *
   * @param dateTime local date-time in the analyzer's reference zone; never {@code null}
   * @return {@code true} when every configured kind is satisfied
   */
  public boolean matches(LocalDateTime dateTime) {
    Objects.requireNonNull(dateTime, "dateTime");
    if (isEmpty()) {
      return true;
    }
    if (!periods.isEmpty() && periods.stream().noneMatch(period -> period.contains(dateTime))) {
      return false;
    }
    if (!weekdays.isEmpty() && !weekdays.contains(weekdayOf(dateTime.getDayOfWeek()))) {
      return false;
    }
    return hours.isEmpty() || hours.stream().anyMatch(range -> range.contains(dateTime.toLocalTime()));
  }

  private static int weekdayOf(DayOfWeek day) {
    return day.getValue() - 1;
  }

  @Override
  public String toString() {
    if (isEmpty()) {
      return "TimeConstraint(empty)";
    }
    List<String> parts = new ArrayList<>(3);
    if (!periods.isEmpty()) {
      parts.add("periods=" + periods);
    }
    if (!weekdays.isEmpty()) {
      List<String> names = new ArrayList<>(weekdays.size());
      for (Integer day : weekdays) {
        names.add(DayOfWeek.of(day + 1).name().toLowerCase(Locale.ROOT));
      }
      parts.add("weekdays=" + names);
    }
    if (!hours.isEmpty()) {
      parts.add("hours=" + hours);
    }
    return "TimeConstraint(" + String.join(", ", parts) + ")";
  }
}
