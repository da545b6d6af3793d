package ca.gc.cra.qaops.config;

import java.time.LocalTime;
import java.util.Objects;

/**
 * Local office hours as a half-open interval {@code [start, end)}.
 *
 * @param start first local time inside business hours
 * @param end first local time after business hours
 * @since 0.1.0
 */
public record BusinessHours(LocalTime start, LocalTime end) {
  /** 09:00 to 18:00. */
  public static final BusinessHours DEFAULT = new BusinessHours(LocalTime.of(9, 0), LocalTime.of(18, 0));

  public BusinessHours {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (!start.isBefore(end)) {
      throw new IllegalArgumentException("business hours start " + start + " must be before end " + end);
    }
  }

  /**
   * @param localTime wall-clock time in the reference zone
   * @return {@code true} when {@code start <= localTime < end}
   */
  public boolean contains(LocalTime localTime) {
    return !localTime.isBefore(start) && localTime.isBefore(end);
  }
}
