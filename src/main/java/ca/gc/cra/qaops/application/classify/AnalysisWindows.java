package ca.gc.cra.qaops.application.classify;

import ca.gc.cra.qaops.domain.alarm.AlarmType;
import ca.gc.cra.qaops.domain.time.AnalysisWindow;
import ca.gc.cra.qaops.domain.time.DateRange;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Selects the absolute window analyzed for an alarm type and a range of days.
 *
 * <p>On-call types cover whole calendar days ({@code 00:00} to {@code 23:59:59.999999}). Normal types cover the
 * shift day, from {@code 18:00} of the previous day to {@code 18:00} of the last day. Local times are resolved
 * in the reference zone with the offset in force at each bound, so daylight saving changes are honoured.</p>
 *
 * @since 0.1.0
 */
public final class AnalysisWindows {
  static final LocalTime SHIFT_CHANGE = LocalTime.of(18, 0);
  static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_999_000);

  private final ZoneId zone;

  public AnalysisWindows(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  /**
   * @param type alarm type
   * @param dates analyzed days
   * @return window for the type's category
   */
  public AnalysisWindow windowFor(AlarmType type, DateRange dates) {
    Objects.requireNonNull(type, "type");
    return type.isOnCall() ? calendarDays(dates) : eveningWindow(dates);
  }

  /**
   * @param dates analyzed days
   * @return midnight of the first day through the last microsecond of the last day
   */
  public AnalysisWindow calendarDays(DateRange dates) {
    return new AnalysisWindow(
        dates.start().atStartOfDay(zone).toInstant(),
        dates.end().atTime(END_OF_DAY).atZone(zone).toInstant());
  }

  /**
   * @param dates analyzed days
   * @return 18:00 of the day before the first day through 18:00 of the last day
   */
  public AnalysisWindow eveningWindow(DateRange dates) {
    return new AnalysisWindow(
        dates.start().minusDays(1).atTime(SHIFT_CHANGE).atZone(zone).toInstant(),
        dates.end().atTime(SHIFT_CHANGE).atZone(zone).toInstant());
  }

  public ZoneId zone() {
    return zone;
  }
}
