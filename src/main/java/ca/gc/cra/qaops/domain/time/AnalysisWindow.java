package ca.gc.cra.qaops.domain.time;

import java.time.Instant;
import java.util.Objects;

/**
 * Absolute time window used to select events for one alarm type. Both bounds are inclusive.
 *
 * @param start first instant of the window
 * @param end last instant of the window; not before {@code start}
 * @since 0.1.0
 */
public record AnalysisWindow(Instant start, Instant end) {

  public AnalysisWindow {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("window end " + end + " precedes start " + start);
    }
  }

  /**
   * @param instant candidate instant
   * @return {@code true} when {@code start <= instant <= end}
   */
  public boolean contains(Instant instant) {
    return instant != null && !instant.isBefore(start) && !instant.isAfter(end);
  }
}
