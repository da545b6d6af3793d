package ca.gc.cra.qaops.application.classify;

import ca.gc.cra.qaops.config.BusinessHours;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Objects;

/**
 * <strong>What:</strong> Decides whether an on-call alarm was raised outside business hours (in reperibilit&agrave;).
 * <p><strong>Semantics:</strong> Business hours are the half-open local interval {@code [start, end)} in the reference
 * zone; anything else is outside. Unknown timestamps are never outside.</p>
 * <p><strong>Time zones:</strong> Instants are localized with the offset in force at that instant. Naive
 * date-times are first anchored to their source zone, never shifted by a fixed offset.</p>
 *
 * @since 0.1.0
 */
public final class OnCallClassifier {
  private final ZoneId zone;
  private final BusinessHours businessHours;

  /**
   * @param zone reference zone of the office
   * @param businessHours office hours in that zone
   */
  public OnCallClassifier(ZoneId zone, BusinessHours businessHours) {
    this.zone = Objects.requireNonNull(zone, "zone");
    this.businessHours = Objects.requireNonNull(businessHours, "businessHours");
  }

  /**
   * @param timestamp alarm instant; {@code null} when unknown
   * @return {@code true} when the local time is before the start or at/after the end of business hours
   */
  public boolean isOutsideBusinessHours(Instant timestamp) {
    if (timestamp == null) {
      return false;
    }
    return !businessHours.contains(timestamp.atZone(zone).toLocalTime());
  }

  /**
   * Variant for wall-clock values recorded without an offset.
   *
   * @param localDateTime wall-clock value; {@code null} when unknown
   * @param sourceZone zone the value was recorded in
   * @return same as {@link #isOutsideBusinessHours(Instant)} for the corresponding instant
   */
  public boolean isOutsideBusinessHours(LocalDateTime localDateTime, ZoneId sourceZone) {
    if (localDateTime == null) {
      return false;
    }
    Objects.requireNonNull(sourceZone, "sourceZone");
    return isOutsideBusinessHours(localDateTime.atZone(sourceZone).toInstant());
  }
}
