package ca.gc.cra.qaops.domain.alarm;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalized alarm extracted from one raw event.
 *
 * @param id alarm occurrence identifier, {@code "N/A"} when the source carries none
 * @param name logical alarm name
 * @param location resource or region reported by the alarm
 * @param timestamp event instant; {@code null} when the event carried no usable timestamp
 * @param rawText text the alarm was extracted from
 * @since 0.1.0
 */
public record AlarmRecord(String id, String name, String location, Instant timestamp, String rawText) {
  /** Identifier used when the source event carries none. */
  public static final String UNKNOWN_ID = "N/A";

  public AlarmRecord {
    id = id == null || id.isBlank() ? UNKNOWN_ID : id;
    Objects.requireNonNull(name, "name");
    location = location == null ? "" : location;
    rawText = rawText == null ? "" : rawText;
  }

  /**
   * @return timestamp when the source event carried one
   */
  public Optional<Instant> optionalTimestamp() {
    return Optional.ofNullable(timestamp);
  }
}
