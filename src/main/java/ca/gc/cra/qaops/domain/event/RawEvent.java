package ca.gc.cra.qaops.domain.event;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> One message fetched from an alarm channel.
 * <p><strong>Why:</strong> Keeps the raw shape available to ignore rules after an alarm record has been extracted.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param text plain message text; may be {@code null}
 * @param ts epoch seconds as sent by the chat service (for example {@code "1719223200.000100"}); may be {@code null}
 * @param attachments attachment blocks in message order
 * @param files shared files in message order
 * @since 0.1.0
 */
public record RawEvent(String text, String ts, List<EventAttachment> attachments, List<EventFile> files) {

  public RawEvent {
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
    files = files == null ? List.of() : List.copyOf(files);
  }

  /**
   * Creates an event carrying a single attachment.
   *
   * @param ts epoch-seconds timestamp string; may be {@code null}
   * @param attachment attachment block
   * @return new event
   */
  public static RawEvent withAttachment(String ts, EventAttachment attachment) {
    return new RawEvent(null, ts, List.of(attachment), List.of());
  }

  /**
   * Creates an event carrying a single shared file.
   *
   * @param ts epoch-seconds timestamp string; may be {@code null}
   * @param file shared file
   * @return new event
   */
  public static RawEvent withFile(String ts, EventFile file) {
    return new RawEvent(null, ts, List.of(), List.of(file));
  }

  public Optional<EventAttachment> firstAttachment() {
    return attachments.isEmpty() ? Optional.empty() : Optional.of(attachments.get(0));
  }

  public Optional<EventFile> firstFile() {
    return files.isEmpty() ? Optional.empty() : Optional.of(files.get(0));
  }

  /**
   * Converts the epoch-seconds string into an instant, keeping sub-second precision.
   *
   * @return instant, or empty when the timestamp is absent
   * @throws NumberFormatException when the timestamp is present but not numeric or outside the
   *     {@link Instant} range
   */
  public Optional<Instant> timestamp() {
    if (ts == null || ts.isBlank()) {
      return Optional.empty();
    }
    BigDecimal seconds = new BigDecimal(ts.trim());
    try {
      BigDecimal floor = seconds.setScale(0, RoundingMode.FLOOR);
      long whole = floor.longValueExact();
      long nanos = seconds.subtract(floor).movePointRight(9).longValue();
      return Optional.of(Instant.ofEpochSecond(whole, nanos));
    } catch (ArithmeticException | DateTimeException ex) {
      NumberFormatException nfe = new NumberFormatException("Timestamp out of range: " + ts);
      nfe.initCause(ex);
      throw nfe;
    }
  }
}
