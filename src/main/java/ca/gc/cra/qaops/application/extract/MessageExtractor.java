package ca.gc.cra.qaops.application.extract;

import ca.gc.cra.qaops.domain.alarm.AlarmRecord;
import ca.gc.cra.qaops.domain.event.RawEvent;
import ca.gc.cra.qaops.logging.Logs;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns a raw channel event into a normalized {@link AlarmRecord}.
 * <p><strong>Why:</strong> Products post alarms in different shapes (attachment titles, forwarded e-mail files);
 * downstream classification only sees the normalized record.</p>
 * <p><strong>Contract:</strong> An event that is not an alarm yields {@link Optional#empty()}. A missing or
 * malformed timestamp yields a record with a {@code null} timestamp instead of an error.</p>
 * <p><strong>Thread-safety:</strong> Implementations are stateless.</p>
 *
 * @since 0.1.0
 */
public sealed interface MessageExtractor permits TitleAlarmExtractor, FileAttachmentExtractor {

  /**
   * @return product and environment this extractor was registered for
   */
  ProductEnvironment productEnvironment();

  /**
   * Extracts an alarm from {@code event}.
   *
   * @param event raw event; never {@code null}
   * @return alarm record, or empty when the event does not describe an alarm
   */
  Optional<AlarmRecord> extract(RawEvent event);

  /**
   * Reads the event timestamp, logging and dropping values that are not numeric.
   *
   * @param event raw event
   * @return instant, or {@code null} when absent or malformed
   */
  static Instant timestampOf(RawEvent event) {
    try {
      return event.timestamp().orElse(null);
    } catch (NumberFormatException ex) {
      Logger log = LoggerFactory.getLogger(MessageExtractor.class);
      log.warn("Ignoring malformed event timestamp '{}': {}", Logs.truncate(event.ts(), 64), ex.getMessage());
      return null;
    }
  }
}
