package ca.gc.cra.qaops.domain.analysis;

import java.time.Instant;

/**
 * Detail of an alarm removed by an ignore rule, retained for noise reporting.
 *
 * @param timestamp event instant; {@code null} when unknown
 * @param alarmId occurrence identifier
 * @param alarmName extracted alarm name
 * @param reason human readable ignore reason
 * @param text plain event text; may be {@code null}
 * @param title first attachment title; may be {@code null}
 * @param fallback first attachment fallback; may be {@code null}
 * @param fileName first file name; may be {@code null}
 * @param fileText first file plain text; may be {@code null}
 * @since 0.1.0
 */
public record IgnoredMessage(
    Instant timestamp,
    String alarmId,
    String alarmName,
    String reason,
    String text,
    String title,
    String fallback,
    String fileName,
    String fileText) {

  /** Shape of the ignored event, derived from which fields it carried. */
  public enum MessageType {
    FILE_ATTACHMENT,
    TEXT_MESSAGE,
    TITLED_MESSAGE,
    UNKNOWN
  }

  /**
   * @return {@code FILE_ATTACHMENT} when a file name is present, else {@code TEXT_MESSAGE} for plain text,
   *     else {@code TITLED_MESSAGE} for an attachment title, else {@code UNKNOWN}
   */
  public MessageType messageType() {
    if (hasText(fileName)) {
      return MessageType.FILE_ATTACHMENT;
    }
    if (hasText(text)) {
      return MessageType.TEXT_MESSAGE;
    }
    if (hasText(title)) {
      return MessageType.TITLED_MESSAGE;
    }
    return MessageType.UNKNOWN;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isEmpty();
  }
}
