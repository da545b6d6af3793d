package ca.gc.cra.qaops.application.rules;

import ca.gc.cra.qaops.domain.alarm.AlarmTitle;
import ca.gc.cra.qaops.domain.event.EventAttachment;
import ca.gc.cra.qaops.domain.event.EventFile;
import ca.gc.cra.qaops.domain.event.RawEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Field path an ignore rule searches. Supported forms:
 * <ul>
 *   <li>{@code *}: event text, every attachment title/fallback/text and every file name/plain text</li>
 *   <li>{@code text}: event text</li>
 *   <li>{@code attachments.<field>} and {@code files.<field>}: one field across all attachments or files</li>
 *   <li>{@code attachments.title.alarm_name}: the quoted alarm name inside each attachment title</li>
 * </ul>
 *
 * @param kind path kind
 * @param field addressed field for the {@code attachments.<field>} and {@code files.<field>} forms, else {@code null}
 * @since 0.1.0
 */
public record RulePath(Kind kind, String field) {
  /** Wildcard path covering every searchable field. */
  public static final RulePath ALL = new RulePath(Kind.ALL_FIELDS, null);

  /** Path shapes understood by the engine. */
  public enum Kind {
    ALL_FIELDS,
    TEXT,
    ATTACHMENT_FIELD,
    FILE_FIELD,
    ATTACHMENT_ALARM_NAME
  }

  public RulePath {
    Objects.requireNonNull(kind, "kind");
    boolean needsField = kind == Kind.ATTACHMENT_FIELD || kind == Kind.FILE_FIELD;
    if (needsField && (field == null || field.isBlank())) {
      throw new IllegalArgumentException(kind + " path requires a field name");
    }
    if (!needsField) {
      field = null;
    }
  }

  /**
   * Parses a dotted path.
   *
   * @param text path text; {@code null} or blank means {@code *}
   * @return parsed path
   * @throws IllegalArgumentException when the path has an unknown root or an unexpected number of segments
   */
  public static RulePath parse(String text) {
    if (text == null || text.isBlank() || text.trim().equals("*")) {
      return ALL;
    }
    String path = text.trim();
    if (path.equals("text")) {
      return new RulePath(Kind.TEXT, null);
    }
    if (path.equals("attachments.title.alarm_name")) {
      return new RulePath(Kind.ATTACHMENT_ALARM_NAME, null);
    }
    String[] parts = path.split("\\.", -1);
    if (parts.length == 2 && !parts[1].isBlank()) {
      if (parts[0].equals("attachments")) {
        return new RulePath(Kind.ATTACHMENT_FIELD, parts[1]);
      }
      if (parts[0].equals("files")) {
        return new RulePath(Kind.FILE_FIELD, parts[1]);
      }
    }
    throw new IllegalArgumentException("Unsupported ignore rule path '" + path
        + "'. Expected *, text, attachments.<field>, files.<field> or attachments.title.alarm_name");
  }

  /**
   * Collects the values this path addresses in {@code event}. Absent fields are skipped.
   *
   * @param event raw event
   * @return values in event order
   */
  public List<String> values(RawEvent event) {
    List<String> values = new ArrayList<>();
    switch (kind) {
      case ALL_FIELDS -> {
        addIfPresent(values, event.text());
        for (EventAttachment attachment : event.attachments()) {
          values.addAll(attachment.searchableValues());
        }
        for (EventFile file : event.files()) {
          values.addAll(file.searchableValues());
        }
      }
      case TEXT -> addIfPresent(values, event.text());
      case ATTACHMENT_FIELD -> event.attachments().forEach(attachment -> addIfPresent(values, attachment.field(field)));
      case FILE_FIELD -> event.files().forEach(file -> addIfPresent(values, file.field(field)));
      case ATTACHMENT_ALARM_NAME -> event.attachments().forEach(attachment ->
          AlarmTitle.parse(attachment.title()).ifPresent(title -> values.add(title.name())));
    }
    return values;
  }

  private static void addIfPresent(List<String> values, String value) {
    if (value != null && !value.isEmpty()) {
      values.add(value);
    }
  }

  @Override
  public String toString() {
    return switch (kind) {
      case ALL_FIELDS -> "*";
      case TEXT -> "text";
      case ATTACHMENT_FIELD -> "attachments." + field;
      case FILE_FIELD -> "files." + field;
      case ATTACHMENT_ALARM_NAME -> "attachments.title.alarm_name";
    };
  }
}
