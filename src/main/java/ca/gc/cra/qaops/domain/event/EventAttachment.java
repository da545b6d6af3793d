package ca.gc.cra.qaops.domain.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Attachment block of a raw event. Fields are kept verbatim so rules can address any of them by name.
 *
 * @param fields attachment fields keyed by name, for example {@code title}, {@code fallback}, {@code text}
 * @since 0.1.0
 */
public record EventAttachment(Map<String, String> fields) {

  public EventAttachment {
    Objects.requireNonNull(fields, "fields");
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  /**
   * Convenience factory for the three fields used by alarm notifications.
   *
   * @param title attachment title; may be {@code null}
   * @param fallback fallback text; may be {@code null}
   * @param text body text; may be {@code null}
   * @return attachment holding the non-null values
   */
  public static EventAttachment of(String title, String fallback, String text) {
    Map<String, String> fields = new LinkedHashMap<>();
    putIfPresent(fields, "title", title);
    putIfPresent(fields, "fallback", fallback);
    putIfPresent(fields, "text", text);
    return new EventAttachment(fields);
  }

  public String title() {
    return field("title");
  }

  public String fallback() {
    return field("fallback");
  }

  public String text() {
    return field("text");
  }

  /**
   * @param name field name
   * @return field value or {@code null} when absent
   */
  public String field(String name) {
    return fields.get(name);
  }

  /**
   * @return title, fallback and text in that order, skipping absent values
   */
  public List<String> searchableValues() {
    return nonNull(title(), fallback(), text());
  }

  static List<String> nonNull(String... values) {
    ArrayList<String> out = new ArrayList<>(values.length);
    for (String value : values) {
      if (value != null) {
        out.add(value);
      }
    }
    return List.copyOf(out);
  }

  private static void putIfPresent(Map<String, String> fields, String key, String value) {
    if (value != null) {
      fields.put(key, value);
    }
  }
}
