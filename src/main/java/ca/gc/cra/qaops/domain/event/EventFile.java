package ca.gc.cra.qaops.domain.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * File shared with a raw event, such as an e-mail forwarded into the channel.
 *
 * @param fields file fields keyed by name, for example {@code name}, {@code id}, {@code plain_text}
 * @since 0.1.0
 */
public record EventFile(Map<String, String> fields) {

  public EventFile {
    Objects.requireNonNull(fields, "fields");
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  /**
   * @param name file name; may be {@code null}
   * @param id file identifier; may be {@code null}
   * @param plainText extracted plain text; may be {@code null}
   * @return file holding the non-null values
   */
  public static EventFile of(String name, String id, String plainText) {
    Map<String, String> fields = new LinkedHashMap<>();
    if (name != null) {
      fields.put("name", name);
    }
    if (id != null) {
      fields.put("id", id);
    }
    if (plainText != null) {
      fields.put("plain_text", plainText);
    }
    return new EventFile(fields);
  }

  public String name() {
    return field("name");
  }

  public String id() {
    return field("id");
  }

  public String plainText() {
    return field("plain_text");
  }

  public String field(String name) {
    return fields.get(name);
  }

  /**
   * @return name and plain text, skipping absent values
   */
  public List<String> searchableValues() {
    return EventAttachment.nonNull(name(), plainText());
  }
}
