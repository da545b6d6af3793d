package ca.gc.cra.qaops.application.extract;

import ca.gc.cra.qaops.domain.alarm.AlarmRecord;
import ca.gc.cra.qaops.domain.event.EventFile;
import ca.gc.cra.qaops.domain.event.RawEvent;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts alarms forwarded as files (for example e-mail notifications). Uses the first shared file: the alarm
 * name is the quoted part of the file name when present, else the whole name; the location is the text after
 * {@code in}, or {@code "Unknown"}.
 *
 * @since 0.1.0
 */
public final class FileAttachmentExtractor implements MessageExtractor {
  static final String UNKNOWN_LOCATION = "Unknown";
  private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");
  private static final Pattern LOCATION = Pattern.compile("\\bin\\s+(.+)");

  private final ProductEnvironment productEnvironment;

  public FileAttachmentExtractor(ProductEnvironment productEnvironment) {
    this.productEnvironment = Objects.requireNonNull(productEnvironment, "productEnvironment");
  }

  @Override
  public ProductEnvironment productEnvironment() {
    return productEnvironment;
  }

  @Override
  public Optional<AlarmRecord> extract(RawEvent event) {
    Objects.requireNonNull(event, "event");
    Optional<EventFile> first = event.firstFile();
    if (first.isEmpty()) {
      return Optional.empty();
    }
    EventFile file = first.get();
    String rawName = file.name() == null ? "" : file.name();
    return Optional.of(new AlarmRecord(
        file.id(),
        alarmName(rawName),
        location(rawName),
        MessageExtractor.timestampOf(event),
        file.plainText()));
  }

  static String alarmName(String rawName) {
    Matcher quoted = QUOTED.matcher(rawName);
    return quoted.find() ? quoted.group(1) : rawName;
  }

  static String location(String rawName) {
    Matcher matcher = LOCATION.matcher(rawName);
    return matcher.find() ? matcher.group(1).trim() : UNKNOWN_LOCATION;
  }

  @Override
  public String toString() {
    return "FileAttachmentExtractor(" + productEnvironment + ")";
  }
}
