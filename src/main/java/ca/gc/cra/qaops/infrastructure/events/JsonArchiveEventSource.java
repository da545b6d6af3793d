package ca.gc.cra.qaops.infrastructure.events;

import ca.gc.cra.qaops.application.port.RawEventSource;
import ca.gc.cra.qaops.domain.event.EventAttachment;
import ca.gc.cra.qaops.domain.event.EventFile;
import ca.gc.cra.qaops.domain.event.RawEvent;
import ca.gc.cra.qaops.domain.time.AnalysisWindow;
import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link RawEventSource} reading an exported channel history file.
 * <p><strong>Format:</strong> {@code {"channels": {"<channel id>": [ <message>, ... ]}}} where each message carries
 * {@code text}, {@code ts}, {@code attachments[]} and {@code files[]} as in the chat service's history API.</p>
 * <p><strong>Selection:</strong> Messages whose timestamp lies inside the window (bounds inclusive) are returned
 * oldest first. Messages without a usable timestamp are kept, after the timed ones.</p>
 * <p><strong>Thread-safety:</strong> The archive is re-read on every call; instances hold no mutable state.</p>
 *
 * @since 0.1.0
 */
public final class JsonArchiveEventSource implements RawEventSource {
  private static final Logger log = LoggerFactory.getLogger(JsonArchiveEventSource.class);

  private final Path archive;
  private final JsonSupport json = new JsonSupport();

  public JsonArchiveEventSource(Path archive) {
    this.archive = Objects.requireNonNull(archive, "archive");
  }

  @Override
  public List<RawEvent> fetch(String channelReference, AnalysisWindow window) throws IOException {
    Objects.requireNonNull(channelReference, "channelReference");
    Objects.requireNonNull(window, "window");
    List<Object> messages = channelMessages(channelReference);

    List<TimedEvent> selected = new ArrayList<>();
    for (Object node : messages) {
      if (!(node instanceof Map<?, ?> message)) {
        throw new IOException("Malformed message in channel " + channelReference + " of " + archive);
      }
      RawEvent event = toEvent(message);
      Optional<Instant> timestamp = timestampOf(event);
      if (timestamp.isEmpty() || window.contains(timestamp.get())) {
        selected.add(new TimedEvent(event, timestamp.orElse(null)));
      }
    }
    selected.sort(Comparator.comparing(TimedEvent::timestamp, Comparator.nullsLast(Comparator.naturalOrder())));
    log.debug("Read {} of {} messages from channel {} in {}", selected.size(), messages.size(),
        channelReference, archive);
    return selected.stream().map(TimedEvent::event).toList();
  }

  private List<Object> channelMessages(String channelReference) throws IOException {
    if (!Files.exists(archive)) {
      throw new IOException("Event archive not found: " + archive);
    }
    Object root;
    try (Reader reader = Files.newBufferedReader(archive, StandardCharsets.UTF_8)) {
      root = json.parse(reader);
    }
    if (!(root instanceof Map<?, ?> rootMap) || !(rootMap.get("channels") instanceof Map<?, ?> channels)) {
      throw new IOException("Event archive " + archive + " has no 'channels' object");
    }
    Object channel = channels.get(channelReference);
    if (channel == null) {
      log.warn("Channel {} not present in {}", channelReference, archive);
      return List.of();
    }
    if (!(channel instanceof List<?> list)) {
      throw new IOException("Channel " + channelReference + " in " + archive + " is not a list");
    }
    return new ArrayList<>(list);
  }

  private static Optional<Instant> timestampOf(RawEvent event) {
    try {
      return event.timestamp();
    } catch (NumberFormatException ex) {
      log.debug("Keeping message with malformed ts '{}'", event.ts());
      return Optional.empty();
    }
  }

  static RawEvent toEvent(Map<?, ?> message) {
    List<EventAttachment> attachments = new ArrayList<>();
    for (Map<String, String> fields : fieldMaps(message.get("attachments"))) {
      attachments.add(new EventAttachment(fields));
    }
    List<EventFile> files = new ArrayList<>();
    for (Map<String, String> fields : fieldMaps(message.get("files"))) {
      files.add(new EventFile(fields));
    }
    return new RawEvent(scalar(message.get("text")), scalar(message.get("ts")), attachments, files);
  }

  private static List<Map<String, String>> fieldMaps(Object node) {
    if (!(node instanceof List<?> list)) {
      return List.of();
    }
    List<Map<String, String>> result = new ArrayList<>(list.size());
    for (Object element : list) {
      if (element instanceof Map<?, ?> map) {
        Map<String, String> fields = new LinkedHashMap<>();
        map.forEach((key, value) -> {
          String text = scalar(value);
          if (text != null) {
            fields.put(String.valueOf(key), text);
          }
        });
        result.add(fields);
      }
    }
    return result;
  }

  private static String scalar(Object value) {
    if (value instanceof String str) {
      return str;
    }
    if (value instanceof BigDecimal number) {
      return number.toPlainString();
    }
    if (value instanceof Number || value instanceof Boolean) {
      return value.toString();
    }
    return null;
  }

  private record TimedEvent(RawEvent event, Instant timestamp) {}
}
