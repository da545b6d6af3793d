package ca.gc.cra.qaops.infrastructure.events;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.qaops.domain.event.RawEvent;
import ca.gc.cra.qaops.domain.time.AnalysisWindow;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonArchiveEventSourceTest {
  private static final Path HISTORY = Path.of("src/test/resources/events/history.json");
  private static final AnalysisWindow EVENING = new AnalysisWindow(
      Instant.parse("2025-06-23T16:00:00Z"), Instant.parse("2025-06-24T16:00:00Z"));

  @TempDir Path tempDir;

  @Test
  void selectsWindowAndSortsByTimestamp() throws IOException {
    List<RawEvent> events = new JsonArchiveEventSource(HISTORY).fetch("C_SEND_PROD", EVENING);
    assertEquals(7, events.size());
    assertEquals("1750698000.000100", events.get(0).ts());
    assertEquals("1750766400.000100", events.get(events.size() - 1).ts());
    for (int i = 1; i < events.size(); i++) {
      assertFalse(events.get(i).timestamp().orElseThrow().isBefore(events.get(i - 1).timestamp().orElseThrow()));
    }
    RawEvent first = events.get(0);
    assertEquals("#103: ALARM: \"Disk-Full\" in eu-south-1", first.firstAttachment().orElseThrow().title());
  }

  @Test
  void readsFilesAndText() throws IOException {
    List<RawEvent> interop = new JsonArchiveEventSource(HISTORY).fetch("C_INTEROP_PROD", EVENING);
    assertEquals(2, interop.size());
    assertEquals("F1", interop.get(0).firstFile().orElseThrow().id());
    assertEquals("Backlog above threshold", interop.get(0).firstFile().orElseThrow().plainText());

    List<RawEvent> prod = new JsonArchiveEventSource(HISTORY).fetch("C_SEND_PROD", EVENING);
    assertTrue(prod.stream().anyMatch(event -> "deploy finished".equals(event.text())));
  }

  @Test
  void missingChannelIsEmpty() throws IOException {
    assertEquals(List.of(), new JsonArchiveEventSource(HISTORY).fetch("C_UNKNOWN", EVENING));
  }

  @Test
  void keepsUntimedMessagesLast() throws IOException {
    Path archive = tempDir.resolve("history.json");
    Files.writeString(archive, """
        {"channels": {"C1": [
          {"text": "no timestamp"},
          {"ts": "soon", "text": "bad timestamp"},
          {"ts": 1750752000, "text": "numeric timestamp"},
          {"ts": "1750000000.000000", "text": "outside"}
        ]}}
        """);
    List<RawEvent> events = new JsonArchiveEventSource(archive).fetch("C1", EVENING);
    assertEquals(List.of("numeric timestamp", "no timestamp", "bad timestamp"),
        events.stream().map(RawEvent::text).toList());
    assertEquals("1750752000", events.get(0).ts());
  }

  @Test
  void outOfRangeTimestampsAreKeptAsUntimed() throws IOException {
    Path archive = tempDir.resolve("range.json");
    Files.writeString(archive, """
        {"channels": {"C1": [
          {"ts": "99999999999999999", "text": "far future"},
          {"ts": 1e20, "text": "exponent"},
          {"ts": "1750752000.000100", "text": "timed"}
        ]}}
        """);
    List<RawEvent> events = new JsonArchiveEventSource(archive).fetch("C1", EVENING);
    assertEquals(List.of("timed", "far future", "exponent"),
        events.stream().map(RawEvent::text).toList());
  }

  @Test
  void structuralProblemsAreIoErrors() throws IOException {
    JsonArchiveEventSource source = new JsonArchiveEventSource(HISTORY);
    IOException notList = assertThrows(IOException.class, () -> source.fetch("C_SEND_UAT", EVENING));
    assertTrue(notList.getMessage().contains("not a list"));

    assertThrows(IOException.class,
        () -> new JsonArchiveEventSource(tempDir.resolve("absent.json")).fetch("C1", EVENING));

    Path noChannels = tempDir.resolve("messages.json");
    Files.writeString(noChannels, "{\"messages\": []}");
    assertThrows(IOException.class, () -> new JsonArchiveEventSource(noChannels).fetch("C1", EVENING));

    Path truncated = tempDir.resolve("truncated.json");
    Files.writeString(truncated, "{\"channels\": {\"C1\": [");
    assertThrows(IOException.class, () -> new JsonArchiveEventSource(truncated).fetch("C1", EVENING));

    Path scalarMessage = tempDir.resolve("scalar.json");
    Files.writeString(scalarMessage, "{\"channels\": {\"C1\": [42]}}");
    assertThrows(IOException.class, () -> new JsonArchiveEventSource(scalarMessage).fetch("C1", EVENING));
  }

  @Test
  void convertsScalarFieldsToText() {
    RawEvent event = JsonArchiveEventSource.toEvent(Map.of(
        "ts", new BigDecimal("1750752000.000100"),
        "attachments", List.of(Map.of("title", "t", "color", Boolean.TRUE, "ignored", List.of())),
        "files", "not-a-list"));
    assertEquals("1750752000.000100", event.ts());
    assertEquals("true", event.firstAttachment().orElseThrow().field("color"));
    assertNull(event.firstAttachment().orElseThrow().field("ignored"));
    assertTrue(event.files().isEmpty());
  }
}
