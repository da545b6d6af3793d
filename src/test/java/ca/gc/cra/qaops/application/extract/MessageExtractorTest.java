package ca.gc.cra.qaops.application.extract;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.qaops.domain.alarm.AlarmRecord;
import ca.gc.cra.qaops.domain.event.EventAttachment;
import ca.gc.cra.qaops.domain.event.EventFile;
import ca.gc.cra.qaops.domain.event.RawEvent;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class MessageExtractorTest {
  private final TitleAlarmExtractor titles = new TitleAlarmExtractor(new ProductEnvironment("SEND", "prod"));
  private final FileAttachmentExtractor files = new FileAttachmentExtractor(new ProductEnvironment("INTEROP", "prod"));

  @Test
  void titleExtractorReadsFirstAttachmentTitle() {
    RawEvent event = RawEvent.withAttachment("1750752000.000200",
        EventAttachment.of("#101: ALARM: \"DB-Timeout\" in eu-south-1", "DB-Timeout fired", "details"));
    AlarmRecord alarm = titles.extract(event).orElseThrow();
    assertEquals("101", alarm.id());
    assertEquals("DB-Timeout", alarm.name());
    assertEquals("eu-south-1", alarm.location());
    assertEquals("DB-Timeout fired", alarm.rawText());
    assertEquals(Instant.parse("2025-06-24T08:00:00.000200Z"), alarm.timestamp());
  }

  @Test
  void titleExtractorFallsBackToFallbackText() {
    RawEvent event = RawEvent.withAttachment("1750752000",
        EventAttachment.of("CloudWatch", "#9: ALARM: \"Lambda-Errors\" in us-east-1", null));
    assertEquals("Lambda-Errors", titles.extract(event).orElseThrow().name());
  }

  @Test
  void titleExtractorSkipsNonAlarms() {
    assertTrue(titles.extract(new RawEvent("deploy finished", "1", List.of(), List.of())).isEmpty());
    assertTrue(titles.extract(RawEvent.withAttachment("1", EventAttachment.of("OK: resolved", null, null))).isEmpty());
  }

  @Test
  void malformedTimestampLeavesAlarmUntimed() {
    RawEvent event = RawEvent.withAttachment("not-a-number",
        EventAttachment.of("#101: ALARM: \"DB-Timeout\" in eu-south-1", null, null));
    AlarmRecord alarm = titles.extract(event).orElseThrow();
    assertNull(alarm.timestamp());
    assertEquals("", alarm.rawText());
  }

  @Test
  void outOfRangeTimestampLeavesAlarmUntimed() {
    RawEvent titled = RawEvent.withAttachment("1e20",
        EventAttachment.of("#101: ALARM: \"DB-Timeout\" in eu-south-1", null, null));
    AlarmRecord alarm = titles.extract(titled).orElseThrow();
    assertEquals("DB-Timeout", alarm.name());
    assertNull(alarm.timestamp());

    RawEvent shared = RawEvent.withFile("99999999999999999",
        EventFile.of("ALARM: \"Queue-Backlog\" in eu-central-1", "F1", "Backlog above threshold"));
    assertNull(files.extract(shared).orElseThrow().timestamp());
  }

  @Test
  void fileExtractorUsesQuotedNameAndLocation() {
    RawEvent event = RawEvent.withFile("1750752000",
        EventFile.of("ALARM: \"Queue-Backlog\" in eu-central-1", "F1", "Backlog above threshold"));
    AlarmRecord alarm = files.extract(event).orElseThrow();
    assertEquals("F1", alarm.id());
    assertEquals("Queue-Backlog", alarm.name());
    assertEquals("eu-central-1", alarm.location());
    assertEquals("Backlog above threshold", alarm.rawText());
  }

  @Test
  void fileExtractorFallsBackToWholeName() {
    assertEquals("AWS Notification Message", FileAttachmentExtractor.alarmName("AWS Notification Message"));
    assertEquals(FileAttachmentExtractor.UNKNOWN_LOCATION, FileAttachmentExtractor.location("AWS Notification Message"));
    assertEquals("Europe", FileAttachmentExtractor.location("disk full in Europe"));
    assertEquals(FileAttachmentExtractor.UNKNOWN_LOCATION, FileAttachmentExtractor.location("Maintenance window"));
  }

  @Test
  void fileExtractorWithoutFilesSkips() {
    RawEvent event = RawEvent.withAttachment("1", EventAttachment.of("#1: ALARM: \"x\" in y", null, null));
    assertTrue(files.extract(event).isEmpty());
    RawEvent unnamed = RawEvent.withFile("1", EventFile.of(null, null, null));
    AlarmRecord alarm = files.extract(unnamed).orElseThrow();
    assertEquals("", alarm.name());
    assertEquals(AlarmRecord.UNKNOWN_ID, alarm.id());
  }
}
