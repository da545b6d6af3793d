package ca.gc.cra.qaops.api;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.qaops.application.analysis.KpiEntry;
import ca.gc.cra.qaops.application.analysis.KpiReport;
import ca.gc.cra.qaops.domain.alarm.AlarmRecord;
import ca.gc.cra.qaops.domain.analysis.AnalysisResult;
import ca.gc.cra.qaops.domain.analysis.IgnoredMessage;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SummaryFormatterTest {
  private final SummaryFormatter formatter = new SummaryFormatter(ZoneId.of("Europe/Rome"));

  @Test
  void emptyResultSaysSo() {
    List<String> lines = formatter.analysis("SEND prod 24-06-2025", AnalysisResult.empty(null), true);
    assertTrue(lines.contains("Total alarms: 0 | Analyzable: 0 | Ignored: 0"));
    assertTrue(lines.contains("No alarm messages found for this range"));
    assertFalse(lines.contains("Hourly distribution:"));
  }

  @Test
  void listsAlarmsIdsAndIgnoredMessages() {
    Instant at = Instant.parse("2025-06-24T08:00:00Z");
    List<AlarmRecord> many = new ArrayList<>();
    for (int i = 1; i <= 12; i++) {
      many.add(new AlarmRecord(String.valueOf(i), "DB-Timeout", "eu-south-1", at.plusSeconds(i), ""));
    }
    Map<String, List<AlarmRecord>> stats = new LinkedHashMap<>();
    stats.put("Lambda-Errors", List.of(new AlarmRecord("50", "Lambda-Errors", "eu-south-1", null, "")));
    stats.put("DB-Timeout", many);
    IgnoredMessage ignored = new IgnoredMessage(at, "103", "Disk-Full", "storage noise", null, "title", null, null, null);
    AnalysisResult result = new AnalysisResult(stats, 14, 13, 1, List.of(ignored), 4, 1, null);

    List<String> lines = formatter.analysis("SEND prod 24-06-2025", result, true);

    assertTrue(lines.contains("On-call alarms: 4 (outside business hours: 1)"));
    int first = lines.indexOf("12 x DB-Timeout");
    assertTrue(first > 0);
    assertTrue(first < lines.indexOf("1 x Lambda-Errors"));
    String ids = lines.get(first + 1);
    assertTrue(ids.startsWith("   IDs: #1 (24-06-2025 10:00:01), #2 (24-06-2025 10:00:02)"), ids);
    assertTrue(ids.endsWith("#10 (24-06-2025 10:00:10) ... and 2 more"), ids);
    assertTrue(lines.contains("   IDs: #50 (unknown time)"));
    assertTrue(lines.contains("   10:00-11:00 -> 12 occurrences"));
    assertTrue(lines.contains(" - [titled_message] #103 Disk-Full: storage noise"));
  }

  @Test
  void kpiTableShowsDashesAndFailures() {
    LocalDate day = LocalDate.of(2025, 6, 24);
    KpiReport report = new KpiReport(List.of(
        new KpiReport.Row("SEND", "prod", day, new KpiEntry(8, 5, 3, 3, 2), null),
        new KpiReport.Row("SEND", "uat", day, new KpiEntry(1, 1, 0, null, null), null),
        new KpiReport.Row("INTEROP", "prod", day, null, "channel unavailable")));

    List<String> lines = formatter.kpis(report);

    assertEquals(4, lines.size());
    assertTrue(lines.get(0).startsWith("PRODUCT"));
    assertTrue(lines.get(1).matches("SEND\\s+prod\\s+24-06-2025\\s+8\\s+5\\s+3\\s+3\\s+2"), lines.get(1));
    assertTrue(lines.get(2).matches("SEND\\s+uat\\s+24-06-2025\\s+1\\s+1\\s+0\\s+-\\s+-"), lines.get(2));
    assertTrue(lines.get(3).endsWith("FAILED: channel unavailable"));
  }
}
