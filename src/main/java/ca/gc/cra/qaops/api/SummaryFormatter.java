package ca.gc.cra.qaops.api;

import ca.gc.cra.qaops.application.analysis.KpiEntry;
import ca.gc.cra.qaops.application.analysis.KpiReport;
import ca.gc.cra.qaops.domain.alarm.AlarmRecord;
import ca.gc.cra.qaops.domain.analysis.AnalysisResult;
import ca.gc.cra.qaops.domain.analysis.IgnoredMessage;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders analysis results and KPI reports as console text.
 *
 * @since 0.1.0
 */
final class SummaryFormatter {
  static final int MAX_IDS = 10;
  private static final String RULE = "=".repeat(50);
  private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("dd-MM-yyyy HH:mm:ss");

  private final ZoneId zone;

  SummaryFormatter(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  List<String> analysis(String heading, AnalysisResult result, boolean hourly) {
    List<String> lines = new ArrayList<>();
    lines.add(RULE);
    lines.add(heading);
    lines.add("Total alarms: " + result.totalAlarms()
        + " | Analyzable: " + result.analyzableAlarms()
        + " | Ignored: " + result.ignoredAlarms());
    if (result.onCallTotal() > 0) {
      lines.add("On-call alarms: " + result.onCallTotal()
          + " (outside business hours: " + result.onCallInReperibilita() + ")");
    }
    lines.add(RULE);
    if (result.totalAlarms() == 0) {
      lines.add("No alarm messages found for this range");
      return lines;
    }
    for (String name : result.namesByCount()) {
      List<AlarmRecord> records = result.alarmStats().get(name);
      lines.add("");
      lines.add(records.size() + " x " + name);
      lines.add("   IDs: " + ids(records));
    }
    if (hourly) {
      lines.add("");
      lines.add("Hourly distribution:");
      lines.addAll(hourlyLines(result.hourlyDistribution(zone)));
    }
    if (!result.ignoredMessages().isEmpty()) {
      lines.add("");
      lines.add("Ignored alarms:");
      for (IgnoredMessage ignored : result.ignoredMessages()) {
        lines.add(" - [" + ignored.messageType().name().toLowerCase(Locale.ROOT) + "] #" + ignored.alarmId()
            + " " + ignored.alarmName() + ": " + ignored.reason());
      }
    }
    lines.add("");
    lines.add(RULE);
    return lines;
  }

  List<String> kpis(KpiReport report) {
    List<String> lines = new ArrayList<>();
    lines.add(String.format(Locale.ROOT, "%-12s %-8s %-10s %7s %10s %7s %7s %12s",
        "PRODUCT", "ENV", "DATE", "TOTAL", "ANALYZABLE", "IGNORED", "ONCALL", "REPERIBILITA"));
    DateTimeFormatter day = DateTimeFormatter.ofPattern("dd-MM-yyyy");
    for (KpiReport.Row row : report.rows()) {
      if (row.failed()) {
        lines.add(String.format(Locale.ROOT, "%-12s %-8s %-10s FAILED: %s",
            row.product(), row.environment(), day.format(row.date()), row.failure()));
        continue;
      }
      KpiEntry entry = row.entry();
      lines.add(String.format(Locale.ROOT, "%-12s %-8s %-10s %7d %10d %7d %7s %12s",
          row.product(), row.environment(), day.format(row.date()),
          entry.totalAlarms(), entry.analyzableAlarms(), entry.ignoredAlarms(),
          orDash(entry.onCallTotal()), orDash(entry.onCallInReperibilita())));
    }
    return lines;
  }

  private String ids(List<AlarmRecord> records) {
    List<String> ids = new ArrayList<>();
    for (AlarmRecord record : records.subList(0, Math.min(MAX_IDS, records.size()))) {
      String when = record.timestamp() == null ? "unknown time" : TIMESTAMP.format(record.timestamp().atZone(zone));
      ids.add("#" + record.id() + " (" + when + ")");
    }
    String joined = String.join(", ", ids);
    if (records.size() > MAX_IDS) {
      joined += " ... and " + (records.size() - MAX_IDS) + " more";
    }
    return joined;
  }

  private static List<String> hourlyLines(int[] hours) {
    List<String> lines = new ArrayList<>();
    for (int hour = 0; hour < 24; hour++) {
      if (hours[hour] > 0) {
        lines.add(String.format(Locale.ROOT, "   %02d:00-%02d:00 -> %d occurrences", hour, (hour + 1) % 24, hours[hour]));
      }
    }
    return lines;
  }

  private static String orDash(Integer value) {
    return value == null ? "-" : value.toString();
  }
}
