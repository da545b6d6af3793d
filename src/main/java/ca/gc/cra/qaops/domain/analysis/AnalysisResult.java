package ca.gc.cra.qaops.domain.analysis;

import ca.gc.cra.qaops.domain.alarm.AlarmRecord;
import ca.gc.cra.qaops.domain.alarm.AlarmType;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Outcome of analyzing one alarm type, or the merge of several.
 * <p><strong>Invariant:</strong> {@code totalAlarms == analyzableAlarms + ignoredAlarms}; the constructor rejects
 * anything else.</p>
 * <p><strong>Ordering:</strong> {@code alarmStats} keeps first-seen name order and event order within each name.</p>
 * <p><strong>Thread-safety:</strong> Immutable; collections are unmodifiable copies.</p>
 *
 * @param alarmStats analyzable alarms grouped by name
 * @param totalAlarms alarms matched by the type, ignored ones included
 * @param analyzableAlarms alarms that survived ignore rules
 * @param ignoredAlarms alarms removed by ignore rules
 * @param ignoredMessages details of every ignored alarm, in event order
 * @param onCallTotal on-call alarms seen (on-call types only)
 * @param onCallInReperibilita on-call alarms raised outside business hours
 * @param alarmType type the result belongs to; {@code null} for merged results
 * @since 0.1.0
 */
public record AnalysisResult(
    Map<String, List<AlarmRecord>> alarmStats,
    int totalAlarms,
    int analyzableAlarms,
    int ignoredAlarms,
    List<IgnoredMessage> ignoredMessages,
    int onCallTotal,
    int onCallInReperibilita,
    AlarmType alarmType) {

  public AnalysisResult {
    Objects.requireNonNull(alarmStats, "alarmStats");
    Map<String, List<AlarmRecord>> copy = new LinkedHashMap<>();
    alarmStats.forEach((name, records) -> copy.put(name, List.copyOf(records)));
    alarmStats = Collections.unmodifiableMap(copy);
    ignoredMessages = ignoredMessages == null ? List.of() : List.copyOf(ignoredMessages);
    if (totalAlarms < 0 || analyzableAlarms < 0 || ignoredAlarms < 0 || onCallTotal < 0 || onCallInReperibilita < 0) {
      throw new IllegalArgumentException("counters must not be negative");
    }
    if (totalAlarms != analyzableAlarms + ignoredAlarms) {
      throw new IllegalArgumentException("total alarms (" + totalAlarms + ") must equal analyzable ("
          + analyzableAlarms + ") + ignored (" + ignoredAlarms + ")");
    }
    if (onCallInReperibilita > onCallTotal) {
      throw new IllegalArgumentException("on-call alarms outside business hours exceed on-call total");
    }
  }

  /**
   * @param alarmType owning type; may be {@code null}
   * @return result with no alarms
   */
  public static AnalysisResult empty(AlarmType alarmType) {
    return new AnalysisResult(Map.of(), 0, 0, 0, List.of(), 0, 0, alarmType);
  }

  /**
   * @return alarm names ordered by descending occurrence count, ties kept in first-seen order
   */
  public List<String> namesByCount() {
    List<String> names = new ArrayList<>(alarmStats.keySet());
    names.sort(Comparator.comparingInt((String name) -> alarmStats.get(name).size()).reversed());
    return names;
  }

  /**
   * Counts analyzable alarms per local hour of day. Alarms without a timestamp are left out.
   *
   * @param zone zone used to derive the hour
   * @return 24 counters indexed by hour
   */
  public int[] hourlyDistribution(ZoneId zone) {
    Objects.requireNonNull(zone, "zone");
    int[] hours = new int[24];
    for (List<AlarmRecord> records : alarmStats.values()) {
      for (AlarmRecord record : records) {
        Instant timestamp = record.timestamp();
        if (timestamp != null) {
          hours[timestamp.atZone(zone).getHour()]++;
        }
      }
    }
    return hours;
  }
}
