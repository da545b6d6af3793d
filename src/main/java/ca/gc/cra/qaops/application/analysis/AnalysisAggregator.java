package ca.gc.cra.qaops.application.analysis;

import ca.gc.cra.qaops.application.classify.OnCallClassifier;
import ca.gc.cra.qaops.application.extract.MessageExtractor;
import ca.gc.cra.qaops.application.port.MetricsPort;
import ca.gc.cra.qaops.application.rules.IgnoreDecision;
import ca.gc.cra.qaops.application.rules.IgnoreRuleEngine;
import ca.gc.cra.qaops.domain.alarm.AlarmRecord;
import ca.gc.cra.qaops.domain.alarm.AlarmType;
import ca.gc.cra.qaops.domain.analysis.AnalysisResult;
import ca.gc.cra.qaops.domain.analysis.IgnoredMessage;
import ca.gc.cra.qaops.domain.event.EventAttachment;
import ca.gc.cra.qaops.domain.event.EventFile;
import ca.gc.cra.qaops.domain.event.RawEvent;
import ca.gc.cra.qaops.logging.Logs;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs extraction, classification, ignore evaluation and on-call tagging for one batch.
 * <p><strong>Role:</strong> Application service used by {@link AnalyzeAlarmsUseCase}; one instance per product and
 * environment.</p>
 * <p><strong>Pipeline:</strong>
 * <ol>
 *   <li>Events the extractor does not recognise are skipped.</li>
 *   <li>Alarms whose name the type does not match are skipped; they count toward nothing.</li>
 *   <li>Ignored alarms are counted and kept as {@link IgnoredMessage} details.</li>
 *   <li>Remaining alarms are grouped by name; for on-call types they also feed the on-call counters.</li>
 * </ol>
 * <p><strong>Thread-safety:</strong> Stateless apart from its immutable collaborators; batches for different types
 * may be analyzed concurrently.</p>
 * <p><strong>Observability:</strong> Emits {@code analysis.*} counters through {@link MetricsPort}.</p>
 *
 * @since 0.1.0
 */
public final class AnalysisAggregator {
  static final String METRIC_SKIPPED = "analysis.events.skipped";
  static final String METRIC_TOTAL = "analysis.alarms.total";
  static final String METRIC_IGNORED = "analysis.alarms.ignored";
  static final String METRIC_ANALYZABLE = "analysis.alarms.analyzable";
  static final String METRIC_ONCALL = "analysis.oncall.total";
  static final String METRIC_REPERIBILITA = "analysis.oncall.reperibilita";
  static final String METRIC_BATCH = "analysis.batch.events";

  private static final Logger log = LoggerFactory.getLogger(AnalysisAggregator.class);
  private static final int LOG_TEXT_BYTES = 160;

  private final MessageExtractor extractor;
  private final IgnoreRuleEngine ignoreRules;
  private final OnCallClassifier onCallClassifier;
  private final MetricsPort metrics;

  public AnalysisAggregator(
      MessageExtractor extractor,
      IgnoreRuleEngine ignoreRules,
      OnCallClassifier onCallClassifier,
      MetricsPort metrics) {
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.ignoreRules = Objects.requireNonNull(ignoreRules, "ignoreRules");
    this.onCallClassifier = Objects.requireNonNull(onCallClassifier, "onCallClassifier");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Analyzes the events fetched for one alarm type.
   *
   * @param type alarm type the events belong to
   * @param events raw events in channel order
   * @return result for {@code type}
   */
  public AnalysisResult analyze(AlarmType type, List<RawEvent> events) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(events, "events");
    metrics.observe(METRIC_BATCH, events.size());

    Map<String, List<AlarmRecord>> stats = new LinkedHashMap<>();
    List<IgnoredMessage> ignored = new ArrayList<>();
    int total = 0;
    int onCallTotal = 0;
    int reperibilita = 0;

    for (RawEvent event : events) {
      Optional<AlarmRecord> extracted = extractor.extract(event);
      if (extracted.isEmpty()) {
        metrics.increment(METRIC_SKIPPED);
        continue;
      }
      AlarmRecord alarm = extracted.get();
      if (!type.matches(alarm.name())) {
        log.debug("{} does not match {}; skipped", alarm.name(), type);
        continue;
      }
      total++;
      metrics.increment(METRIC_TOTAL);

      IgnoreDecision decision = ignoreRules.evaluate(event, type.environment(), alarm.timestamp());
      if (decision.ignored()) {
        metrics.increment(METRIC_IGNORED);
        log.debug("Ignoring alarm #{} {}: {}", alarm.id(), Logs.truncate(alarm.name(), LOG_TEXT_BYTES),
            decision.reason());
        ignored.add(detailsOf(event, alarm, decision.reason()));
        continue;
      }

      metrics.increment(METRIC_ANALYZABLE);
      stats.computeIfAbsent(alarm.name(), name -> new ArrayList<>()).add(alarm);
      if (type.isOnCall()) {
        onCallTotal++;
        metrics.increment(METRIC_ONCALL);
        if (onCallClassifier.isOutsideBusinessHours(alarm.timestamp())) {
          reperibilita++;
          metrics.increment(METRIC_REPERIBILITA);
        }
      }
    }

    log.info("{}: {} events, {} alarms, {} ignored", type, events.size(), total, ignored.size());
    return new AnalysisResult(
        stats, total, total - ignored.size(), ignored.size(), ignored, onCallTotal, reperibilita, type);
  }

  /**
   * Merges results of one analysis run. Alarm lists under the same name are concatenated in input order,
   * counters are summed and ignored messages concatenated. The merged result has no alarm type.
   *
   * @param results results in source order
   * @return combined result
   */
  public static AnalysisResult merge(List<AnalysisResult> results) {
    Objects.requireNonNull(results, "results");
    Map<String, List<AlarmRecord>> stats = new LinkedHashMap<>();
    List<IgnoredMessage> ignored = new ArrayList<>();
    int total = 0;
    int analyzable = 0;
    int ignoredCount = 0;
    int onCallTotal = 0;
    int reperibilita = 0;
    for (AnalysisResult result : results) {
      result.alarmStats().forEach((name, records) ->
          stats.computeIfAbsent(name, key -> new ArrayList<>()).addAll(records));
      ignored.addAll(result.ignoredMessages());
      total += result.totalAlarms();
      analyzable += result.analyzableAlarms();
      ignoredCount += result.ignoredAlarms();
      onCallTotal += result.onCallTotal();
      reperibilita += result.onCallInReperibilita();
    }
    return new AnalysisResult(stats, total, analyzable, ignoredCount, ignored, onCallTotal, reperibilita, null);
  }

  static IgnoredMessage detailsOf(RawEvent event, AlarmRecord alarm, String reason) {
    Optional<EventAttachment> attachment = event.firstAttachment();
    Optional<EventFile> file = event.firstFile();
    return new IgnoredMessage(
        alarm.timestamp(),
        alarm.id(),
        alarm.name(),
        reason,
        event.text(),
        attachment.map(EventAttachment::title).orElse(null),
        attachment.map(EventAttachment::fallback).orElse(null),
        file.map(EventFile::name).orElse(null),
        file.map(EventFile::plainText).orElse(null));
  }
}
