package ca.gc.cra.qaops.application.analysis;

import ca.gc.cra.qaops.application.classify.AlarmTypeFactory;
import ca.gc.cra.qaops.application.classify.AnalysisWindows;
import ca.gc.cra.qaops.application.classify.OnCallClassifier;
import ca.gc.cra.qaops.application.extract.MessageExtractor;
import ca.gc.cra.qaops.application.extract.MessageExtractorRegistry;
import ca.gc.cra.qaops.application.extract.ProductEnvironment;
import ca.gc.cra.qaops.application.port.MetricsPort;
import ca.gc.cra.qaops.application.port.RawEventSource;
import ca.gc.cra.qaops.application.rules.IgnoreRuleEngine;
import ca.gc.cra.qaops.config.AnalyzerConfig;
import ca.gc.cra.qaops.config.ProductConfig;
import ca.gc.cra.qaops.domain.alarm.AlarmType;
import ca.gc.cra.qaops.domain.analysis.AnalysisResult;
import ca.gc.cra.qaops.domain.event.RawEvent;
import ca.gc.cra.qaops.domain.time.AnalysisWindow;
import ca.gc.cra.qaops.domain.time.DateRange;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Analyzes the alarms of one product and environment over a range of days.
 * <p><strong>Flow:</strong> builds the alarm types, selects each type's window, fetches the type's channel,
 * analyzes each batch and merges the per-type results.</p>
 * <p><strong>Errors:</strong> configuration problems surface as
 * {@link ca.gc.cra.qaops.config.ConfigurationException} before any event is fetched; event source failures
 * propagate as {@link IOException}.</p>
 *
 * @since 0.1.0
 */
public final class AnalyzeAlarmsUseCase {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeAlarmsUseCase.class);

  private final AnalyzerConfig config;
  private final RawEventSource events;
  private final MessageExtractorRegistry extractors;
  private final MetricsPort metrics;
  private final AlarmTypeFactory alarmTypes = new AlarmTypeFactory();
  private final AnalysisWindows windows;
  private final OnCallClassifier onCallClassifier;

  public AnalyzeAlarmsUseCase(
      AnalyzerConfig config,
      RawEventSource events,
      MessageExtractorRegistry extractors,
      MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.events = Objects.requireNonNull(events, "events");
    this.extractors = Objects.requireNonNull(extractors, "extractors");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.windows = new AnalysisWindows(config.zone());
    this.onCallClassifier = new OnCallClassifier(config.zone(), config.businessHours());
  }

  /**
   * @param product product name
   * @param environment environment name
   * @param dates analyzed days
   * @return merged result across the product's alarm types
   * @throws IOException when events cannot be fetched
   * @throws ca.gc.cra.qaops.config.ConfigurationException when the product or environment is unusable
   */
  public AnalysisResult analyze(String product, String environment, DateRange dates) throws IOException {
    return AnalysisAggregator.merge(analyzeByType(product, environment, dates));
  }

  /**
   * Same as {@link #analyze(String, String, DateRange)} without the final merge.
   *
   * @return one result per alarm type, normal first
   */
  public List<AnalysisResult> analyzeByType(String product, String environment, DateRange dates)
      throws IOException {
    Objects.requireNonNull(dates, "dates");
    ProductConfig productConfig = config.requireProduct(product);
    String env = Objects.requireNonNull(environment, "environment").trim();
    MessageExtractor extractor = extractors.resolve(productConfig.name(), env);
    IgnoreRuleEngine rules = new IgnoreRuleEngine(productConfig.applicableIgnoreRules(env), config.zone());
    AnalysisAggregator aggregator = new AnalysisAggregator(extractor, rules, onCallClassifier, metrics);
    List<AlarmType> types = alarmTypes.build(productConfig, env);

    List<AnalysisResult> results = new ArrayList<>(types.size());
    for (AlarmType type : types) {
      AnalysisWindow window = windows.windowFor(type, dates);
      log.debug("Fetching {} from channel {} between {} and {}", type, type.channelReference(),
          window.start(), window.end());
      List<RawEvent> batch = events.fetch(type.channelReference(), window);
      results.add(aggregator.analyze(type, batch));
    }
    return results;
  }

  /**
   * Collects daily KPIs for every configured product and environment. A day whose events cannot be fetched is
   * recorded as failed and the run continues.
   *
   * @param dates analyzed days
   * @return report in product, environment, day order
   * @throws ca.gc.cra.qaops.config.ConfigurationException when a product cannot be analyzed at all
   */
  public KpiReport collectKpis(DateRange dates) {
    Objects.requireNonNull(dates, "dates");
    List<KpiReport.Row> rows = new ArrayList<>();
    for (ProductConfig product : config.products().values()) {
      for (String env : product.environmentNames()) {
        extractors.resolve(product.name(), env);
        for (LocalDate day : dates.days()) {
          rows.add(collectDay(product.name(), env, day));
        }
      }
    }
    return new KpiReport(rows);
  }

  private KpiReport.Row collectDay(String product, String env, LocalDate day) {
    try {
      AnalysisResult result = analyze(product, env, DateRange.of(day));
      log.info("KPI {} {} {}: total={}, analyzable={}, oncall={}", product, env, day,
          result.totalAlarms(), result.analyzableAlarms(), result.onCallTotal());
      boolean production = ProductEnvironment.PROD.equals(env.toLowerCase(Locale.ROOT));
      return new KpiReport.Row(product, env, day, KpiEntry.of(result, production), null);
    } catch (IOException | UncheckedIOException ex) {
      log.warn("KPI collection failed for {} {} {}", product, env, day, ex);
      return new KpiReport.Row(product, env, day, null, String.valueOf(ex.getMessage()));
    }
  }
}
