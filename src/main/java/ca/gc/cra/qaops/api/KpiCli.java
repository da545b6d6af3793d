package ca.gc.cra.qaops.api;

import ca.gc.cra.qaops.application.analysis.AnalyzeAlarmsUseCase;
import ca.gc.cra.qaops.application.analysis.KpiReport;
import ca.gc.cra.qaops.application.extract.MessageExtractorRegistry;
import ca.gc.cra.qaops.application.port.MetricsPort;
import ca.gc.cra.qaops.config.AnalyzerConfig;
import ca.gc.cra.qaops.config.ConfigurationException;
import ca.gc.cra.qaops.domain.time.DateRange;
import ca.gc.cra.qaops.infrastructure.events.JsonArchiveEventSource;
import ca.gc.cra.qaops.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code kpi} command: collects daily alarm KPIs for every configured product and environment.
 *
 * @since 0.1.0
 */
public final class KpiCli {
  private static final Logger log = LoggerFactory.getLogger(KpiCli.class);
  private static final String SUMMARY_USAGE =
      "usage: kpi events=FILE dates=dd-mm-yy[:dd-mm-yy] [config=config/base.yaml]";
  private static final String HELP_TEXT = """
      QAOps daily KPI collection

      Usage:
        kpi events=FILE dates=dd-mm-yy[:dd-mm-yy] [config=config/base.yaml]

      Options:
        events=FILE           Exported channel history ({"channels": {"<id>": [messages]}})
        dates=RANGE           Single day or inclusive range; each day is analyzed separately
        config=FILE           Analyzer configuration (default config/base.yaml)
        metrics=otel|none     Export counters through OpenTelemetry (default none)

      Flags:
        --help                Show this message
        --verbose             Enable DEBUG logging

      Days that cannot be collected are reported as FAILED; the exit code is still 0.
      """;

  private KpiCli() {}

  /**
   * @param args command arguments, without the command name
   * @return exit code for the shell
   */
  public static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.strip());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for kpi");
    }

    Map<String, String> options;
    DateRange dates;
    Path events;
    try {
      options = CliArgsParser.toMap(input.keyValueArgs());
      events = Path.of(CliSupport.require(options, "events"));
      dates = DateRange.parse(CliSupport.require(options, "dates"));
    } catch (IllegalArgumentException ex) {
      CliPrinter.println(ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    MetricsPort metrics = null;
    try {
      AnalyzerConfig config = CliSupport.loadConfig(options);
      metrics = CliSupport.metrics(options);
      AnalyzeAlarmsUseCase useCase = new AnalyzeAlarmsUseCase(
          config, new JsonArchiveEventSource(events), MessageExtractorRegistry.standard(), metrics);
      KpiReport report = useCase.collectKpis(dates);
      CliPrinter.printLines(new SummaryFormatter(config.zone()).kpis(report));
      if (!report.failures().isEmpty()) {
        log.warn("{} day(s) could not be collected", report.failures().size());
      }
      return ExitCode.SUCCESS;
    } catch (ConfigurationException ex) {
      log.error("Configuration error: {}", ex.getMessage());
      CliPrinter.println("Configuration error: " + ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Failed to read analyzer configuration", ex);
      CliPrinter.println("I/O error: " + ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      CliPrinter.println(ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (RuntimeException ex) {
      log.error("KPI collection failed", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      CliSupport.close(metrics);
    }
  }
}
