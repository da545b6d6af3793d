package ca.gc.cra.qaops.api;

import ca.gc.cra.qaops.application.analysis.AnalyzeAlarmsUseCase;
import ca.gc.cra.qaops.application.extract.MessageExtractorRegistry;
import ca.gc.cra.qaops.application.port.MetricsPort;
import ca.gc.cra.qaops.config.AnalyzerConfig;
import ca.gc.cra.qaops.config.ConfigurationException;
import ca.gc.cra.qaops.domain.analysis.AnalysisResult;
import ca.gc.cra.qaops.domain.time.DateRange;
import ca.gc.cra.qaops.infrastructure.events.JsonArchiveEventSource;
import ca.gc.cra.qaops.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code analyze} command: analyzes one product and environment over a date or date range and prints the alarm
 * summary.
 *
 * @since 0.1.0
 */
public final class AnalyzeCli {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeCli.class);
  private static final String SUMMARY_USAGE =
      "usage: analyze events=FILE date=dd-mm-yy[:dd-mm-yy] product=NAME [env=prod] [config=config/base.yaml]";
  private static final String HELP_TEXT = """
      QAOps alarm analysis

      Usage:
        analyze events=FILE date=dd-mm-yy[:dd-mm-yy] product=NAME [env=prod] [config=config/base.yaml]

      Options:
        events=FILE           Exported channel history ({"channels": {"<id>": [messages]}})
        date=RANGE            Single day (24-06-25) or inclusive range (01-06-25:07-06-25)
        product=NAME          Product as named in the configuration (e.g. SEND, INTEROP)
        env=NAME              Environment to analyze (default prod)
        config=FILE           Analyzer configuration (default config/base.yaml)
        metrics=otel|none     Export counters through OpenTelemetry (default none)

      Flags:
        --hourly              Print the hourly distribution of analyzable alarms
        --help                Show this message
        --verbose             Enable DEBUG logging, including per-alarm ignore decisions

      Example:
        qaops analyze events=history.json date=24-06-25 product=SEND env=prod
      """;

  private AnalyzeCli() {}

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
      log.debug("Verbose logging enabled for analyze");
    }

    Map<String, String> options;
    DateRange dates;
    String product;
    String env;
    Path events;
    try {
      options = CliArgsParser.toMap(input.keyValueArgs());
      events = Path.of(CliSupport.require(options, "events"));
      dates = DateRange.parse(CliSupport.require(options, "date"));
      product = CliSupport.require(options, "product");
      env = options.getOrDefault("env", "prod");
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
      AnalysisResult result = useCase.analyze(product, env, dates);
      String heading = config.requireProduct(product).name() + " " + env + " " + dates.displayLabel();
      List<String> lines = new SummaryFormatter(config.zone()).analysis(heading, result, input.hasFlag("--hourly"));
      CliPrinter.printLines(lines);
      return ExitCode.SUCCESS;
    } catch (ConfigurationException ex) {
      log.error("Configuration error: {}", ex.getMessage());
      CliPrinter.println("Configuration error: " + ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Failed to read analyzer input", ex);
      CliPrinter.println("I/O error: " + ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      CliPrinter.println(ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (RuntimeException ex) {
      log.error("Alarm analysis failed", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      CliSupport.close(metrics);
    }
  }
}
