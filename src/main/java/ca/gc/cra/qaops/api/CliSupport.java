package ca.gc.cra.qaops.api;

import ca.gc.cra.qaops.application.port.MetricsPort;
import ca.gc.cra.qaops.config.AnalyzerConfig;
import ca.gc.cra.qaops.config.ConfigValidator;
import ca.gc.cra.qaops.config.ProductConfigLoader;
import ca.gc.cra.qaops.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.qaops.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Option handling shared by the {@code analyze} and {@code kpi} commands.
 */
final class CliSupport {
  private static final Logger log = LoggerFactory.getLogger(CliSupport.class);
  static final String DEFAULT_CONFIG = "config/base.yaml";

  private CliSupport() {}

  static String require(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing required argument " + key + "=...");
    }
    return value;
  }

  /**
   * Loads the configuration named by {@code config=} and logs non-fatal problems.
   */
  static AnalyzerConfig loadConfig(Map<String, String> options) throws IOException {
    Path path = Path.of(options.getOrDefault("config", DEFAULT_CONFIG));
    AnalyzerConfig config = new ProductConfigLoader().load(path);
    for (String problem : new ConfigValidator().validate(config)) {
      log.warn("Configuration problem: {}", problem);
    }
    return config;
  }

  /**
   * @return OpenTelemetry adapter for {@code metrics=otel}, else a no-op adapter
   */
  static MetricsPort metrics(Map<String, String> options) {
    String mode = options.getOrDefault("metrics", "none").toLowerCase(Locale.ROOT);
    return switch (mode) {
      case "otel", "otlp", "opentelemetry" -> new OpenTelemetryMetricsAdapter();
      case "none" -> new NoOpMetricsAdapter();
      default -> throw new IllegalArgumentException("metrics must be otel or none (was '" + mode + "')");
    };
  }

  static void close(MetricsPort metrics) {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.forceFlush();
      otel.close();
    }
  }
}
