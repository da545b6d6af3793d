package ca.gc.cra.qaops.api;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.qaops.logging.LoggingConfigurator;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class AnalyzeCliTest {
  private static final String CONFIG = "config=src/test/resources/config/base.yaml";
  private static final String EVENTS = "events=src/test/resources/events/history.json";

  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(AnalyzeCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
    LoggingConfigurator.resetLogging();
  }

  @Test
  void printsSummaryForProductionDay() {
    ExitCode code = AnalyzeCli.run(new String[] {CONFIG, EVENTS, "date=24-06-25", "product=SEND", "--hourly"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("SEND prod 24-06-2025"), out);
    assertTrue(out.contains("Total alarms: 8 | Analyzable: 5 | Ignored: 3"), out);
    assertTrue(out.contains("On-call alarms: 3 (outside business hours: 2)"), out);
    assertTrue(out.contains("2 x DB-Timeout"), out);
    assertTrue(out.contains("   IDs: #102 (24-06-2025 08:30:00), #101 (24-06-2025 10:00:00)"), out);
    assertTrue(out.contains("   08:00-09:00 -> 2 occurrences"), out);
    assertTrue(out.contains(" - [titled_message] #103 Disk-Full: Disk alarms are tracked by the storage team"), out);
  }

  @Test
  void missingArgumentsReturnInvalidArgs() {
    ExitCode code = AnalyzeCli.run(new String[] {CONFIG, EVENTS, "product=SEND"});
    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("Missing required argument date=..."));
    assertTrue(buffer.toString().contains("usage: analyze"));
  }

  @Test
  void malformedDateReturnsInvalidArgs() {
    ExitCode code = AnalyzeCli.run(new String[] {CONFIG, EVENTS, "product=SEND", "date=2025-06-24"});
    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("Invalid date format"));
  }

  @Test
  void unknownProductIsConfigurationError() {
    ExitCode code = AnalyzeCli.run(new String[] {CONFIG, EVENTS, "date=24-06-25", "product=BILLING"});
    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(buffer.toString().contains("Product 'BILLING' not found"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().startsWith("Configuration error")));
  }

  @Test
  void missingArchiveIsIoError() {
    ExitCode code = AnalyzeCli.run(new String[] {
        CONFIG, "events=" + tempDir.resolve("absent.json"), "date=24-06-25", "product=SEND"});
    assertEquals(ExitCode.IO_ERROR, code);
    assertTrue(buffer.toString().contains("Event archive not found"));
  }

  @Test
  void unknownMetricsModeIsRejected() {
    ExitCode code = AnalyzeCli.run(new String[] {CONFIG, EVENTS, "date=24-06-25", "product=SEND", "metrics=statsd"});
    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("metrics must be otel or none"));
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, AnalyzeCli.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("--hourly"));
  }
}
