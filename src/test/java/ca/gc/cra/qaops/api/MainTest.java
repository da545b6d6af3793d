package ca.gc.cra.qaops.api;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.qaops.logging.LoggingConfigurator;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
    LoggingConfigurator.resetLogging();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: qaops <analyze|kpi>"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"report"}));
  }

  @Test
  void helpWithoutCommandListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("Commands:"));
  }

  @Test
  void helpAfterCommandIsForwarded() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"kpi", "--help"}));
    assertTrue(buffer.toString().contains("QAOps daily KPI collection"));
  }

  @Test
  void dispatchesAnalyzeWithOptionsAndFlags() {
    ExitCode code = Main.run(new String[] {
        "--verbose",
        "analyze",
        "config=src/test/resources/config/base.yaml",
        "events=src/test/resources/events/history.json",
        "date=24-06-25",
        "product=INTEROP"});
    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Total alarms: 2 | Analyzable: 1 | Ignored: 1"), buffer.toString());
    assertTrue(buffer.toString().contains(" - [file_attachment] #F2 AWS Notification Message"));
  }
}
