package ca.gc.cra.qaops.api;

import static org.junit.jupiter.api.Assertions.*;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KpiCliTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void printsOneRowPerProductEnvironmentAndDay() {
    ExitCode code = KpiCli.run(new String[] {
        "config=src/test/resources/config/base.yaml",
        "events=src/test/resources/events/history.json",
        "dates=24-06-25"});

    assertEquals(ExitCode.SUCCESS, code);
    String[] lines = buffer.toString().strip().split("\\R");
    assertEquals(4, lines.length, buffer.toString());
    assertTrue(lines[0].startsWith("PRODUCT"));
    assertTrue(lines[1].matches("SEND\\s+prod\\s+24-06-2025\\s+8\\s+5\\s+3\\s+3\\s+2"), lines[1]);
    assertTrue(lines[2].matches("SEND\\s+uat\\s+24-06-2025\\s+FAILED: .*not a list"), lines[2]);
    assertTrue(lines[3].matches("INTEROP\\s+prod\\s+24-06-2025\\s+2\\s+1\\s+1\\s+0\\s+0"), lines[3]);
  }

  @Test
  void missingDatesReturnInvalidArgs() {
    ExitCode code = KpiCli.run(new String[] {"events=history.json"});
    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: kpi"));
  }

  @Test
  void missingConfigurationIsIoError() {
    ExitCode code = KpiCli.run(new String[] {
        "config=src/test/resources/config/absent.yaml", "events=history.json", "dates=24-06-25"});
    assertEquals(ExitCode.IO_ERROR, code);
    assertTrue(buffer.toString().contains("Configuration file not found"));
  }
}
