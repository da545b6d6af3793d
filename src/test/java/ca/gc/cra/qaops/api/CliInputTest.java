package ca.gc.cra.qaops.api;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesFlagsFromOptions() {
    CliInput input = CliInput.parse(new String[] {"product=SEND", "--HOURLY", "-v", "date=24-06-25"});
    assertArrayEquals(new String[] {"product=SEND", "date=24-06-25"}, input.keyValueArgs());
    assertTrue(input.verbose());
    assertTrue(input.hasFlag("--hourly"));
    assertFalse(input.help());
  }

  @Test
  void recognisesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"--debug"}).verbose());
    assertEquals(0, CliInput.parse(null).keyValueArgs().length);
  }

  @Test
  void dashedOptionWithValueIsKept() {
    CliInput input = CliInput.parse(new String[] {"--events=history.json"});
    assertArrayEquals(new String[] {"--events=history.json"}, input.keyValueArgs());
  }
}
