package ca.gc.cra.qaops.domain.alarm;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class AlarmTitleTest {

  @Test
  void parsesOpeningLine() {
    AlarmTitle title = AlarmTitle.parse("#101: ALARM: \"DB-Timeout\" in EU (Milan)").orElseThrow();
    assertEquals("101", title.id());
    assertEquals("DB-Timeout", title.name());
    assertEquals("EU (Milan)", title.location());
  }

  @Test
  void findsOpeningLineInsideLongerText() {
    String text = "Alert from CloudWatch\n#7: ALARM: \"queue-depth\" in eu-south-1\nthreshold crossed";
    AlarmTitle title = AlarmTitle.parse(text).orElseThrow();
    assertEquals("7", title.id());
    assertEquals("eu-south-1", title.location());
  }

  @Test
  void rejectsOtherText() {
    assertTrue(AlarmTitle.parse(null).isEmpty());
    assertTrue(AlarmTitle.parse("").isEmpty());
    assertTrue(AlarmTitle.parse("#101: OK: \"DB-Timeout\" in eu-south-1").isEmpty());
    assertTrue(AlarmTitle.parse("ALARM: \"DB-Timeout\" in eu-south-1").isEmpty());
  }

  @Test
  void blankIdFallsBack() {
    AlarmRecord record = new AlarmRecord(" ", "name", null, null, null);
    assertEquals(AlarmRecord.UNKNOWN_ID, record.id());
    assertEquals("", record.location());
    assertTrue(record.optionalTimestamp().isEmpty());
  }
}
