package ca.gc.cra.qaops.testutil;

import ca.gc.cra.qaops.domain.event.EventAttachment;
import ca.gc.cra.qaops.domain.event.EventFile;
import ca.gc.cra.qaops.domain.event.RawEvent;
import java.time.Instant;

/** Builders for raw events used across tests. */
public final class Events {
  private Events() {}

  public static RawEvent titled(Instant at, String id, String name) {
    return titled(at, id, name, name + " fired");
  }

  public static RawEvent titled(Instant at, String id, String name, String fallback) {
    String title = "#" + id + ": ALARM: \"" + name + "\" in eu-south-1";
    return RawEvent.withAttachment(ts(at), EventAttachment.of(title, fallback, null));
  }

  public static RawEvent file(Instant at, String id, String fileName, String plainText) {
    return RawEvent.withFile(ts(at), EventFile.of(fileName, id, plainText));
  }

  public static String ts(Instant at) {
    return at == null ? null : at.getEpochSecond() + "." + String.format("%06d", at.getNano() / 1000);
  }
}
