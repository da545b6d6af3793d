package ca.gc.cra.qaops.application.extract;

import ca.gc.cra.qaops.domain.alarm.AlarmRecord;
import ca.gc.cra.qaops.domain.alarm.AlarmTitle;
import ca.gc.cra.qaops.domain.event.EventAttachment;
import ca.gc.cra.qaops.domain.event.RawEvent;
import java.util.Objects;
import java.util.Optional;

/**
 * Extracts CloudWatch style alarms from the first attachment. The title is searched for the alarm opening line
 * first and the fallback text second; the fallback text is kept as the record's raw text.
 *
 * @since 0.1.0
 */
public final class TitleAlarmExtractor implements MessageExtractor {
  private final ProductEnvironment productEnvironment;

  public TitleAlarmExtractor(ProductEnvironment productEnvironment) {
    this.productEnvironment = Objects.requireNonNull(productEnvironment, "productEnvironment");
  }

  @Override
  public ProductEnvironment productEnvironment() {
    return productEnvironment;
  }

  @Override
  public Optional<AlarmRecord> extract(RawEvent event) {
    Objects.requireNonNull(event, "event");
    Optional<EventAttachment> first = event.firstAttachment();
    if (first.isEmpty()) {
      return Optional.empty();
    }
    EventAttachment attachment = first.get();
    String fallback = attachment.fallback() == null ? "" : attachment.fallback();
    Optional<AlarmTitle> title = AlarmTitle.parse(attachment.title()).or(() -> AlarmTitle.parse(fallback));
    return title.map(parsed -> new AlarmRecord(
        parsed.id(), parsed.name(), parsed.location(), MessageExtractor.timestampOf(event), fallback));
  }

  @Override
  public String toString() {
    return "TitleAlarmExtractor(" + productEnvironment + ")";
  }
}
