package ca.gc.cra.qaops.application.port;

import ca.gc.cra.qaops.domain.event.RawEvent;
import ca.gc.cra.qaops.domain.time.AnalysisWindow;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Supplies the raw events posted to an alarm channel within a time window.
 * <p><strong>Why:</strong> Keeps transport concerns (HTTP, paging, retries, archives) out of the analysis core.</p>
 * <p><strong>Contract:</strong> Events are returned oldest first. Implementations own any timeout and retry
 * policy.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface RawEventSource {
  /**
   * Fetches the events of one channel.
   *
   * @param channelReference channel identifier from the product configuration
   * @param window inclusive window the events must fall into
   * @return events in chronological order; never {@code null}
   * @throws IOException when the events cannot be read
   */
  List<RawEvent> fetch(String channelReference, AnalysisWindow window) throws IOException;
}
