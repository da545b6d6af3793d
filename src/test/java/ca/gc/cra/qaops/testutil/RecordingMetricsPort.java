package ca.gc.cra.qaops.testutil;

import ca.gc.cra.qaops.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Metrics double that keeps counters and observations in memory. */
public final class RecordingMetricsPort implements MetricsPort {
  private final Map<String, Long> counters = new HashMap<>();
  private final Map<String, List<Long>> observations = new HashMap<>();

  @Override
  public synchronized void increment(String key) {
    counters.merge(key, 1L, Long::sum);
  }

  @Override
  public synchronized void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
  }

  public synchronized long count(String key) {
    return counters.getOrDefault(key, 0L);
  }

  public synchronized List<Long> observed(String key) {
    return List.copyOf(observations.getOrDefault(key, List.of()));
  }
}
