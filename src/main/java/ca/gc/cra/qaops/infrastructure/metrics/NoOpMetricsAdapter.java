package ca.gc.cra.qaops.infrastructure.metrics;

import ca.gc.cra.qaops.application.port.MetricsPort;

/**
 * Metrics adapter that discards all updates. Selected by the CLI when metrics are disabled.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
