package ca.gc.cra.qaops.application.port;

/**
 * <strong>What:</strong> Port abstracting analyzer metrics emission.
 * <p><strong>Why:</strong> Lets the aggregator count alarms and skips without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for alarm outcomes (total, ignored, analyzable, on-call).</li>
 *   <li>Record numeric observations such as batch sizes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent updates when alarm types are
 * analyzed in parallel.</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code analysis.alarms.ignored}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value, semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that drops all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
