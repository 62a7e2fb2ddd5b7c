package ca.gc.cra.rulesync.application.port;

/**
 * <strong>What:</strong> Port abstracting RULESYNC metrics emission.
 * <p><strong>Why:</strong> Lets the fetcher, merge engine and sync use case record counters and observations
 * without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} discards everything.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from download workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code fetch.cache.hit},
 * {@code fetch.latencyMillis}, {@code ruleset.success}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (milliseconds, bytes, counts) as defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
