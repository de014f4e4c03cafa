package ca.gc.cra.lattice.application.port;

/**
 * <strong>What:</strong> Port abstracting lattice client metrics emission.
 * <p><strong>Why:</strong> Lets the collector and transports record counters and latencies without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter} and {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from collector, watcher
 * and transport threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code query.hosts.latencyMs}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code query.decode.failed}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., milliseconds, reply counts)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
