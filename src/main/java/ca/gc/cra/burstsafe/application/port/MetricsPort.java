package ca.gc.cra.burstsafe.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for merge runs.
 * <p><strong>Why:</strong> Lets the merge use case record counters and latency observations without binding to a vendor
 * SDK.</p>
 * <p><strong>Role:</strong> Output port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from group workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code merge.stitch.latencyNanos}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code merge.groups.merged}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates; useful for tests.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
