package ca.gc.cra.burstsafe.infrastructure.metrics;

import ca.gc.cra.burstsafe.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations.
 * <p>Thread-safe and stateless; used when {@code metricsExporter=none}.</p>
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {

  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
