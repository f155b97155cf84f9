/**
 * <strong>Purpose:</strong> Metrics adapters behind {@link ca.gc.cra.burstsafe.application.port.MetricsPort}.
 * <p><strong>Observability:</strong> OpenTelemetry SDK with an OTLP gRPC exporter; {@code none} disables export.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.burstsafe.infrastructure.metrics;
