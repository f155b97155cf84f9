package ca.gc.cra.burstsafe.config;

import ca.gc.cra.burstsafe.application.pipeline.BurstMergeUseCase;
import ca.gc.cra.burstsafe.application.port.BurstSourcePort;
import ca.gc.cra.burstsafe.application.port.MetricsPort;
import ca.gc.cra.burstsafe.application.port.ProductSinkPort;
import ca.gc.cra.burstsafe.application.render.AnnotationJsonRenderer;
import ca.gc.cra.burstsafe.application.render.ManifestJsonRenderer;
import ca.gc.cra.burstsafe.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.burstsafe.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.burstsafe.infrastructure.persistence.DirectoryProductSinkAdapter;
import ca.gc.cra.burstsafe.logging.LoggingConfigurator;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the merge use case to concrete adapters.
 * <p><strong>Why:</strong> Keeps the translation from configuration to a runnable pipeline in one place.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning source, merge and sink.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Apply logging verbosity.</li>
 *   <li>Select the metrics adapter from {@code metricsExporter}.</li>
 *   <li>Construct merge use cases and directory sinks.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable configuration; factory methods are not synchronized.</p>
 * <p><strong>Observability:</strong> Exposes the shared metrics port so callers can close it after the run.</p>
 *
 * @since 0.1.0
 * @see BurstMergeUseCase
 */
public final class CompositionRoot {
  private final MergeConfig config;
  private final MetricsPort metrics;

  /**
   * Creates a composition root whose metrics adapter follows {@link MergeConfig#metricsExporter()}.
   *
   * @param config merge configuration; must not be {@code null}
   */
  public CompositionRoot(MergeConfig config) {
    this(config, metricsFor(Objects.requireNonNull(config, "config")));
  }

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param config merge configuration; must not be {@code null}
   * @param metrics metrics adapter used by constructed use cases; must not be {@code null}
   */
  public CompositionRoot(MergeConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (config.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
  }

  /**
   * @return configuration this root was built from
   */
  public MergeConfig config() {
    return config;
  }

  /**
   * @return metrics adapter shared by every use case built here
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds a merge use case reading from {@code source} and writing to {@code sink}.
   *
   * @param source burst supplier; must not be {@code null}
   * @param sink product receiver; must not be {@code null}
   * @return merge use case
   */
  public BurstMergeUseCase mergeUseCase(BurstSourcePort source, ProductSinkPort sink) {
    return new BurstMergeUseCase(config, source, sink, metrics);
  }

  /**
   * Builds a sink writing the product into {@code outputDirectory}.
   *
   * @param outputDirectory product directory; created on first write
   * @return directory sink
   */
  public ProductSinkPort directorySink(Path outputDirectory) {
    return new DirectoryProductSinkAdapter(outputDirectory, new AnnotationJsonRenderer(), new ManifestJsonRenderer());
  }

  static MetricsPort metricsFor(MergeConfig config) {
    if ("none".equals(config.metricsExporter().toLowerCase(Locale.ROOT))) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter(
        config.metricsExporter(), config.otelEndpoint(), config.otelResourceAttributes());
  }
}
