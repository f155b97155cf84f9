package ca.gc.cra.burstsafe.application.pipeline;

import ca.gc.cra.burstsafe.application.merge.AnnotationAssembler;
import ca.gc.cra.burstsafe.application.merge.AnnotationAssembler.AssembledAnnotations;
import ca.gc.cra.burstsafe.application.merge.AssemblyFailedException;
import ca.gc.cra.burstsafe.application.merge.BurstGrouper;
import ca.gc.cra.burstsafe.application.merge.EligibilityValidator;
import ca.gc.cra.burstsafe.application.merge.GroupFailure;
import ca.gc.cra.burstsafe.application.merge.GroupRejectedException;
import ca.gc.cra.burstsafe.application.merge.InternalConsistencyException;
import ca.gc.cra.burstsafe.application.merge.LineAxisVerifier;
import ca.gc.cra.burstsafe.application.merge.ManifestBuilder;
import ca.gc.cra.burstsafe.application.merge.MergeException;
import ca.gc.cra.burstsafe.application.merge.MergeResult;
import ca.gc.cra.burstsafe.application.merge.ProductIdentityCalculator;
import ca.gc.cra.burstsafe.application.merge.RasterStitcher;
import ca.gc.cra.burstsafe.application.merge.UnresolvedFieldWarning;
import ca.gc.cra.burstsafe.application.port.BurstSourcePort;
import ca.gc.cra.burstsafe.application.port.MetricsPort;
import ca.gc.cra.burstsafe.application.port.ProductSinkPort;
import ca.gc.cra.burstsafe.application.render.AnnotationJsonRenderer;
import ca.gc.cra.burstsafe.config.MergeConfig;
import ca.gc.cra.burstsafe.domain.burst.AcquisitionMode;
import ca.gc.cra.burstsafe.domain.burst.BurstRecord;
import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import ca.gc.cra.burstsafe.domain.burst.Polarization;
import ca.gc.cra.burstsafe.domain.burst.Swath;
import ca.gc.cra.burstsafe.domain.product.AssembledRaster;
import ca.gc.cra.burstsafe.domain.product.BurstGroup;
import ca.gc.cra.burstsafe.domain.product.GroupLayout;
import ca.gc.cra.burstsafe.domain.product.MergedAnnotation;
import ca.gc.cra.burstsafe.infrastructure.exec.ExecutorFactories;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Merges a set of single-burst products into one multi-burst product.
 * <p><strong>Why:</strong> Downstream processors expect one continuous image and one annotation set per swath and
 * polarization; this use case reconstructs that product from independently retrieved bursts.</p>
 * <p><strong>Role:</strong> Application-layer use case coordinating the merge services and the source, sink and metrics
 * ports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate product-wide eligibility, then group bursts by (swath, polarization).</li>
 *   <li>Per group: check size and contiguity, compute the layout, stitch the raster, merge annotations and cross-check
 *       line counts.</li>
 *   <li>Derive the product identity and manifest from the successful groups.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; call {@link #run()} or {@link #merge(List)} from one thread.
 * Group work may fan out to a bounded pool when {@code groupParallelism > 1}.</p>
 * <p><strong>Performance:</strong> Groups share no mutable state; results are gathered in key order so output does not
 * depend on the worker count.</p>
 * <p><strong>Observability:</strong> Emits {@code merge.*} metrics and sets MDC key {@code merge.group} during group
 * work.</p>
 *
 * @implNote Eligibility and schema failures abort only their group; internal consistency failures abort the run.
 *     Image numbers are assigned before assembly so they do not shift when a group fails.
 * @since 0.1.0
 */
public final class BurstMergeUseCase {
  private static final Logger log = LoggerFactory.getLogger(BurstMergeUseCase.class);
  private static final String MDC_GROUP = "merge.group";

  private final MergeConfig config;
  private final BurstSourcePort source;
  private final ProductSinkPort sink;
  private final MetricsPort metrics;
  private final EligibilityValidator validator;
  private final BurstGrouper grouper = new BurstGrouper();
  private final RasterStitcher stitcher = new RasterStitcher();
  private final AnnotationAssembler assembler = new AnnotationAssembler();
  private final ProductIdentityCalculator identityCalculator = new ProductIdentityCalculator();
  private final ManifestBuilder manifestBuilder;

  /**
   * Creates a merge use case.
   *
   * @param config merge options; must not be {@code null}
   * @param source supplier of input bursts; must not be {@code null}
   * @param sink receiver of the merge result; must not be {@code null}
   * @param metrics metrics port; must not be {@code null}
   */
  public BurstMergeUseCase(MergeConfig config, BurstSourcePort source, ProductSinkPort sink, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.source = Objects.requireNonNull(source, "source");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.validator = new EligibilityValidator(config.footprintToleranceDegrees(), config.contiguityTolerance());
    this.manifestBuilder = new ManifestBuilder(new AnnotationJsonRenderer());
  }

  /**
   * Loads bursts from the source, merges them and hands the result to the sink.
   *
   * @return merge result written to the sink
   * @throws Exception if loading, merging or writing fails
   */
  public MergeResult run() throws Exception {
    try (ProductSinkPort out = sink) {
      List<BurstRecord> records = source.load();
      log.info("Merging {} bursts", records.size());
      MergeResult result = merge(records);
      out.write(result);
      return result;
    } catch (Exception ex) {
      log.error("Merge run failed", ex);
      throw ex;
    }
  }

  /**
   * Merges bursts into a product.
   *
   * @param records input bursts in any order; never empty
   * @return manifest, merged annotations, rasters, warnings and per-group failures
   * @throws MergeException when product-wide eligibility fails or no group could be assembled
   * @throws InternalConsistencyException when independently computed results disagree
   * @throws IllegalArgumentException when {@code records} is empty
   */
  public MergeResult merge(List<BurstRecord> records) throws MergeException {
    Objects.requireNonNull(records, "records");
    if (records.isEmpty()) {
      throw new IllegalArgumentException("No bursts to merge");
    }
    long started = System.nanoTime();
    validator.validateProduct(records);
    List<BurstGroup> groups = grouper.group(records);
    Instant creationTime = config.creationTime().orElseGet(() -> latestStop(records));
    Set<GroupKey> metadataOnlyKeys = metadataOnlyKeys(groups);
    Map<GroupKey, Integer> imageNumbers = assignImageNumbers(groups, metadataOnlyKeys);
    log.debug("Grouped {} bursts into {} groups; creation time {}", records.size(), groups.size(), creationTime);

    List<GroupOutcome> outcomes = assembleGroups(groups, imageNumbers, creationTime);

    List<MergedGroup> merged = new ArrayList<>();
    List<GroupFailure> failures = new ArrayList<>();
    for (GroupOutcome outcome : outcomes) {
      outcome.merged().ifPresent(merged::add);
      outcome.failure().ifPresent(failures::add);
    }
    if (merged.isEmpty()) {
      throw new AssemblyFailedException(failures);
    }

    List<MergedAnnotation> annotations = new ArrayList<>();
    List<UnresolvedFieldWarning> warnings = new ArrayList<>();
    List<AssembledRaster> rasters = new ArrayList<>();
    List<BurstGroup> mergedGroups = new ArrayList<>();
    for (MergedGroup group : merged) {
      annotations.addAll(group.annotations().annotations());
      warnings.addAll(group.annotations().warnings());
      rasters.add(group.raster());
      mergedGroups.add(group.group());
    }
    for (GroupKey key : metadataOnlyKeys) {
      assembleMetadataOnly(key, merged, imageNumbers.get(key), annotations, warnings, failures);
    }
    annotations.sort(Comparator.comparing(MergedAnnotation::key).thenComparing(MergedAnnotation::type));
    for (UnresolvedFieldWarning warning : warnings) {
      metrics.increment("merge.fields.unresolved");
      log.debug("Unresolved {} field {} for {}", warning.documentType(), warning.field(), warning.key().label());
    }

    MergeResult result = new MergeResult(
        manifestBuilder.build(
            annotations, rasters, identityCalculator.compute(rasters), mergedGroups, imageNumbers),
        annotations,
        rasters,
        warnings,
        failures);
    metrics.observe("merge.run.latencyNanos", System.nanoTime() - started);
    log.info("Merged {} of {} groups into product {} ({} annotations, {} unresolved fields)",
        merged.size(), groups.size(), result.identity().uniqueId(), annotations.size(), warnings.size());
    return result;
  }

  private List<GroupOutcome> assembleGroups(
      List<BurstGroup> groups, Map<GroupKey, Integer> imageNumbers, Instant creationTime) throws MergeException {
    int parallelism = Math.min(config.groupParallelism(), groups.size());
    List<GroupOutcome> outcomes = new ArrayList<>(groups.size());
    if (parallelism <= 1) {
      for (BurstGroup group : groups) {
        outcomes.add(assembleGroup(group, imageNumbers.get(group.key()), creationTime));
      }
      return outcomes;
    }

    ExecutorService pool = ExecutorFactories.newGroupPool(parallelism, "burstsafe-group",
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
    try {
      List<Future<GroupOutcome>> futures = new ArrayList<>(groups.size());
      for (BurstGroup group : groups) {
        int imageNumber = imageNumbers.get(group.key());
        futures.add(pool.submit(() -> assembleGroup(group, imageNumber, creationTime)));
      }
      for (Future<GroupOutcome> future : futures) {
        outcomes.add(future.get());
      }
      return outcomes;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new MergeException("Interrupted while assembling groups", ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("Group assembly failed", cause);
    } finally {
      pool.shutdownNow();
    }
  }

  private GroupOutcome assembleGroup(BurstGroup group, int imageNumber, Instant creationTime) {
    String previous = MDC.get(MDC_GROUP);
    MDC.put(MDC_GROUP, group.key().label());
    try {
      if (group.size() < config.minBurstsPerGroup()) {
        throw new GroupRejectedException(group.key(), group.size(), config.minBurstsPerGroup());
      }
      validator.validateGroup(group);
      GroupLayout layout = GroupLayout.of(group);
      long stitchStarted = System.nanoTime();
      AssembledRaster raster = stitcher.stitch(group, layout, creationTime);
      metrics.observe("merge.stitch.latencyNanos", System.nanoTime() - stitchStarted);
      AssembledAnnotations annotations =
          assembler.assemble(group, layout, imageNumber, raster.statistics(), config.documentTypes());
      LineAxisVerifier.verify(group, raster, annotations.annotations());
      metrics.increment("merge.groups.merged");
      log.debug("Assembled {} bursts into {} lines x {} samples",
          group.size(), layout.totalLines(), layout.maxSamples());
      return GroupOutcome.merged(new MergedGroup(group, layout, raster, annotations));
    } catch (GroupRejectedException ex) {
      metrics.increment("merge.groups.rejected");
      log.warn("Rejected group {}: {}", group.key().label(), ex.getMessage());
      return GroupOutcome.failed(new GroupFailure(group.key(), ex));
    } catch (MergeException ex) {
      metrics.increment("merge.groups.failed");
      log.warn("Failed to assemble group {}: {}", group.key().label(), ex.getMessage());
      return GroupOutcome.failed(new GroupFailure(group.key(), ex));
    } finally {
      if (previous == null) {
        MDC.remove(MDC_GROUP);
      } else {
        MDC.put(MDC_GROUP, previous);
      }
    }
  }

  private void assembleMetadataOnly(
      GroupKey key,
      List<MergedGroup> merged,
      int imageNumber,
      List<MergedAnnotation> annotations,
      List<UnresolvedFieldWarning> warnings,
      List<GroupFailure> failures) {
    Optional<MergedGroup> donor = merged.stream()
        .filter(group -> group.group().key().polarization() == key.polarization())
        .findFirst();
    if (donor.isEmpty()) {
      log.debug("No merged {} group to source metadata for {}", key.polarization(), key.label());
      return;
    }
    MDC.put(MDC_GROUP, key.label());
    try {
      AssembledAnnotations assembled = assembler.assembleMetadataOnly(
          key, donor.get().group(), donor.get().layout(), imageNumber, config.documentTypes());
      if (assembled.annotations().isEmpty()) {
        log.debug("Donor {} carries no sibling metadata for {}", donor.get().group().key().label(), key.label());
      }
      annotations.addAll(assembled.annotations());
      warnings.addAll(assembled.warnings());
    } catch (MergeException ex) {
      metrics.increment("merge.groups.failed");
      log.warn("Failed to build metadata-only annotations for {}: {}", key.label(), ex.getMessage());
      failures.add(new GroupFailure(key, ex));
    } finally {
      MDC.remove(MDC_GROUP);
    }
  }

  private Set<GroupKey> metadataOnlyKeys(List<BurstGroup> groups) {
    Set<GroupKey> keys = new TreeSet<>();
    if (!config.includeAllAnnotations()) {
      return keys;
    }
    AcquisitionMode mode = groups.get(0).first().mode();
    EnumSet<Polarization> polarizations = EnumSet.noneOf(Polarization.class);
    Set<GroupKey> present = new TreeSet<>();
    for (BurstGroup group : groups) {
      polarizations.add(group.key().polarization());
      present.add(group.key());
    }
    for (Swath swath : mode.swaths()) {
      for (Polarization polarization : polarizations) {
        GroupKey key = new GroupKey(swath, polarization);
        if (!present.contains(key)) {
          keys.add(key);
        }
      }
    }
    return keys;
  }

  private static Map<GroupKey, Integer> assignImageNumbers(List<BurstGroup> groups, Set<GroupKey> metadataOnlyKeys) {
    TreeSet<GroupKey> keys = new TreeSet<>(metadataOnlyKeys);
    for (BurstGroup group : groups) {
      keys.add(group.key());
    }
    Map<GroupKey, Integer> numbers = new TreeMap<>();
    int next = 1;
    for (GroupKey key : keys) {
      numbers.put(key, next++);
    }
    return numbers;
  }

  private static Instant latestStop(List<BurstRecord> records) {
    Instant latest = records.get(0).stop();
    for (BurstRecord record : records) {
      if (record.stop().isAfter(latest)) {
        latest = record.stop();
      }
    }
    return latest;
  }

  private record MergedGroup(
      BurstGroup group, GroupLayout layout, AssembledRaster raster, AssembledAnnotations annotations) {}

  private record GroupOutcome(Optional<MergedGroup> merged, Optional<GroupFailure> failure) {
    static GroupOutcome merged(MergedGroup group) {
      return new GroupOutcome(Optional.of(group), Optional.empty());
    }

    static GroupOutcome failed(GroupFailure failure) {
      return new GroupOutcome(Optional.empty(), Optional.of(failure));
    }
  }
}
