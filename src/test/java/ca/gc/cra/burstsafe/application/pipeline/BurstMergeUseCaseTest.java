package ca.gc.cra.burstsafe.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.burstsafe.application.merge.AssemblyFailedException;
import ca.gc.cra.burstsafe.application.merge.EligibilityException;
import ca.gc.cra.burstsafe.application.merge.EligibilityRule;
import ca.gc.cra.burstsafe.application.merge.GroupFailure;
import ca.gc.cra.burstsafe.application.merge.GroupRejectedException;
import ca.gc.cra.burstsafe.application.merge.MergeResult;
import ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas;
import ca.gc.cra.burstsafe.application.port.ProductSinkPort;
import ca.gc.cra.burstsafe.application.render.AnnotationJsonRenderer;
import ca.gc.cra.burstsafe.application.render.ManifestJsonRenderer;
import ca.gc.cra.burstsafe.config.MergeConfig;
import ca.gc.cra.burstsafe.domain.annotation.DocumentType;
import ca.gc.cra.burstsafe.domain.burst.BurstRecord;
import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import ca.gc.cra.burstsafe.domain.burst.Polarization;
import ca.gc.cra.burstsafe.domain.burst.Swath;
import ca.gc.cra.burstsafe.domain.product.AssembledRaster;
import ca.gc.cra.burstsafe.domain.product.ComponentRole;
import ca.gc.cra.burstsafe.domain.product.ManifestComponent;
import ca.gc.cra.burstsafe.domain.product.MergedAnnotation;
import ca.gc.cra.burstsafe.testutil.BurstFixtures;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class BurstMergeUseCaseTest {
  private static final GroupKey IW1_VV = new GroupKey(Swath.IW1, Polarization.VV);

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void twoOverlappingBurstsMergeIntoSeventeenLines() throws Exception {
    MergeResult result = useCase(Map.of()).merge(BurstFixtures.twoBurstGroup(Polarization.VV));

    assertEquals(1, result.rasters().size());
    AssembledRaster raster = result.rasters().get(0);
    assertEquals(17, raster.lines());
    assertEquals(BurstFixtures.at(1600), raster.creationTime());
    assertEquals(4, result.annotations().size());
    MergedAnnotation product = result.annotations().get(0);
    assertEquals(DocumentType.PRODUCT, product.type());
    assertEquals("17", product.text(AnnotationSchemas.NUMBER_OF_LINES).orElseThrow());
    assertEquals(5, result.manifest().components().size());
    assertEquals("measurement-iw1-vv-001", result.manifest().components().get(4).id());
    assertTrue(result.failures().isEmpty());
    assertFalse(result.warnings().isEmpty());
    assertEquals(1, metrics.count("merge.groups.merged"));
    assertEquals(result.warnings().size(), metrics.count("merge.fields.unresolved"));
    assertEquals(1, metrics.observed("merge.stitch.latencyNanos").size());
    assertEquals(1, metrics.observed("merge.run.latencyNanos").size());
  }

  @Test
  void absoluteOrbitMismatchFailsBeforeGrouping() {
    List<BurstRecord> records = List.of(
        BurstFixtures.burst(Swath.IW1, Polarization.VV, 1001).build(),
        BurstFixtures.burst(Swath.IW1, Polarization.VV, 1002)
            .start(BurstFixtures.at(700)).absoluteOrbit(50_001).build());

    EligibilityException ex = assertThrows(EligibilityException.class, () -> useCase(Map.of()).merge(records));

    assertEquals(EligibilityRule.SAME_ABSOLUTE_ORBIT, ex.rule());
    assertEquals(0, metrics.count("merge.groups.merged"));
  }

  @Test
  void undersizedGroupIsRejectedWhileOthersMerge() throws Exception {
    List<BurstRecord> records = new ArrayList<>(BurstFixtures.twoBurstGroup(Polarization.VV));
    records.add(BurstFixtures.burst(Swath.IW2, Polarization.VV, 2001).start(BurstFixtures.at(300)).build());

    MergeResult result = useCase(Map.of("minBurstsPerGroup", "2")).merge(records);

    assertEquals(1, result.rasters().size());
    assertEquals(IW1_VV, result.rasters().get(0).key());
    assertEquals(1, result.failures().size());
    GroupFailure failure = result.failures().get(0);
    assertEquals(new GroupKey(Swath.IW2, Polarization.VV), failure.key());
    GroupRejectedException rejected = assertInstanceOf(GroupRejectedException.class, failure.cause());
    assertEquals(1, rejected.memberCount());
    assertEquals(2, rejected.minimum());
    assertEquals(1, metrics.count("merge.groups.rejected"));
    assertEquals(List.of(Swath.IW1), result.manifest().summary().swaths());
  }

  @Test
  void everyGroupRejectedFailsTheRun() {
    List<BurstRecord> records = List.of(BurstFixtures.burst(Swath.IW1, Polarization.VV, 1001).build());

    AssemblyFailedException ex = assertThrows(AssemblyFailedException.class,
        () -> useCase(Map.of("minBurstsPerGroup", "2")).merge(records));

    assertEquals(1, ex.failures().size());
  }

  @Test
  void discontiguousGroupFailsAlone() throws Exception {
    List<BurstRecord> records = new ArrayList<>(BurstFixtures.twoBurstGroup(Polarization.VV));
    records.add(BurstFixtures.burst(Swath.IW2, Polarization.VV, 2001).build());
    records.add(BurstFixtures.burst(Swath.IW2, Polarization.VV, 2003).start(BurstFixtures.at(700)).build());

    MergeResult result = useCase(Map.of()).merge(records);

    assertEquals(1, result.rasters().size());
    EligibilityException cause = assertInstanceOf(EligibilityException.class, result.failures().get(0).cause());
    assertEquals(EligibilityRule.CONTIGUITY, cause.rule());
    assertEquals(1, metrics.count("merge.groups.failed"));
  }

  @Test
  void outputIsIndependentOfInputOrderAndParallelism() throws Exception {
    List<BurstRecord> records = new ArrayList<>();
    for (Polarization polarization : List.of(Polarization.VV, Polarization.VH)) {
      for (Swath swath : List.of(Swath.IW1, Swath.IW2, Swath.IW3)) {
        records.add(BurstFixtures.burst(swath, polarization, 100L * swath.number() + 1).build());
        records.add(BurstFixtures.burst(swath, polarization, 100L * swath.number() + 2)
            .start(BurstFixtures.at(700)).build());
      }
    }
    MergeResult sequential = useCase(Map.of()).merge(records);

    List<BurstRecord> shuffled = new ArrayList<>(records);
    Collections.shuffle(shuffled, new Random(7));
    MergeResult parallel = useCase(Map.of("groupParallelism", "4")).merge(shuffled);

    assertEquals(6, sequential.rasters().size());
    assertEquals(sequential.identity(), parallel.identity());
    assertArrayEquals(render(sequential), render(parallel));
  }

  @Test
  void includeAllAddsMetadataOnlyAnnotationsForMissingSwaths() throws Exception {
    List<BurstRecord> records = List.of(
        BurstFixtures.burst(Swath.IW1, Polarization.VV, 1001).siblings(Swath.IW2, Swath.IW3).build(),
        BurstFixtures.burst(Swath.IW1, Polarization.VV, 1002).start(BurstFixtures.at(700))
            .siblings(Swath.IW2, Swath.IW3).build());

    MergeResult result = useCase(Map.of("includeAllAnnotations", "true")).merge(records);

    assertEquals(12, result.annotations().size());
    assertEquals(1, result.rasters().size());
    Map<GroupKey, Integer> imageNumbers = new HashMap<>();
    for (MergedAnnotation annotation : result.annotations()) {
      imageNumbers.put(annotation.key(), annotation.imageNumber());
      assertEquals(!annotation.key().equals(IW1_VV), annotation.metadataOnly());
    }
    assertEquals(Map.of(
        IW1_VV, 1,
        new GroupKey(Swath.IW2, Polarization.VV), 2,
        new GroupKey(Swath.IW3, Polarization.VV), 3), imageNumbers);
    long measurements = result.manifest().components().stream()
        .filter(component -> component.role() == ComponentRole.MEASUREMENT)
        .count();
    assertEquals(1, measurements);
    assertEquals("product-iw3-vv-003", result.manifest().components().stream()
        .map(ManifestComponent::id)
        .filter(id -> id.startsWith("product-iw3"))
        .findFirst()
        .orElseThrow());
  }

  @Test
  void fixedCreationTimeIsUsed() throws Exception {
    MergeResult result = useCase(Map.of("creationTime", "2030-01-01T00:00:00Z"))
        .merge(BurstFixtures.twoBurstGroup(Polarization.VV));

    assertEquals(Instant.parse("2030-01-01T00:00:00Z"), result.rasters().get(0).creationTime());
  }

  @Test
  void emptyInputIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> useCase(Map.of()).merge(List.of()));
  }

  @Test
  void runLoadsMergesWritesAndClosesSink() throws Exception {
    RecordingSink sink = new RecordingSink();
    BurstMergeUseCase useCase = new BurstMergeUseCase(
        config(Map.of()), () -> BurstFixtures.twoBurstGroup(Polarization.HH), sink, metrics);

    MergeResult result = useCase.run();

    assertSame(result, sink.written);
    assertTrue(sink.closed);
  }

  @Test
  void runClosesSinkWhenSourceFails() {
    RecordingSink sink = new RecordingSink();
    BurstMergeUseCase useCase = new BurstMergeUseCase(config(Map.of()), () -> {
      throw new IOException("catalog unavailable");
    }, sink, metrics);

    assertThrows(IOException.class, useCase::run);
    assertTrue(sink.closed);
  }

  private BurstMergeUseCase useCase(Map<String, String> options) {
    return new BurstMergeUseCase(config(options), List::of, new RecordingSink(), metrics);
  }

  private static MergeConfig config(Map<String, String> options) {
    Map<String, String> effective = new HashMap<>(options);
    effective.putIfAbsent("metricsExporter", "none");
    return MergeConfig.fromMap(effective);
  }

  private static byte[] render(MergeResult result) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    AnnotationJsonRenderer annotations = new AnnotationJsonRenderer();
    for (MergedAnnotation annotation : result.annotations()) {
      out.writeBytes(annotations.render(annotation));
    }
    out.writeBytes(new ManifestJsonRenderer().render(result.manifest()));
    return out.toByteArray();
  }

  private static final class RecordingSink implements ProductSinkPort {
    private MergeResult written;
    private boolean closed;

    @Override
    public void write(MergeResult result) {
      written = result;
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
