package ca.gc.cra.burstsafe.application.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.burstsafe.application.render.AnnotationJsonRenderer;
import ca.gc.cra.burstsafe.domain.annotation.DocumentType;
import ca.gc.cra.burstsafe.domain.burst.AcquisitionMode;
import ca.gc.cra.burstsafe.domain.burst.Envelope;
import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import ca.gc.cra.burstsafe.domain.burst.Polarization;
import ca.gc.cra.burstsafe.domain.burst.Swath;
import ca.gc.cra.burstsafe.domain.product.AssembledRaster;
import ca.gc.cra.burstsafe.domain.product.BurstGroup;
import ca.gc.cra.burstsafe.domain.product.ComponentRole;
import ca.gc.cra.burstsafe.domain.product.GroupLayout;
import ca.gc.cra.burstsafe.domain.product.Manifest;
import ca.gc.cra.burstsafe.domain.product.ManifestComponent;
import ca.gc.cra.burstsafe.domain.product.MergedAnnotation;
import ca.gc.cra.burstsafe.domain.product.ProductIdentity;
import ca.gc.cra.burstsafe.testutil.BurstFixtures;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ManifestBuilderTest {
  private static final GroupKey KEY = new GroupKey(Swath.IW1, Polarization.VV);
  private static final Instant CREATED = Instant.parse("2024-03-02T00:00:00Z");

  private final ManifestBuilder builder = new ManifestBuilder(new AnnotationJsonRenderer());

  @Test
  void listsAnnotationsAndMeasurementPerImage() throws Exception {
    BurstGroup group = new BurstGroup(KEY, BurstFixtures.twoBurstGroup(Polarization.VV));
    GroupLayout layout = GroupLayout.of(group);
    AssembledRaster raster = new RasterStitcher().stitch(group, layout, CREATED);
    List<MergedAnnotation> annotations = new AnnotationAssembler()
        .assemble(group, layout, 1, raster.statistics(), EnumSet.of(DocumentType.PRODUCT, DocumentType.NOISE))
        .annotations();
    ProductIdentity identity = new ProductIdentityCalculator().compute(List.of(raster));

    Manifest manifest = builder.build(annotations, List.of(raster), identity, List.of(group), Map.of(KEY, 1));

    assertEquals(List.of("product-iw1-vv-001", "noise-iw1-vv-001", "measurement-iw1-vv-001"),
        manifest.components().stream().map(ManifestComponent::id).toList());
    ManifestComponent measurement = manifest.components().get(2);
    assertEquals(ComponentRole.MEASUREMENT, measurement.role());
    assertEquals(identity.rasterChecksums().get(KEY), measurement.checksum());
    assertEquals(32, manifest.components().get(0).checksum().length());
    assertEquals(AcquisitionMode.IW, manifest.summary().mode());
    assertEquals(BurstFixtures.ABSOLUTE_ORBIT, manifest.summary().absoluteOrbit());
    assertEquals(BurstFixtures.BASE, manifest.summary().start());
    assertEquals(BurstFixtures.at(1600), manifest.summary().stop());
    assertEquals(List.of(Polarization.VV), manifest.summary().polarizations());
    assertEquals(new Envelope(11, 45, 12, 46), manifest.footprint());
  }

  @Test
  void rasterWithoutImageNumberIsRejected() {
    BurstGroup group = new BurstGroup(KEY, BurstFixtures.twoBurstGroup(Polarization.VV));
    AssembledRaster raster = new RasterStitcher().stitch(group, GroupLayout.of(group), CREATED);
    ProductIdentity identity = new ProductIdentityCalculator().compute(List.of(raster));

    assertThrows(IllegalArgumentException.class,
        () -> builder.build(List.of(), List.of(raster), identity, List.of(group), Map.of()));
    assertThrows(IllegalArgumentException.class,
        () -> builder.build(List.of(), List.of(), identity, List.of(), Map.of()));
  }

  @Test
  void rasterMissingFromIdentityIsAnInternalError() {
    BurstGroup group = new BurstGroup(KEY, BurstFixtures.twoBurstGroup(Polarization.VV));
    AssembledRaster raster = new RasterStitcher().stitch(group, GroupLayout.of(group), CREATED);
    ProductIdentity empty = new ProductIdentity("0000", "", Map.of());

    assertThrows(InternalConsistencyException.class,
        () -> builder.build(List.of(), List.of(raster), empty, List.of(group), Map.of(KEY, 1)));
  }

  @Test
  void statisticsFlowIntoMergedProductAnnotation() throws Exception {
    BurstGroup group = new BurstGroup(KEY, BurstFixtures.twoBurstGroup(Polarization.VV));
    GroupLayout layout = GroupLayout.of(group);
    AssembledRaster raster = new RasterStitcher().stitch(group, layout, CREATED);

    MergedAnnotation product = new AnnotationAssembler()
        .assemble(group, layout, 1, raster.statistics(), EnumSet.of(DocumentType.PRODUCT))
        .annotations().get(0);

    assertEquals(Optional.of(String.format(Locale.ROOT, "%.6e", raster.statistics().orElseThrow().meanReal())),
        product.text("imageAnnotation/imageInformation/imageStatistics/outputDataMean/re"));
  }
}
