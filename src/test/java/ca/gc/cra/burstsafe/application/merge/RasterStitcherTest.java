package ca.gc.cra.burstsafe.application.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.burstsafe.domain.burst.BurstRecord;
import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import ca.gc.cra.burstsafe.domain.burst.Polarization;
import ca.gc.cra.burstsafe.domain.burst.Swath;
import ca.gc.cra.burstsafe.domain.product.AssembledRaster;
import ca.gc.cra.burstsafe.domain.product.BurstGroup;
import ca.gc.cra.burstsafe.domain.product.GroupLayout;
import ca.gc.cra.burstsafe.domain.raster.RasterStatistics;
import ca.gc.cra.burstsafe.testutil.BurstFixtures;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class RasterStitcherTest {
  private static final GroupKey KEY = new GroupKey(Swath.IW1, Polarization.VV);
  private static final Instant CREATED = Instant.parse("2024-03-02T00:00:00Z");

  private final RasterStitcher stitcher = new RasterStitcher();

  @Test
  void laterBurstReplacesOverlapFromItsTrimmedStart() {
    BurstGroup group = new BurstGroup(KEY, BurstFixtures.twoBurstGroup(Polarization.VV));
    GroupLayout layout = GroupLayout.of(group);

    AssembledRaster assembled = stitcher.stitch(group, layout, CREATED);

    assertEquals(17, assembled.lines());
    assertEquals(4, assembled.raster().samples());
    assertEquals(List.of(0, 10), assembled.burstLineOffsets());
    assertEquals(1001f, assembled.raster().real(9, 0));
    assertEquals(9f, assembled.raster().imaginary(9, 3));
    assertEquals(1002f, assembled.raster().real(10, 0));
    assertEquals(3f, assembled.raster().imaginary(10, 0));
    assertEquals(9f, assembled.raster().imaginary(16, 2));
    assertEquals(CREATED, assembled.creationTime());
  }

  @Test
  void invalidLinesAndNarrowBurstsAreZeroFilled() {
    BurstRecord wide = BurstFixtures.burst(Swath.IW1, Polarization.VV, 1).start(BurstFixtures.at(0)).samples(6).build();
    BurstRecord narrow = BurstFixtures.burst(Swath.IW1, Polarization.VV, 2).start(BurstFixtures.at(1000))
        .invalidLines(2)
        .build();
    BurstGroup group = new BurstGroup(KEY, List.of(wide, narrow));
    GroupLayout layout = GroupLayout.of(group);

    AssembledRaster assembled = stitcher.stitch(group, layout, CREATED);

    assertEquals(20, assembled.lines());
    assertEquals(6, assembled.raster().samples());
    assertEquals(1f, assembled.raster().real(0, 5));
    assertEquals(2f, assembled.raster().real(10, 3));
    assertEquals(0f, assembled.raster().real(10, 4));
    assertEquals(0f, assembled.raster().real(12, 0));
    assertEquals(0f, assembled.raster().imaginary(12, 0));
  }

  @Test
  void statisticsCoverValidSamplesOnly() {
    BurstRecord burst = BurstFixtures.burst(Swath.IW1, Polarization.VV, 4).lines(2).samples(2).invalidLines(1).build();
    BurstGroup group = new BurstGroup(KEY, List.of(burst));

    RasterStatistics statistics = stitcher.stitch(group, GroupLayout.of(group), CREATED).statistics().orElseThrow();

    assertEquals(2, statistics.validSamples());
    assertEquals(4d, statistics.meanReal(), 1e-9);
    assertEquals(0d, statistics.meanImaginary(), 1e-9);
    assertEquals(0d, statistics.stdDevReal(), 1e-9);
  }

  @Test
  void fullyInvalidRasterHasNoStatistics() {
    BurstRecord burst = BurstFixtures.burst(Swath.IW1, Polarization.VV, 4).lines(2).invalidLines(0, 1).build();
    BurstGroup group = new BurstGroup(KEY, List.of(burst));

    AssembledRaster assembled = stitcher.stitch(group, GroupLayout.of(group), CREATED);

    assertEquals(2, assembled.lines());
    assertTrue(assembled.statistics().isEmpty());
  }

  @Test
  void layoutDisagreeingWithMembersIsAnInternalError() {
    BurstGroup group = new BurstGroup(KEY, BurstFixtures.twoBurstGroup(Polarization.VV));
    GroupLayout actual = GroupLayout.of(group);
    GroupLayout shortened = new GroupLayout(actual.placements(), 16, actual.maxSamples(), actual.start(), actual.stop());

    InternalConsistencyException ex =
        assertThrows(InternalConsistencyException.class, () -> stitcher.stitch(group, shortened, CREATED));

    assertEquals("stitch.lineOffset", ex.check());
  }
}
