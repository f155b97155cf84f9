package ca.gc.cra.burstsafe.application.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.burstsafe.domain.burst.BurstRecord;
import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import ca.gc.cra.burstsafe.domain.burst.Polarization;
import ca.gc.cra.burstsafe.domain.burst.Swath;
import ca.gc.cra.burstsafe.domain.product.AssembledRaster;
import ca.gc.cra.burstsafe.domain.product.BurstGroup;
import ca.gc.cra.burstsafe.domain.product.GroupLayout;
import ca.gc.cra.burstsafe.domain.product.ProductIdentity;
import ca.gc.cra.burstsafe.testutil.BurstFixtures;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProductIdentityCalculatorTest {
  private static final Instant CREATED = Instant.parse("2024-03-02T00:00:00Z");

  private final ProductIdentityCalculator calculator = new ProductIdentityCalculator();

  @Test
  void identityDependsOnContentNotOrder() {
    AssembledRaster vv = raster(Polarization.VV, CREATED);
    AssembledRaster vh = raster(Polarization.VH, CREATED);

    ProductIdentity forward = calculator.compute(List.of(vv, vh));
    ProductIdentity backward = calculator.compute(List.of(vh, vv));

    assertEquals(forward, backward);
    assertTrue(forward.uniqueId().matches("[0-9A-F]{4}"));
    assertEquals(64, forward.contentDigest().length());
    assertEquals(2, forward.rasterChecksums().size());
    assertEquals(HexFormat.of().formatHex(ProductIdentityCalculator.rasterChecksum(vv)),
        forward.rasterChecksums().get(new GroupKey(Swath.IW1, Polarization.VV)));
  }

  @Test
  void uniqueIdIsCrcOfContentDigest() {
    ProductIdentity identity = calculator.compute(List.of(raster(Polarization.VV, CREATED)));

    int crc = Crc16.ccittFalse(HexFormat.of().parseHex(identity.contentDigest()));
    assertEquals(String.format("%04X", crc), identity.uniqueId());
  }

  @Test
  void creationTimeChangesChecksum() {
    ProductIdentity first = calculator.compute(List.of(raster(Polarization.VV, CREATED)));
    ProductIdentity second = calculator.compute(List.of(raster(Polarization.VV, CREATED.plusSeconds(1))));

    assertNotEquals(first.contentDigest(), second.contentDigest());
  }

  @Test
  void singleSampleChangesChecksumAndDigest() {
    GroupKey key = new GroupKey(Swath.IW1, Polarization.VV);
    BurstRecord first = BurstFixtures.burst(Swath.IW1, Polarization.VV, 1001).start(BurstFixtures.at(0)).build();
    BurstRecord second = BurstFixtures.burst(Swath.IW1, Polarization.VV, 1002).start(BurstFixtures.at(700)).build();
    BurstRecord flipped = BurstFixtures.burst(Swath.IW1, Polarization.VV, 1002).start(BurstFixtures.at(700))
        .sample(5, 2, -1002f)
        .build();
    BurstGroup original = new BurstGroup(key, List.of(first, second));
    BurstGroup altered = new BurstGroup(key, List.of(first, flipped));

    ProductIdentity before = calculator.compute(List.of(
        new RasterStitcher().stitch(original, GroupLayout.of(original), CREATED)));
    ProductIdentity after = calculator.compute(List.of(
        new RasterStitcher().stitch(altered, GroupLayout.of(altered), CREATED)));

    assertNotEquals(before.contentDigest(), after.contentDigest());
    assertNotEquals(before.rasterChecksums().get(key), after.rasterChecksums().get(key));
  }

  private static AssembledRaster raster(Polarization polarization, Instant creationTime) {
    BurstGroup group = new BurstGroup(
        new GroupKey(Swath.IW1, polarization), BurstFixtures.twoBurstGroup(polarization));
    return new RasterStitcher().stitch(group, GroupLayout.of(group), creationTime);
  }
}
