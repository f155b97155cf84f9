package ca.gc.cra.burstsafe.domain.product;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.burstsafe.domain.burst.BurstRecord;
import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import ca.gc.cra.burstsafe.domain.burst.Polarization;
import ca.gc.cra.burstsafe.domain.burst.Swath;
import ca.gc.cra.burstsafe.testutil.BurstFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class GroupLayoutTest {
  private static final GroupKey KEY = new GroupKey(Swath.IW1, Polarization.VV);

  @Test
  void overlappingBurstsTrimLeadingLines() {
    List<BurstRecord> members = BurstFixtures.twoBurstGroup(Polarization.VV);

    GroupLayout layout = GroupLayout.of(new BurstGroup(KEY, members));

    assertEquals(3, GroupLayout.overlapLines(members.get(0), members.get(1)));
    assertEquals(17, layout.totalLines());
    assertEquals(4, layout.maxSamples());
    assertEquals(0, layout.placement(0).overlapTrim());
    assertEquals(10, layout.placement(0).usableLines());
    assertEquals(3, layout.placement(1).overlapTrim());
    assertEquals(10, layout.placement(1).lineOffset());
    assertEquals(7, layout.placement(1).usableLines());
    assertEquals(16, layout.placement(1).toGroupLine(9));
    assertEquals(BurstFixtures.BASE, layout.start());
    assertEquals(BurstFixtures.at(1600), layout.stop());
  }

  @Test
  void lineCountIsSumOfLinesMinusOverlaps() {
    BurstRecord first = BurstFixtures.burst(Swath.IW1, Polarization.VV, 1).start(BurstFixtures.at(0)).build();
    BurstRecord second = BurstFixtures.burst(Swath.IW1, Polarization.VV, 2).start(BurstFixtures.at(950)).build();
    BurstRecord third = BurstFixtures.burst(Swath.IW1, Polarization.VV, 3).start(BurstFixtures.at(1000)).build();

    GroupLayout layout = GroupLayout.of(new BurstGroup(KEY, List.of(first, second, third)));

    int overlaps = GroupLayout.overlapLines(first, second) + GroupLayout.overlapLines(second, third);
    assertEquals(30 - overlaps, layout.totalLines());
    assertEquals(0, GroupLayout.overlapLines(first, second));
    assertEquals(9, GroupLayout.overlapLines(second, third));
  }

  @Test
  void abuttingBurstsShareOneLine() {
    BurstRecord first = BurstFixtures.burst(Swath.IW1, Polarization.VV, 1).start(BurstFixtures.at(0)).build();
    BurstRecord second = BurstFixtures.burst(Swath.IW1, Polarization.VV, 2).start(BurstFixtures.at(900)).build();

    assertEquals(1, GroupLayout.overlapLines(first, second));
  }

  @Test
  void coveredBurstIsRejected() {
    BurstRecord first = BurstFixtures.burst(Swath.IW1, Polarization.VV, 1).start(BurstFixtures.at(0)).build();
    BurstRecord second = BurstFixtures.burst(Swath.IW1, Polarization.VV, 2)
        .start(BurstFixtures.at(100)).lines(3).build();

    assertThrows(IllegalArgumentException.class, () -> GroupLayout.of(new BurstGroup(KEY, List.of(first, second))));
  }

  @Test
  void groupRequiresMembersOfItsKeyInStartOrder() {
    List<BurstRecord> members = BurstFixtures.twoBurstGroup(Polarization.VV);

    assertThrows(IllegalArgumentException.class,
        () -> new BurstGroup(KEY, List.of(members.get(1), members.get(0))));
    assertThrows(IllegalArgumentException.class,
        () -> new BurstGroup(new GroupKey(Swath.IW1, Polarization.VH), members));
    assertThrows(IllegalArgumentException.class, () -> new BurstGroup(KEY, List.of()));
  }
}
