package ca.gc.cra.burstsafe.domain.burst;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.burstsafe.domain.annotation.AnnotationTimes;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class BurstIdCalculatorTest {
  private static final Instant IW_SENSING = AnnotationTimes.parse("2023-04-22T18:46:39.515927");
  private static final Instant IW_ANX = AnnotationTimes.parse("2023-04-22T17:03:10.235250");
  private static final Instant EW_SENSING = AnnotationTimes.parse("2022-10-10T14:32:29.345783");
  private static final Instant EW_ANX = AnnotationTimes.parse("2022-10-10T14:02:11.848637");

  @Test
  void iwBurstAfterNominalOrbitUsesStopOrbit() {
    BurstIdCalculator.Result result =
        BurstIdCalculator.calculate(IW_SENSING, IW_ANX, 48213, 48213, Swath.IW2);

    assertEquals(103556001L, result.burstNumber());
    assertEquals(48213, result.orbitNumber());
  }

  @Test
  void iwBurstOnRelativeOrbit() {
    BurstIdCalculator.Result result = BurstIdCalculator.calculate(IW_SENSING, IW_ANX, 16, 16, Swath.IW2);

    assertEquals(32322L, result.burstNumber());
    assertEquals(16, result.orbitNumber());
  }

  @Test
  void ewBurstKeepsStartOrbit() {
    assertEquals(88487688L,
        BurstIdCalculator.calculate(EW_SENSING, EW_ANX, 45381, 45381, Swath.EW5).burstNumber());

    BurstIdCalculator.Result relative = BurstIdCalculator.calculate(EW_SENSING, EW_ANX, 159, 159, Swath.EW5);
    assertEquals(308684L, relative.burstNumber());
    assertEquals(159, relative.orbitNumber());
  }

  @Test
  void burstIdCarriesSwathAndOrbit() {
    BurstId id = BurstIdCalculator.burstId(IW_SENSING, IW_ANX, 16, 16, Swath.IW2);

    assertEquals(new BurstId(16, Swath.IW2, 32322L), id);
    assertEquals("t016_032322_iw2", id.toString());
  }

  @Test
  void burstIdRejectsOrbitOutsideCycle() {
    assertThrows(IllegalArgumentException.class, () -> new BurstId(176, Swath.IW1, 1));
    assertThrows(IllegalArgumentException.class, () -> new BurstId(12, Swath.IW1, 0));
  }
}
