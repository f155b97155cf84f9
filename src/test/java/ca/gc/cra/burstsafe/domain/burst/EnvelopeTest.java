package ca.gc.cra.burstsafe.domain.burst;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class EnvelopeTest {

  @Test
  void footprintEnvelopeSpansAllPoints() {
    Footprint footprint = new Footprint(List.of(
        new GeoPoint(10.5, 45.0), new GeoPoint(11.0, 45.5), new GeoPoint(10.0, 46.0)));

    assertEquals(new Envelope(10.0, 45.0, 11.0, 46.0), footprint.envelope());
  }

  @Test
  void unionAndToleranceMatch() {
    Envelope west = new Envelope(10, 45, 11, 46);
    Envelope east = new Envelope(10.5, 45, 12, 46);

    assertEquals(new Envelope(10, 45, 12, 46), west.union(east));
    assertTrue(west.matches(new Envelope(10.005, 45, 11, 46.005), 0.01));
    assertFalse(west.matches(east, 0.01));
  }

  @Test
  void footprintNeedsThreePoints() {
    assertThrows(IllegalArgumentException.class,
        () -> new Footprint(List.of(new GeoPoint(0, 0), new GeoPoint(1, 1))));
  }
}
