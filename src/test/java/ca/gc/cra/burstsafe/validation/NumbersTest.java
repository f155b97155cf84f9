package ca.gc.cra.burstsafe.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsInclusiveBounds() {
    assertEquals(1L, Numbers.requireRange("groupParallelism", 1L, 1L, 64L));
    assertEquals(64L, Numbers.requireRange("groupParallelism", 64L, 1L, 64L));
    assertEquals(0.0, Numbers.requireRange("tolerance", 0.0, 0.0, 10.0));
  }

  @Test
  void requireRangeRejectsOutOfBounds() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("groupParallelism", 65L, 1L, 64L));
    assertEquals("groupParallelism must be between 1 and 64 (was 65)", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("tolerance", Double.NaN, 0.0, 10.0));
  }

  @Test
  void parseRejectsNonNumericText() {
    assertEquals(-7L, Numbers.parseLong("minBursts", " -7 "));
    assertEquals(0.25, Numbers.parseDouble("tolerance", "0.25"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseLong("minBursts", "1.5"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseDouble("tolerance", "wide"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseLong("minBursts", ""));
  }
}
