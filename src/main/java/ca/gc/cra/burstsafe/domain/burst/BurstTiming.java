package ca.gc.cra.burstsafe.domain.burst;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Azimuth timing of one burst: first and last line times, line count and line spacing.
 *
 * @param start azimuth time of line {@code 0}
 * @param stop azimuth time of the last line; strictly after {@code start}
 * @param lines number of azimuth lines; positive
 * @param azimuthTimeInterval time between two consecutive lines; positive
 * @since 0.1.0
 */
public record BurstTiming(Instant start, Instant stop, int lines, Duration azimuthTimeInterval) {

  public BurstTiming {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(stop, "stop");
    Objects.requireNonNull(azimuthTimeInterval, "azimuthTimeInterval");
    if (!start.isBefore(stop)) {
      throw new IllegalArgumentException("start must be before stop (" + start + " >= " + stop + ")");
    }
    if (lines <= 0) {
      throw new IllegalArgumentException("lines must be positive (was " + lines + ")");
    }
    if (azimuthTimeInterval.isNegative() || azimuthTimeInterval.isZero()) {
      throw new IllegalArgumentException("azimuthTimeInterval must be positive");
    }
  }

  /**
   * Builds timing from the first line time, the stop time being {@code start + (lines - 1) * interval}.
   *
   * @param start azimuth time of line {@code 0}
   * @param lines number of lines; at least two so that start precedes stop
   * @param azimuthTimeInterval line spacing
   * @return burst timing
   */
  public static BurstTiming of(Instant start, int lines, Duration azimuthTimeInterval) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(azimuthTimeInterval, "azimuthTimeInterval");
    return new BurstTiming(start, start.plus(azimuthTimeInterval.multipliedBy(lines - 1L)), lines, azimuthTimeInterval);
  }

  /**
   * Returns the azimuth time of a burst-local line.
   *
   * @param line zero-based line index; may exceed the burst for grid points on its trailing edge
   * @return azimuth time of {@code line}
   */
  public Instant lineTime(int line) {
    return start.plus(azimuthTimeInterval.multipliedBy(line));
  }
}
