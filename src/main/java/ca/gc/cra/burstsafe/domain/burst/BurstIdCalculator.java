package ca.gc.cra.burstsafe.domain.burst;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Derives ESA burst numbers from sensing time, ascending-node time and orbit number.
 * <p><strong>Why:</strong> Burst identity must be a deterministic function of geometry and orbit so that the same
 * physical burst always maps to the same id, regardless of which product it was extracted from.</p>
 * <p><strong>Role:</strong> Domain service used by loaders when materializing {@link BurstRecord}s.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @implNote Implements Sentinel-1 Level 1 Detailed Algorithm Definition eq. 9-89 and 9-91. Burst timing is referred to
 * the middle of the central sub-swath (IW2, EW3). IW acquisitions may cross the ascending node mid-frame, so the orbit
 * number of the result is chosen from the start/stop orbit pair.
 * @since 0.1.0
 */
public final class BurstIdCalculator {
  /** Number of relative orbits in the repeat cycle. */
  public static final int RELATIVE_ORBITS = 175;

  /** Nominal orbit duration in seconds: 12 days over 175 orbits. */
  static final double NOMINAL_ORBIT_SECONDS = 12d * 24d * 3600d / RELATIVE_ORBITS;

  private BurstIdCalculator() {
    // Utility
  }

  /**
   * Result of a burst number computation.
   *
   * @param burstNumber ESA burst number
   * @param orbitNumber orbit number the burst belongs to (start or stop orbit for equator-crossing frames)
   */
  public record Result(long burstNumber, int orbitNumber) {}

  /**
   * Computes the ESA burst number of a burst.
   *
   * @param sensingTime sensing time of the first line of the burst
   * @param ascendingNodeTime time of the ascending node prior to the scene start
   * @param orbitNumberStart orbit number (relative or absolute) at the start of the acquisition
   * @param orbitNumberStop orbit number at the end of the acquisition; equal to start unless the frame crosses the equator
   * @param swath sub-swath the burst was imaged in
   * @return burst number and owning orbit number
   */
  public static Result calculate(
      Instant sensingTime,
      Instant ascendingNodeTime,
      int orbitNumberStart,
      int orbitNumberStop,
      Swath swath) {
    Objects.requireNonNull(sensingTime, "sensingTime");
    Objects.requireNonNull(ascendingNodeTime, "ascendingNodeTime");
    Objects.requireNonNull(swath, "swath");
    AcquisitionMode mode = swath.mode();
    double sinceNode = seconds(Duration.between(ascendingNodeTime, sensingTime));

    double firstSwathStart = sinceNode;
    for (int i = 0; i < swath.number() - 1; i++) {
      firstSwathStart -= mode.interSwathSeconds(i);
    }
    // Middle of the central sub-swath is the middle of the whole burst cycle.
    int centre = mode == AcquisitionMode.IW ? 2 : 3;
    double firstToCentreMid = mode.interSwathSeconds(centre - 1) / 2d;
    for (int i = 0; i < centre - 1; i++) {
      firstToCentreMid += mode.interSwathSeconds(i);
    }
    double timeSinceNode = firstSwathStart + firstToCentreMid;

    int orbitNumber = orbitNumberStart;
    if (mode == AcquisitionMode.IW && firstSwathStart - NOMINAL_ORBIT_SECONDS >= 0) {
      orbitNumber = orbitNumberStop;
      boolean crossesNode = orbitNumberStop == orbitNumberStart + 1
          || (orbitNumberStop == 1 && orbitNumberStart == RELATIVE_ORBITS);
      if (!crossesNode) {
        timeSinceNode -= NOMINAL_ORBIT_SECONDS;
      }
    }

    double sinceCycleStart = timeSinceNode + (orbitNumberStart - 1) * NOMINAL_ORBIT_SECONDS;
    long burstNumber = 1 + (long) Math.floor(
        (sinceCycleStart - mode.preambleSeconds()) / mode.beamCycleSeconds());
    return new Result(burstNumber, orbitNumber);
  }

  /**
   * Builds a {@link BurstId} for a burst on a relative orbit track.
   *
   * @param sensingTime sensing time of the first line of the burst
   * @param ascendingNodeTime time of the ascending node prior to the scene start
   * @param relativeOrbitStart relative orbit at the acquisition start
   * @param relativeOrbitStop relative orbit at the acquisition end
   * @param swath sub-swath of the burst
   * @return burst identity
   */
  public static BurstId burstId(
      Instant sensingTime,
      Instant ascendingNodeTime,
      int relativeOrbitStart,
      int relativeOrbitStop,
      Swath swath) {
    Result result = calculate(sensingTime, ascendingNodeTime, relativeOrbitStart, relativeOrbitStop, swath);
    return new BurstId(result.orbitNumber(), swath, result.burstNumber());
  }

  private static double seconds(Duration duration) {
    return duration.getSeconds() + duration.getNano() / 1_000_000_000d;
  }
}
