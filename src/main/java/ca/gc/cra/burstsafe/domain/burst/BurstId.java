package ca.gc.cra.burstsafe.domain.burst;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Stable identity of a physical burst: relative orbit track, swath and along-track burst number.
 * <p><strong>Why:</strong> Used as the deterministic tie-breaker when ordering bursts and as structured context in
 * eligibility and schema errors.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param relativeOrbit relative orbit track in {@code [1, 175]}
 * @param swath sub-swath the burst was imaged in
 * @param burstNumber ESA burst number along the track; positive
 * @since 0.1.0
 * @see BurstIdCalculator
 */
public record BurstId(int relativeOrbit, Swath swath, long burstNumber) implements Comparable<BurstId> {
  private static final Comparator<BurstId> ORDER = Comparator
      .comparingInt(BurstId::relativeOrbit)
      .thenComparing(BurstId::swath)
      .thenComparingLong(BurstId::burstNumber);

  public BurstId {
    Objects.requireNonNull(swath, "swath");
    if (relativeOrbit < 1 || relativeOrbit > BurstIdCalculator.RELATIVE_ORBITS) {
      throw new IllegalArgumentException("relativeOrbit must be between 1 and 175 (was " + relativeOrbit + ")");
    }
    if (burstNumber <= 0) {
      throw new IllegalArgumentException("burstNumber must be positive (was " + burstNumber + ")");
    }
  }

  @Override
  public int compareTo(BurstId other) {
    return ORDER.compare(this, other);
  }

  /**
   * Formats the id the way burst catalogs print it, e.g. {@code t016_032322_iw2}.
   *
   * @return lower-case id string
   */
  @Override
  public String toString() {
    return String.format(Locale.ROOT, "t%03d_%06d_%s", relativeOrbit, burstNumber, swath.label());
  }
}
