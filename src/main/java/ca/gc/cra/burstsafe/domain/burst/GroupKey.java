package ca.gc.cra.burstsafe.domain.burst;

import java.util.Comparator;
import java.util.Objects;

/**
 * Key of a burst group: one swath imaged in one polarization. Natural order is swath, then polarization.
 *
 * @param swath sub-swath
 * @param polarization polarization
 * @since 0.1.0
 */
public record GroupKey(Swath swath, Polarization polarization) implements Comparable<GroupKey> {
  private static final Comparator<GroupKey> ORDER =
      Comparator.comparing(GroupKey::swath).thenComparing(GroupKey::polarization);

  public GroupKey {
    Objects.requireNonNull(swath, "swath");
    Objects.requireNonNull(polarization, "polarization");
  }

  @Override
  public int compareTo(GroupKey other) {
    return ORDER.compare(this, other);
  }

  /**
   * @return label such as {@code iw1-vv}, used in logs and component ids
   */
  public String label() {
    return swath.label() + "-" + polarization.label();
  }
}
