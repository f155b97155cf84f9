package ca.gc.cra.burstsafe.domain.product;

import ca.gc.cra.burstsafe.domain.burst.BurstRecord;
import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Time-ordered bursts sharing one swath and polarization.
 *
 * @param key swath and polarization shared by every member
 * @param members members in ascending start time; never empty
 * @since 0.1.0
 */
public record BurstGroup(GroupKey key, List<BurstRecord> members) {

  public BurstGroup {
    Objects.requireNonNull(key, "key");
    members = List.copyOf(Objects.requireNonNull(members, "members"));
    if (members.isEmpty()) {
      throw new IllegalArgumentException("Burst group " + key.label() + " has no members");
    }
    BurstRecord previous = null;
    for (BurstRecord member : members) {
      if (!member.groupKey().equals(key)) {
        throw new IllegalArgumentException(member.identity() + " does not belong to group " + key.label());
      }
      if (previous != null && member.start().isBefore(previous.start())) {
        throw new IllegalArgumentException("Burst group " + key.label() + " is not ordered by start time");
      }
      previous = member;
    }
  }

  public BurstRecord first() {
    return members.get(0);
  }

  public int size() {
    return members.size();
  }

  /**
   * @return start time of the earliest member
   */
  public Instant start() {
    return first().start();
  }

  /**
   * @return latest stop time over all members
   */
  public Instant stop() {
    Instant stop = first().stop();
    for (BurstRecord member : members) {
      if (member.stop().isAfter(stop)) {
        stop = member.stop();
      }
    }
    return stop;
  }
}
