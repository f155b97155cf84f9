package ca.gc.cra.burstsafe.domain.product;

import ca.gc.cra.burstsafe.domain.burst.BurstId;
import ca.gc.cra.burstsafe.domain.burst.BurstRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Placement of every member of a burst group on the group's single line axis.
 * <p><strong>Why:</strong> The raster stitcher and list concatenation must agree on where each burst lands; both read
 * the same layout so the merged raster and the merged annotation axis cannot drift apart.</p>
 * <p><strong>Role:</strong> Derived domain value computed once per group.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param placements per-member placement in group order
 * @param totalLines sum of member lines minus overlap trims
 * @param maxSamples widest member raster
 * @param start first line time of the group
 * @param stop last line time of the group
 * @implNote A member overlapping its predecessor loses its leading
 *     {@code floor((previous.stop - next.start) / azimuthTimeInterval) + 1} lines; the earlier burst wins.
 * @since 0.1.0
 */
public record GroupLayout(
    List<MemberPlacement> placements,
    int totalLines,
    int maxSamples,
    Instant start,
    Instant stop) {

  public GroupLayout {
    placements = List.copyOf(Objects.requireNonNull(placements, "placements"));
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(stop, "stop");
  }

  /**
   * Placement of one member.
   *
   * @param burst member identity
   * @param overlapTrim leading member lines already covered by the previous member
   * @param lineOffset group line receiving the member's first untrimmed line
   * @param usableLines member lines written to the group axis
   */
  public record MemberPlacement(BurstId burst, int overlapTrim, int lineOffset, int usableLines) {

    /**
     * Maps a member-local line onto the group axis.
     *
     * @param localLine member-local line; must not be inside the trimmed overlap
     * @return group line
     */
    public int toGroupLine(int localLine) {
      return lineOffset + (localLine - overlapTrim);
    }
  }

  /**
   * Computes the layout of a group.
   *
   * @param group time-ordered burst group
   * @return layout
   * @throws IllegalArgumentException when a member is entirely covered by its predecessor
   */
  public static GroupLayout of(BurstGroup group) {
    Objects.requireNonNull(group, "group");
    List<MemberPlacement> placements = new ArrayList<>(group.size());
    int offset = 0;
    int maxSamples = 0;
    BurstRecord previous = null;
    for (BurstRecord member : group.members()) {
      int trim = previous == null ? 0 : overlapLines(previous, member);
      if (trim >= member.lines()) {
        throw new IllegalArgumentException(
            member.identity() + " is entirely covered by " + previous.identity());
      }
      int usable = member.lines() - trim;
      placements.add(new MemberPlacement(member.identity(), trim, offset, usable));
      offset += usable;
      maxSamples = Math.max(maxSamples, member.raster().width());
      previous = member;
    }
    return new GroupLayout(placements, offset, maxSamples, group.start(), group.stop());
  }

  /**
   * Counts the leading lines of {@code next} whose azimuth time is not after {@code previous}'s stop time.
   *
   * @param previous earlier burst
   * @param next later burst
   * @return number of overlapping lines; zero when the bursts do not overlap
   */
  public static int overlapLines(BurstRecord previous, BurstRecord next) {
    if (previous.stop().isBefore(next.start())) {
      return 0;
    }
    long overlapNanos = Duration.between(next.start(), previous.stop()).toNanos();
    long intervalNanos = next.timing().azimuthTimeInterval().toNanos();
    return Math.toIntExact(overlapNanos / intervalNanos + 1);
  }

  public MemberPlacement placement(int index) {
    return placements.get(index);
  }
}
