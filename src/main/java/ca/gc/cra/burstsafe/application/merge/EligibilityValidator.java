package ca.gc.cra.burstsafe.application.merge;

import ca.gc.cra.burstsafe.domain.burst.AcquisitionMode;
import ca.gc.cra.burstsafe.domain.burst.BurstId;
import ca.gc.cra.burstsafe.domain.burst.BurstRecord;
import ca.gc.cra.burstsafe.domain.burst.Envelope;
import ca.gc.cra.burstsafe.domain.burst.Polarization;
import ca.gc.cra.burstsafe.domain.product.BurstGroup;
import ca.gc.cra.burstsafe.domain.product.GroupLayout;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Decides whether a set of bursts can legally form one product.
 * <p><strong>Why:</strong> Mixing modes, orbits or mismatched polarization coverage produces a product no downstream
 * processor can use; the check runs before any group is assembled so such input yields no partial output.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Product-wide rules: same mode, same absolute orbit, matching footprint per polarization.</li>
 *   <li>Per-group contiguity: no duplicates, no gaps, no burst hidden entirely by its predecessor.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; pure functions over their arguments.</p>
 *
 * @implNote Rules are evaluated in {@link EligibilityRule} order and the first violation is reported. A gap is
 *     detected both by timing and by burst numbering, since a skipped burst of a real acquisition still starts within
 *     one repeat interval of its predecessor's stop.
 * @since 0.1.0
 */
public final class EligibilityValidator {
  private static final Comparator<BurstRecord> TIME_ORDER =
      Comparator.comparing(BurstRecord::start).thenComparing(BurstRecord::identity);

  private final double footprintToleranceDegrees;
  private final Duration contiguityTolerance;

  /**
   * @param footprintToleranceDegrees allowed per-edge difference between polarization envelopes; non-negative
   * @param contiguityTolerance slack added to the burst repeat interval; non-negative
   */
  public EligibilityValidator(double footprintToleranceDegrees, Duration contiguityTolerance) {
    if (!(footprintToleranceDegrees >= 0d)) {
      throw new IllegalArgumentException("footprintToleranceDegrees must be >= 0");
    }
    this.footprintToleranceDegrees = footprintToleranceDegrees;
    this.contiguityTolerance = Objects.requireNonNull(contiguityTolerance, "contiguityTolerance");
    if (contiguityTolerance.isNegative()) {
      throw new IllegalArgumentException("contiguityTolerance must be >= 0");
    }
  }

  /**
   * Applies the product-wide rules.
   *
   * @param records every burst of the requested product
   * @throws EligibilityException on the first violated rule
   */
  public void validateProduct(List<BurstRecord> records) throws EligibilityException {
    List<BurstRecord> sorted = new ArrayList<>(records);
    sorted.sort(TIME_ORDER);
    if (sorted.isEmpty()) {
      return;
    }
    BurstRecord reference = sorted.get(0);
    for (BurstRecord record : sorted) {
      if (record.mode() != reference.mode()) {
        throw new EligibilityException(EligibilityRule.SAME_MODE,
            List.of(reference.identity(), record.identity()),
            "mode " + record.mode() + " differs from " + reference.mode());
      }
    }
    for (BurstRecord record : sorted) {
      if (record.absoluteOrbit() != reference.absoluteOrbit()) {
        throw new EligibilityException(EligibilityRule.SAME_ABSOLUTE_ORBIT,
            List.of(reference.identity(), record.identity()),
            "absolute orbit " + record.absoluteOrbit() + " differs from " + reference.absoluteOrbit());
      }
    }
    checkFootprints(sorted);
  }

  /**
   * Applies the contiguity rule to one group.
   *
   * @param group time-ordered group
   * @throws EligibilityException when the group has a duplicate, a gap or a fully overlapped member
   */
  public void validateGroup(BurstGroup group) throws EligibilityException {
    AcquisitionMode mode = group.first().mode();
    Duration maxGap = mode.burstRepeatInterval().plus(contiguityTolerance);
    Set<BurstId> seen = new HashSet<>();
    BurstRecord previous = null;
    for (BurstRecord next : group.members()) {
      if (!seen.add(next.identity())) {
        throw contiguity(previous, next, "duplicate burst");
      }
      if (previous != null) {
        if (!next.start().isAfter(previous.start())) {
          throw contiguity(previous, next, "does not start after its predecessor");
        }
        Duration gap = Duration.between(previous.stop(), next.start());
        if (gap.compareTo(maxGap) > 0) {
          throw contiguity(previous, next, "gap of " + gap + " exceeds " + maxGap);
        }
        BurstId before = previous.identity();
        BurstId after = next.identity();
        if (before.relativeOrbit() == after.relativeOrbit() && after.burstNumber() != before.burstNumber() + 1) {
          throw contiguity(previous, next, "burst numbers are not consecutive");
        }
        if (GroupLayout.overlapLines(previous, next) >= next.lines()) {
          throw contiguity(previous, next, "entirely covered by its predecessor");
        }
      }
      previous = next;
    }
  }

  private void checkFootprints(List<BurstRecord> sorted) throws EligibilityException {
    Map<Polarization, Envelope> envelopes = new EnumMap<>(Polarization.class);
    Map<Polarization, BurstRecord> earliest = new EnumMap<>(Polarization.class);
    for (BurstRecord record : sorted) {
      Envelope envelope = record.footprint().envelope();
      envelopes.merge(record.polarization(), envelope, Envelope::union);
      earliest.putIfAbsent(record.polarization(), record);
    }
    if (envelopes.size() < 2) {
      return;
    }
    Polarization referencePolarization = envelopes.keySet().iterator().next();
    Envelope reference = envelopes.get(referencePolarization);
    for (Map.Entry<Polarization, Envelope> entry : envelopes.entrySet()) {
      if (!entry.getValue().matches(reference, footprintToleranceDegrees)) {
        throw new EligibilityException(EligibilityRule.CROSS_POLARIZATION_FOOTPRINT,
            List.of(earliest.get(referencePolarization).identity(), earliest.get(entry.getKey()).identity()),
            entry.getKey() + " footprint " + entry.getValue() + " differs from " + referencePolarization
                + " footprint " + reference);
      }
    }
  }

  private static EligibilityException contiguity(BurstRecord previous, BurstRecord next, String detail) {
    List<BurstId> offending = previous == null
        ? List.of(next.identity())
        : List.of(previous.identity(), next.identity());
    return new EligibilityException(EligibilityRule.CONTIGUITY, offending, next.identity() + " " + detail);
  }
}
