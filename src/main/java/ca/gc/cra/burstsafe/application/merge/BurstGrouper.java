package ca.gc.cra.burstsafe.application.merge;

import ca.gc.cra.burstsafe.domain.burst.BurstRecord;
import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import ca.gc.cra.burstsafe.domain.product.BurstGroup;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Partitions bursts into groups keyed by (swath, polarization).
 *
 * <p>Members are ordered by start time with ties broken by identity, and groups by key, so the result does not depend
 * on input order.</p>
 *
 * @since 0.1.0
 */
public final class BurstGrouper {
  private static final Comparator<BurstRecord> MEMBER_ORDER =
      Comparator.comparing(BurstRecord::start).thenComparing(BurstRecord::identity);

  /**
   * @param records bursts in any order
   * @return groups in key order; every record appears in exactly one group
   */
  public List<BurstGroup> group(List<BurstRecord> records) {
    List<BurstRecord> sorted = new ArrayList<>(records);
    sorted.sort(MEMBER_ORDER);
    Map<GroupKey, List<BurstRecord>> byKey = new TreeMap<>();
    for (BurstRecord record : sorted) {
      byKey.computeIfAbsent(record.groupKey(), key -> new ArrayList<>()).add(record);
    }
    List<BurstGroup> groups = new ArrayList<>(byKey.size());
    for (Map.Entry<GroupKey, List<BurstRecord>> entry : byKey.entrySet()) {
      groups.add(new BurstGroup(entry.getKey(), entry.getValue()));
    }
    return groups;
  }
}
