package ca.gc.cra.burstsafe.application.merge;

import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import java.util.Objects;

/**
 * Raised when a group has fewer members than the configured minimum. Distinct from eligibility: the bursts are valid,
 * there are just not enough of them.
 *
 * @since 0.1.0
 */
public final class GroupRejectedException extends MergeException {
  private final GroupKey key;
  private final int memberCount;
  private final int minimum;

  /**
   * @param key rejected group
   * @param memberCount members found
   * @param minimum configured minimum
   */
  public GroupRejectedException(GroupKey key, int memberCount, int minimum) {
    super("Group " + key.label() + " has " + memberCount + " burst(s); at least " + minimum + " required");
    this.key = Objects.requireNonNull(key, "key");
    this.memberCount = memberCount;
    this.minimum = minimum;
  }

  public GroupKey key() {
    return key;
  }

  public int memberCount() {
    return memberCount;
  }

  public int minimum() {
    return minimum;
  }
}
