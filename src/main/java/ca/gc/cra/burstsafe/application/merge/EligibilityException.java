package ca.gc.cra.burstsafe.application.merge;

import ca.gc.cra.burstsafe.domain.burst.BurstId;
import java.util.List;
import java.util.Objects;

/**
 * Raised when a set of bursts cannot legally form one product (or one group).
 *
 * @since 0.1.0
 */
public final class EligibilityException extends MergeException {
  private final EligibilityRule rule;
  private final List<BurstId> offendingBursts;

  /**
   * Creates an eligibility failure.
   *
   * @param rule first violated rule
   * @param offendingBursts bursts that violate the rule, usually the pair that disagrees
   * @param detail human-readable explanation
   */
  public EligibilityException(EligibilityRule rule, List<BurstId> offendingBursts, String detail) {
    super(rule + " violated by " + offendingBursts + ": " + detail);
    this.rule = Objects.requireNonNull(rule, "rule");
    this.offendingBursts = List.copyOf(offendingBursts);
  }

  public EligibilityRule rule() {
    return rule;
  }

  public List<BurstId> offendingBursts() {
    return offendingBursts;
  }
}
