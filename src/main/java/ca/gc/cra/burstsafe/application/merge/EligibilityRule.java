package ca.gc.cra.burstsafe.application.merge;

/**
 * Eligibility rules in evaluation order.
 *
 * @since 0.1.0
 */
public enum EligibilityRule {
  /** All bursts share one acquisition mode. */
  SAME_MODE(true),
  /** All bursts share one absolute orbit. */
  SAME_ABSOLUTE_ORBIT(true),
  /** Every polarization covers the same ground envelope, within tolerance. */
  CROSS_POLARIZATION_FOOTPRINT(true),
  /** Consecutive bursts of a group follow each other within one burst repeat interval. */
  CONTIGUITY(false);

  private final boolean productWide;

  EligibilityRule(boolean productWide) {
    this.productWide = productWide;
  }

  /**
   * @return {@code true} when a violation rejects the whole input set, {@code false} when it rejects one group
   */
  public boolean productWide() {
    return productWide;
  }
}
