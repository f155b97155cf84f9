package ca.gc.cra.burstsafe.domain.burst;

import java.util.Locale;

/**
 * Transmit/receive polarization of a burst.
 *
 * @since 0.1.0
 */
public enum Polarization {
  VV,
  VH,
  HH,
  HV;

  /**
   * @return lower-case label used in component ids (e.g. {@code vv})
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
