package ca.gc.cra.burstsafe.domain.burst;

import java.util.Locale;

/**
 * Sub-swath of an acquisition mode, ordered by beam number.
 *
 * @since 0.1.0
 */
public enum Swath {
  IW1(AcquisitionMode.IW, 1),
  IW2(AcquisitionMode.IW, 2),
  IW3(AcquisitionMode.IW, 3),
  EW1(AcquisitionMode.EW, 1),
  EW2(AcquisitionMode.EW, 2),
  EW3(AcquisitionMode.EW, 3),
  EW4(AcquisitionMode.EW, 4),
  EW5(AcquisitionMode.EW, 5);

  private final AcquisitionMode mode;
  private final int number;

  Swath(AcquisitionMode mode, int number) {
    this.mode = mode;
    this.number = number;
  }

  /**
   * @return acquisition mode owning this swath
   */
  public AcquisitionMode mode() {
    return mode;
  }

  /**
   * @return one-based beam number within the mode
   */
  public int number() {
    return number;
  }

  /**
   * @return lower-case label used in component ids (e.g. {@code iw2})
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a swath label case-insensitively.
   *
   * @param label swath name such as {@code iw1}
   * @return matching swath
   * @throws IllegalArgumentException when the label is unknown
   */
  public static Swath fromLabel(String label) {
    if (label == null || label.isBlank()) {
      throw new IllegalArgumentException("Swath label must not be blank");
    }
    return valueOf(label.trim().toUpperCase(Locale.ROOT));
  }
}
