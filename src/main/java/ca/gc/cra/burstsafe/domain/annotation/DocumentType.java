package ca.gc.cra.burstsafe.domain.annotation;

import java.util.Locale;

/**
 * Annotation document kinds carried per swath and polarization.
 *
 * @since 0.1.0
 */
public enum DocumentType {
  PRODUCT,
  CALIBRATION,
  NOISE,
  /** Radio-frequency interference report; only produced by processors from IPF 3.40 on. */
  RFI;

  /**
   * @return lower-case label used in component ids
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a document type label case-insensitively.
   *
   * @param raw label such as {@code noise}
   * @return matching type
   * @throws IllegalArgumentException when the label is unknown
   */
  public static DocumentType fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Document type must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown document type: " + raw, ex);
    }
  }
}
