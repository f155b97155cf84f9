package ca.gc.cra.burstsafe.domain.product;

import ca.gc.cra.burstsafe.domain.annotation.DocumentType;

/**
 * Role of a component listed in the manifest. Preview imagery and report documents have no role here.
 *
 * @since 0.1.0
 */
public enum ComponentRole {
  PRODUCT_ANNOTATION("product"),
  CALIBRATION("calibration"),
  NOISE("noise"),
  RFI("rfi"),
  MEASUREMENT("measurement");

  private final String idPrefix;

  ComponentRole(String idPrefix) {
    this.idPrefix = idPrefix;
  }

  public String idPrefix() {
    return idPrefix;
  }

  /**
   * @param type annotation document kind
   * @return role of the merged document in the manifest
   */
  public static ComponentRole forDocument(DocumentType type) {
    return switch (type) {
      case PRODUCT -> PRODUCT_ANNOTATION;
      case CALIBRATION -> CALIBRATION;
      case NOISE -> NOISE;
      case RFI -> RFI;
    };
  }
}
