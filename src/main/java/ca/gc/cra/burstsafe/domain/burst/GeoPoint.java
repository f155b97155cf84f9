package ca.gc.cra.burstsafe.domain.burst;

/**
 * Geographic coordinate in decimal degrees.
 *
 * @param longitude longitude in {@code [-180, 180]}
 * @param latitude latitude in {@code [-90, 90]}
 * @since 0.1.0
 */
public record GeoPoint(double longitude, double latitude) {
  public GeoPoint {
    if (Double.isNaN(longitude) || longitude < -180d || longitude > 180d) {
      throw new IllegalArgumentException("longitude out of range: " + longitude);
    }
    if (Double.isNaN(latitude) || latitude < -90d || latitude > 90d) {
      throw new IllegalArgumentException("latitude out of range: " + latitude);
    }
  }
}
