package ca.gc.cra.burstsafe.domain.burst;

import java.util.List;

/**
 * Axis-aligned bounding box in geographic coordinates.
 *
 * @param minLongitude western edge
 * @param minLatitude southern edge
 * @param maxLongitude eastern edge
 * @param maxLatitude northern edge
 * @since 0.1.0
 */
public record Envelope(double minLongitude, double minLatitude, double maxLongitude, double maxLatitude) {

  public Envelope {
    if (minLongitude > maxLongitude || minLatitude > maxLatitude) {
      throw new IllegalArgumentException("Envelope minimum must not exceed maximum");
    }
  }

  /**
   * Returns the smallest envelope covering both this envelope and {@code other}.
   *
   * @param other envelope to merge
   * @return union envelope
   */
  public Envelope union(Envelope other) {
    return new Envelope(
        Math.min(minLongitude, other.minLongitude),
        Math.min(minLatitude, other.minLatitude),
        Math.max(maxLongitude, other.maxLongitude),
        Math.max(maxLatitude, other.maxLatitude));
  }

  /**
   * Compares two envelopes edge by edge.
   *
   * @param other envelope to compare against
   * @param toleranceDegrees maximum allowed difference per edge, in degrees
   * @return {@code true} when every edge lies within tolerance
   */
  public boolean matches(Envelope other, double toleranceDegrees) {
    return Math.abs(minLongitude - other.minLongitude) <= toleranceDegrees
        && Math.abs(minLatitude - other.minLatitude) <= toleranceDegrees
        && Math.abs(maxLongitude - other.maxLongitude) <= toleranceDegrees
        && Math.abs(maxLatitude - other.maxLatitude) <= toleranceDegrees;
  }

  /**
   * Returns the envelope corners counter-clockwise from the south-west corner.
   *
   * @return four corner points
   */
  public List<GeoPoint> corners() {
    return List.of(
        new GeoPoint(minLongitude, minLatitude),
        new GeoPoint(maxLongitude, minLatitude),
        new GeoPoint(maxLongitude, maxLatitude),
        new GeoPoint(minLongitude, maxLatitude));
  }
}
