package ca.gc.cra.burstsafe.domain.burst;

import java.util.List;
import java.util.Objects;

/**
 * Ground footprint polygon of a burst.
 *
 * @param points polygon vertices in order; at least three
 * @since 0.1.0
 */
public record Footprint(List<GeoPoint> points) {

  public Footprint {
    points = List.copyOf(Objects.requireNonNull(points, "points"));
    if (points.size() < 3) {
      throw new IllegalArgumentException("Footprint requires at least three points (was " + points.size() + ")");
    }
  }

  /**
   * @return bounding envelope of the polygon
   */
  public Envelope envelope() {
    double minLon = Double.POSITIVE_INFINITY;
    double minLat = Double.POSITIVE_INFINITY;
    double maxLon = Double.NEGATIVE_INFINITY;
    double maxLat = Double.NEGATIVE_INFINITY;
    for (GeoPoint point : points) {
      minLon = Math.min(minLon, point.longitude());
      minLat = Math.min(minLat, point.latitude());
      maxLon = Math.max(maxLon, point.longitude());
      maxLat = Math.max(maxLat, point.latitude());
    }
    return new Envelope(minLon, minLat, maxLon, maxLat);
  }
}
