package ca.gc.cra.burstsafe.domain.annotation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> One entry of an ordered annotation list (orbit state vector, geolocation grid point, noise
 * vector, burst record).
 * <p><strong>Why:</strong> Concatenation needs the entry coordinate separated from its payload so it can be re-indexed
 * onto the group axis without touching the remaining values.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; {@code values} keeps insertion order.</p>
 *
 * @param azimuthTime azimuth time of the entry, when the list is time-indexed
 * @param line burst-local (or, once merged, group-global) line, when the list is line-indexed
 * @param pixel range pixel, for two-dimensional grids
 * @param values remaining entry payload keyed by element name
 * @since 0.1.0
 */
public record ListEntry(
    Optional<Instant> azimuthTime,
    OptionalInt line,
    OptionalInt pixel,
    Map<String, String> values) {

  public ListEntry {
    azimuthTime = Objects.requireNonNullElse(azimuthTime, Optional.empty());
    line = Objects.requireNonNullElse(line, OptionalInt.empty());
    pixel = Objects.requireNonNullElse(pixel, OptionalInt.empty());
    if (azimuthTime.isEmpty() && line.isEmpty()) {
      throw new IllegalArgumentException("List entry requires an azimuth time or a line coordinate");
    }
    values = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(values, "values")));
  }

  /**
   * Creates a time-indexed entry.
   *
   * @param azimuthTime entry time
   * @param values payload
   * @return entry
   */
  public static ListEntry timed(Instant azimuthTime, Map<String, String> values) {
    return new ListEntry(Optional.of(azimuthTime), OptionalInt.empty(), OptionalInt.empty(), values);
  }

  /**
   * Creates a geolocation-grid style entry carrying time, line and pixel.
   *
   * @param azimuthTime entry time
   * @param line burst-local line
   * @param pixel range pixel
   * @param values payload
   * @return entry
   */
  public static ListEntry gridPoint(Instant azimuthTime, int line, int pixel, Map<String, String> values) {
    return new ListEntry(Optional.of(azimuthTime), OptionalInt.of(line), OptionalInt.of(pixel), values);
  }

  /**
   * Creates a line-indexed entry with no explicit time.
   *
   * @param line burst-local line
   * @param values payload
   * @return entry
   */
  public static ListEntry atLine(int line, Map<String, String> values) {
    return new ListEntry(Optional.empty(), OptionalInt.of(line), OptionalInt.empty(), values);
  }

  /**
   * Returns a copy of this entry placed on another line.
   *
   * @param newLine line on the target axis
   * @return re-indexed entry
   */
  public ListEntry withLine(int newLine) {
    return new ListEntry(azimuthTime, OptionalInt.of(newLine), pixel, values);
  }
}
