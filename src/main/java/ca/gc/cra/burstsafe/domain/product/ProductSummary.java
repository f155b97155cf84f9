package ca.gc.cra.burstsafe.domain.product;

import ca.gc.cra.burstsafe.domain.burst.AcquisitionMode;
import ca.gc.cra.burstsafe.domain.burst.Polarization;
import ca.gc.cra.burstsafe.domain.burst.Swath;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Group-level summary fields of an assembled product.
 *
 * @param mode acquisition mode
 * @param absoluteOrbit absolute orbit number
 * @param start earliest line time over all groups
 * @param stop latest line time over all groups
 * @param polarizations polarizations present, sorted
 * @param swaths swaths present, sorted
 * @since 0.1.0
 */
public record ProductSummary(
    AcquisitionMode mode,
    int absoluteOrbit,
    Instant start,
    Instant stop,
    List<Polarization> polarizations,
    List<Swath> swaths) {

  public ProductSummary {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(stop, "stop");
    polarizations = List.copyOf(polarizations);
    swaths = List.copyOf(swaths);
  }
}
