package ca.gc.cra.burstsafe.domain.product;

import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import ca.gc.cra.burstsafe.domain.raster.ComplexRaster;
import ca.gc.cra.burstsafe.domain.raster.RasterStatistics;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Continuous raster of one (swath, polarization) group.
 *
 * @param key swath and polarization
 * @param raster stitched samples; line count equals the group layout total
 * @param statistics statistics over valid samples; empty when the group has none
 * @param burstLineOffsets first group line of every member, in group order
 * @param creationTime fixed construction timestamp embedded in the raster metadata
 * @since 0.1.0
 */
public record AssembledRaster(
    GroupKey key,
    ComplexRaster raster,
    Optional<RasterStatistics> statistics,
    List<Integer> burstLineOffsets,
    Instant creationTime) {

  public AssembledRaster {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(raster, "raster");
    statistics = Objects.requireNonNullElse(statistics, Optional.empty());
    burstLineOffsets = List.copyOf(Objects.requireNonNull(burstLineOffsets, "burstLineOffsets"));
    Objects.requireNonNull(creationTime, "creationTime");
  }

  public int lines() {
    return raster.lines();
  }
}
