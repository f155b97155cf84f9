package ca.gc.cra.burstsafe.application.merge.strategy;

import ca.gc.cra.burstsafe.domain.annotation.DocumentType;
import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import ca.gc.cra.burstsafe.domain.product.GroupLayout;
import ca.gc.cra.burstsafe.domain.raster.RasterStatistics;
import java.util.Objects;
import java.util.Optional;

/**
 * Group-wide inputs available to the strategies while one document is merged.
 *
 * @param key swath and polarization of the document
 * @param type document kind
 * @param imageNumber one-based image number
 * @param layout group layout supplying the time window and line axis
 * @param statistics statistics of the assembled raster; empty for metadata-only documents or rasters with no valid
 *     sample
 * @param metadataOnly whether the document is built without bursts of its own swath
 * @since 0.1.0
 */
public record MergeContext(
    GroupKey key,
    DocumentType type,
    int imageNumber,
    GroupLayout layout,
    Optional<RasterStatistics> statistics,
    boolean metadataOnly) {

  public MergeContext {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(layout, "layout");
    statistics = Objects.requireNonNullElse(statistics, Optional.empty());
  }
}
