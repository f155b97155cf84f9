package ca.gc.cra.burstsafe.domain.product;

import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Content-derived identity of an assembled product.
 *
 * @param uniqueId four upper-case hex digits filling the product-name identifier slot
 * @param contentDigest SHA-256 hex digest over every assembled raster in group order
 * @param rasterChecksums MD5 hex checksum of every assembled raster
 * @since 0.1.0
 */
public record ProductIdentity(String uniqueId, String contentDigest, Map<GroupKey, String> rasterChecksums) {

  public ProductIdentity {
    Objects.requireNonNull(uniqueId, "uniqueId");
    if (!uniqueId.matches("[0-9A-F]{4}")) {
      throw new IllegalArgumentException("uniqueId must be four upper-case hex digits (was " + uniqueId + ")");
    }
    Objects.requireNonNull(contentDigest, "contentDigest");
    rasterChecksums = Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNull(rasterChecksums, "rasterChecksums")));
  }
}
