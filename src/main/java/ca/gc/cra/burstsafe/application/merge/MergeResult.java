package ca.gc.cra.burstsafe.application.merge;

import ca.gc.cra.burstsafe.domain.product.AssembledRaster;
import ca.gc.cra.burstsafe.domain.product.Manifest;
import ca.gc.cra.burstsafe.domain.product.MergedAnnotation;
import ca.gc.cra.burstsafe.domain.product.ProductIdentity;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a merge run handed to the product sink.
 *
 * @param manifest product index
 * @param annotations merged annotations in (swath, polarization, document type) order
 * @param rasters assembled rasters in group key order
 * @param warnings unresolved Merge fields; non-fatal
 * @param failures groups that were rejected or failed while others succeeded
 * @since 0.1.0
 */
public record MergeResult(
    Manifest manifest,
    List<MergedAnnotation> annotations,
    List<AssembledRaster> rasters,
    List<UnresolvedFieldWarning> warnings,
    List<GroupFailure> failures) {

  public MergeResult {
    Objects.requireNonNull(manifest, "manifest");
    annotations = List.copyOf(annotations);
    rasters = List.copyOf(rasters);
    warnings = List.copyOf(warnings);
    failures = List.copyOf(failures);
  }

  public ProductIdentity identity() {
    return manifest.identity();
  }
}
