package ca.gc.cra.burstsafe.application.merge.strategy;

import ca.gc.cra.burstsafe.domain.annotation.AnnotationDocument;
import ca.gc.cra.burstsafe.domain.burst.BurstRecord;
import ca.gc.cra.burstsafe.domain.product.GroupLayout;
import java.util.Objects;

/**
 * One group member as seen by a strategy: its annotation document of the type being merged and its placement on the
 * group axis.
 *
 * @param burst source burst, for timing and diagnostics
 * @param document annotation document being merged
 * @param placement placement of the burst on the group axis
 * @since 0.1.0
 */
public record MemberView(BurstRecord burst, AnnotationDocument document, GroupLayout.MemberPlacement placement) {
  public MemberView {
    Objects.requireNonNull(burst, "burst");
    Objects.requireNonNull(document, "document");
    Objects.requireNonNull(placement, "placement");
  }
}
