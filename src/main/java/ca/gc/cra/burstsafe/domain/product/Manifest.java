package ca.gc.cra.burstsafe.domain.product;

import ca.gc.cra.burstsafe.domain.burst.Envelope;
import java.util.List;
import java.util.Objects;

/**
 * Top-level index of an assembled product.
 *
 * @param identity product identity shared by every component
 * @param summary group-level summary
 * @param components annotation and measurement components, in image number then role order
 * @param footprint envelope of all merged burst footprints
 * @since 0.1.0
 */
public record Manifest(
    ProductIdentity identity,
    ProductSummary summary,
    List<ManifestComponent> components,
    Envelope footprint) {

  public Manifest {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(summary, "summary");
    components = List.copyOf(Objects.requireNonNull(components, "components"));
    Objects.requireNonNull(footprint, "footprint");
  }
}
