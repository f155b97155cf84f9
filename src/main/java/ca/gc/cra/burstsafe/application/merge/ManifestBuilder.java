package ca.gc.cra.burstsafe.application.merge;

import ca.gc.cra.burstsafe.application.render.AnnotationJsonRenderer;
import ca.gc.cra.burstsafe.domain.burst.BurstRecord;
import ca.gc.cra.burstsafe.domain.burst.Envelope;
import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import ca.gc.cra.burstsafe.domain.burst.Polarization;
import ca.gc.cra.burstsafe.domain.burst.Swath;
import ca.gc.cra.burstsafe.domain.product.AssembledRaster;
import ca.gc.cra.burstsafe.domain.product.BurstGroup;
import ca.gc.cra.burstsafe.domain.product.ComponentRole;
import ca.gc.cra.burstsafe.domain.product.Manifest;
import ca.gc.cra.burstsafe.domain.product.ManifestComponent;
import ca.gc.cra.burstsafe.domain.product.MergedAnnotation;
import ca.gc.cra.burstsafe.domain.product.ProductIdentity;
import ca.gc.cra.burstsafe.domain.product.ProductSummary;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Builds the top-level index of the assembled product.
 * <p><strong>Why:</strong> Writers and packagers need one structure enumerating every component with its role,
 * cross-reference id and checksum, plus the product-level summary.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>One component per merged annotation and one per raster; no slots for preview or report components.</li>
 *   <li>Summary of mode, orbit, time span, polarizations and swaths of the merged groups.</li>
 *   <li>Footprint covering every merged burst.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe; holds only a thread-safe renderer.</p>
 *
 * @since 0.1.0
 */
public final class ManifestBuilder {
  private static final HexFormat HEX = HexFormat.of();

  private final AnnotationJsonRenderer annotationRenderer;

  public ManifestBuilder(AnnotationJsonRenderer annotationRenderer) {
    this.annotationRenderer = Objects.requireNonNull(annotationRenderer, "annotationRenderer");
  }

  /**
   * Builds the manifest.
   *
   * @param annotations every merged annotation, including metadata-only ones
   * @param rasters every assembled raster
   * @param identity product identity derived from {@code rasters}
   * @param groups merged groups
   * @param imageNumbers image number of every key
   * @return manifest with components ordered by image number, then role
   * @throws IllegalArgumentException when no group is supplied or a key has no image number
   */
  public Manifest build(
      List<MergedAnnotation> annotations,
      List<AssembledRaster> rasters,
      ProductIdentity identity,
      List<BurstGroup> groups,
      Map<GroupKey, Integer> imageNumbers) {
    if (groups.isEmpty()) {
      throw new IllegalArgumentException("Manifest requires at least one merged group");
    }
    List<ManifestComponent> components = new ArrayList<>();
    for (MergedAnnotation annotation : annotations) {
      ComponentRole role = ComponentRole.forDocument(annotation.type());
      components.add(new ManifestComponent(
          ManifestComponent.idFor(role, annotation.key(), annotation.imageNumber()),
          role,
          annotation.key(),
          annotation.imageNumber(),
          HEX.formatHex(md5(annotationRenderer.render(annotation)))));
    }
    for (AssembledRaster raster : rasters) {
      Integer imageNumber = imageNumbers.get(raster.key());
      if (imageNumber == null) {
        throw new IllegalArgumentException("No image number assigned to " + raster.key().label());
      }
      String checksum = identity.rasterChecksums().get(raster.key());
      if (checksum == null) {
        throw new InternalConsistencyException("manifest.rasterChecksum", raster.key().label(), "none");
      }
      components.add(new ManifestComponent(
          ManifestComponent.idFor(ComponentRole.MEASUREMENT, raster.key(), imageNumber),
          ComponentRole.MEASUREMENT,
          raster.key(),
          imageNumber,
          checksum));
    }
    components.sort(Comparator.comparingInt(ManifestComponent::imageNumber)
        .thenComparing(ManifestComponent::role));
    return new Manifest(identity, summary(groups), components, footprint(groups));
  }

  private static ProductSummary summary(List<BurstGroup> groups) {
    BurstRecord first = groups.get(0).first();
    Instant start = groups.get(0).start();
    Instant stop = groups.get(0).stop();
    TreeSet<Polarization> polarizations = new TreeSet<>();
    TreeSet<Swath> swaths = new TreeSet<>();
    for (BurstGroup group : groups) {
      if (group.start().isBefore(start)) {
        start = group.start();
      }
      if (group.stop().isAfter(stop)) {
        stop = group.stop();
      }
      polarizations.add(group.key().polarization());
      swaths.add(group.key().swath());
    }
    return new ProductSummary(
        first.mode(), first.absoluteOrbit(), start, stop, List.copyOf(polarizations), List.copyOf(swaths));
  }

  private static Envelope footprint(List<BurstGroup> groups) {
    Envelope envelope = null;
    for (BurstGroup group : groups) {
      for (BurstRecord member : group.members()) {
        Envelope next = member.footprint().envelope();
        envelope = envelope == null ? next : envelope.union(next);
      }
    }
    return envelope;
  }

  private static byte[] md5(byte[] content) {
    try {
      return MessageDigest.getInstance("MD5").digest(content);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("MD5 digest unavailable", ex);
    }
  }
}
