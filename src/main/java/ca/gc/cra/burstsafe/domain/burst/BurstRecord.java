package ca.gc.cra.burstsafe.domain.burst;

import ca.gc.cra.burstsafe.domain.annotation.AnnotationDocument;
import ca.gc.cra.burstsafe.domain.annotation.DocumentType;
import ca.gc.cra.burstsafe.domain.raster.BurstRaster;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One source burst fully materialized in memory: identity, orbit, timing, geometry, annotation
 * documents and raster tile.
 * <p><strong>Why:</strong> The merge engine performs no I/O; loaders hand over complete records and every later stage
 * reads from them.</p>
 * <p><strong>Role:</strong> Root domain value of a merge run.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Guarantee {@code start < stop} and that the raster line count matches the burst timing.</li>
 *   <li>Guarantee the swath, mode and identity agree with each other.</li>
 *   <li>Expose annotation documents per {@link DocumentType}, and optionally those of the other swaths of the same
 *       source acquisition for include-all-annotations runs.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record; shared read-only by parallel group workers.</p>
 *
 * @param identity stable burst identity
 * @param granule source burst product name, for diagnostics
 * @param absoluteOrbit absolute orbit number
 * @param mode acquisition mode
 * @param polarization polarization
 * @param swath sub-swath; must belong to {@code mode}
 * @param timing azimuth timing
 * @param footprint ground footprint
 * @param metadata annotation documents of this burst's own swath
 * @param siblingMetadata annotation documents of the other swaths of the source acquisition; may be empty
 * @param raster raster tile and validity bounds
 * @since 0.1.0
 */
public record BurstRecord(
    BurstId identity,
    String granule,
    int absoluteOrbit,
    AcquisitionMode mode,
    Polarization polarization,
    Swath swath,
    BurstTiming timing,
    Footprint footprint,
    Map<DocumentType, AnnotationDocument> metadata,
    Map<Swath, Map<DocumentType, AnnotationDocument>> siblingMetadata,
    BurstRaster raster) {

  public BurstRecord {
    Objects.requireNonNull(identity, "identity");
    granule = Objects.requireNonNullElse(granule, identity.toString());
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(polarization, "polarization");
    Objects.requireNonNull(swath, "swath");
    Objects.requireNonNull(timing, "timing");
    Objects.requireNonNull(footprint, "footprint");
    Objects.requireNonNull(raster, "raster");
    if (absoluteOrbit <= 0) {
      throw new IllegalArgumentException("absoluteOrbit must be positive (was " + absoluteOrbit + ")");
    }
    if (swath.mode() != mode) {
      throw new IllegalArgumentException("Swath " + swath + " does not belong to mode " + mode);
    }
    if (identity.swath() != swath) {
      throw new IllegalArgumentException("Identity " + identity + " does not match swath " + swath);
    }
    if (raster.lines() != timing.lines()) {
      throw new IllegalArgumentException(
          "Raster of " + identity + " has " + raster.lines() + " lines but timing declares " + timing.lines());
    }
    metadata = copyDocuments(Objects.requireNonNullElse(metadata, Map.of()));
    EnumMap<Swath, Map<DocumentType, AnnotationDocument>> siblings = new EnumMap<>(Swath.class);
    for (Map.Entry<Swath, Map<DocumentType, AnnotationDocument>> entry
        : Objects.requireNonNullElse(siblingMetadata, Map.<Swath, Map<DocumentType, AnnotationDocument>>of()).entrySet()) {
      Swath sibling = entry.getKey();
      if (sibling == swath || sibling.mode() != mode) {
        throw new IllegalArgumentException("Invalid sibling swath " + sibling + " for " + identity);
      }
      siblings.put(sibling, copyDocuments(entry.getValue()));
    }
    siblingMetadata = Collections.unmodifiableMap(siblings);
  }

  public Instant start() {
    return timing.start();
  }

  public Instant stop() {
    return timing.stop();
  }

  public int lines() {
    return timing.lines();
  }

  public GroupKey groupKey() {
    return new GroupKey(swath, polarization);
  }

  /**
   * @param type document kind
   * @return this burst's document of that kind, when present
   */
  public Optional<AnnotationDocument> document(DocumentType type) {
    return Optional.ofNullable(metadata.get(type));
  }

  /**
   * @param sibling another swath of the same acquisition
   * @param type document kind
   * @return the sibling swath's document of that kind, when present
   */
  public Optional<AnnotationDocument> siblingDocument(Swath sibling, DocumentType type) {
    Map<DocumentType, AnnotationDocument> documents = siblingMetadata.get(sibling);
    return documents == null ? Optional.empty() : Optional.ofNullable(documents.get(type));
  }

  private static Map<DocumentType, AnnotationDocument> copyDocuments(Map<DocumentType, AnnotationDocument> source) {
    EnumMap<DocumentType, AnnotationDocument> copy = new EnumMap<>(DocumentType.class);
    for (Map.Entry<DocumentType, AnnotationDocument> entry : source.entrySet()) {
      AnnotationDocument document = Objects.requireNonNull(entry.getValue(), "document");
      if (document.type() != entry.getKey()) {
        throw new IllegalArgumentException(
            "Document registered as " + entry.getKey() + " has type " + document.type());
      }
      copy.put(entry.getKey(), document);
    }
    return Collections.unmodifiableMap(copy);
  }
}
