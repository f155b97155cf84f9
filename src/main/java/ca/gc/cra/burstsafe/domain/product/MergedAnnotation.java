package ca.gc.cra.burstsafe.domain.product;

import ca.gc.cra.burstsafe.domain.annotation.DocumentType;
import ca.gc.cra.burstsafe.domain.annotation.FieldValue;
import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One merged annotation document for a (swath, polarization, document type).
 * <p><strong>Role:</strong> Output value handed to the writer and indexed by the manifest.</p>
 * <p><strong>Thread-safety:</strong> Immutable; field order follows the document schema.</p>
 *
 * @param key swath and polarization
 * @param type document kind
 * @param imageNumber one-based image number shared with the matching measurement
 * @param metadataOnly {@code true} for neighbour-swath documents built without bursts of their own
 * @param fields merged fields keyed by path in schema order
 * @since 0.1.0
 */
public record MergedAnnotation(
    GroupKey key,
    DocumentType type,
    int imageNumber,
    boolean metadataOnly,
    Map<String, MergedField> fields) {

  public MergedAnnotation {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(type, "type");
    if (imageNumber <= 0) {
      throw new IllegalArgumentException("imageNumber must be positive (was " + imageNumber + ")");
    }
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields")));
  }

  public Optional<MergedField> field(String path) {
    return Optional.ofNullable(fields.get(path));
  }

  /**
   * Returns the text of a scalar field, whether copied or recomputed and resolved.
   *
   * @param path field path
   * @return scalar text when available
   */
  public Optional<String> text(String path) {
    MergedField field = fields.get(path);
    if (field instanceof MergedField.Recomputed recomputed) {
      return recomputed.value().text();
    }
    if (field instanceof MergedField.Copied copied && copied.value() instanceof FieldValue.Scalar scalar) {
      return Optional.of(scalar.text());
    }
    return Optional.empty();
  }
}
