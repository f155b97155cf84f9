package ca.gc.cra.burstsafe.domain.annotation;

import java.util.List;
import java.util.Objects;

/**
 * Value of one annotation field: either a scalar text value or an ordered list of entries.
 *
 * @since 0.1.0
 */
public sealed interface FieldValue {

  /**
   * Scalar field such as {@code adsHeader/polarisation}.
   *
   * @param text raw text as found in the source document; may be empty, never {@code null}
   */
  record Scalar(String text) implements FieldValue {
    public Scalar {
      Objects.requireNonNull(text, "text");
    }
  }

  /**
   * Ordered list field such as {@code generalAnnotation/orbitList}.
   *
   * @param entries entries in ascending coordinate order
   */
  record Entries(List<ListEntry> entries) implements FieldValue {
    public Entries {
      entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
    }
  }

  static FieldValue scalar(String text) {
    return new Scalar(text);
  }

  static FieldValue entries(List<ListEntry> entries) {
    return new Entries(entries);
  }
}
