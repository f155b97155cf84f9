package ca.gc.cra.burstsafe.domain.product;

import ca.gc.cra.burstsafe.domain.annotation.FieldValue;
import ca.gc.cra.burstsafe.domain.annotation.ListEntry;
import java.util.List;
import java.util.Objects;

/**
 * Field of a merged annotation, tagged by the strategy that produced it.
 *
 * @since 0.1.0
 */
public sealed interface MergedField {

  /**
   * Value copied verbatim from the earliest member.
   *
   * @param value copied value
   */
  record Copied(FieldValue value) implements MergedField {
    public Copied {
      Objects.requireNonNull(value, "value");
    }
  }

  /**
   * List re-indexed onto the group axis.
   *
   * @param entries merged entries in ascending coordinate order
   */
  record Concatenated(List<ListEntry> entries) implements MergedField {
    public Concatenated {
      entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
    }
  }

  /**
   * Scalar recomputed over the whole group.
   *
   * @param value recomputed value or unresolved sentinel
   */
  record Recomputed(MergedValue value) implements MergedField {
    public Recomputed {
      Objects.requireNonNull(value, "value");
    }
  }
}
