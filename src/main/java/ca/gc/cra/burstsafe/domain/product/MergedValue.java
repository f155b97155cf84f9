package ca.gc.cra.burstsafe.domain.product;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a recomputed field: a value, or the explicit unresolved sentinel when no rule can compute one.
 *
 * @since 0.1.0
 */
public sealed interface MergedValue {

  /**
   * Recomputed value.
   *
   * @param value formatted value
   */
  record Resolved(String value) implements MergedValue {
    public Resolved {
      Objects.requireNonNull(value, "value");
    }
  }

  /**
   * Sentinel for a field with no computable value.
   */
  enum Unresolved implements MergedValue {
    INSTANCE
  }

  static MergedValue resolved(String text) {
    return new Resolved(text);
  }

  static MergedValue unresolved() {
    return Unresolved.INSTANCE;
  }

  default boolean isResolved() {
    return this instanceof Resolved;
  }

  /**
   * @return the value when resolved
   */
  default Optional<String> text() {
    return this instanceof Resolved resolved ? Optional.of(resolved.value()) : Optional.empty();
  }
}
