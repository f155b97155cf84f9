package ca.gc.cra.burstsafe.application.merge.strategy;

import ca.gc.cra.burstsafe.domain.product.MergedValue;
import java.util.List;

/**
 * Field-specific recomputation over a whole group.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface MergeRule {
  /**
   * Recomputes a field.
   *
   * @param context group-wide inputs
   * @param memberValues the field's text in every member carrying it, in group order
   * @return recomputed value, or {@link MergedValue#unresolved()} when the inputs do not allow one
   */
  MergedValue apply(MergeContext context, List<String> memberValues);
}
