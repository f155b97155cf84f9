package ca.gc.cra.burstsafe.application.merge.strategy;

/**
 * Field-level merge strategies declared by the annotation schemas.
 *
 * @since 0.1.0
 */
public enum MergeStrategy {
  /** Copy the earliest member's value verbatim. */
  INCLUDE,
  /** Concatenate list entries onto the group axis, earliest burst winning on overlap. */
  CONCATENATE,
  /** Recompute the value from the whole group with a field-specific rule. */
  MERGE
}
