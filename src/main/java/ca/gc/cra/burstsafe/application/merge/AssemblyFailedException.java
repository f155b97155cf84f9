package ca.gc.cra.burstsafe.application.merge;

import java.util.List;

/**
 * Raised when no group of a run could be merged.
 *
 * @since 0.1.0
 */
public final class AssemblyFailedException extends MergeException {
  private final List<GroupFailure> failures;

  /**
   * @param failures every group failure, in group order; the first cause is attached
   */
  public AssemblyFailedException(List<GroupFailure> failures) {
    super("No burst group could be merged (" + failures.size() + " failed)",
        failures.isEmpty() ? null : failures.get(0).cause());
    this.failures = List.copyOf(failures);
  }

  public List<GroupFailure> failures() {
    return failures;
  }
}
