package ca.gc.cra.burstsafe.application.merge;

import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import java.util.Objects;

/**
 * A group that could not be merged, with the reason.
 *
 * @param key failed group
 * @param cause eligibility, schema or rejection failure
 * @since 0.1.0
 */
public record GroupFailure(GroupKey key, MergeException cause) {
  public GroupFailure {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(cause, "cause");
  }
}
