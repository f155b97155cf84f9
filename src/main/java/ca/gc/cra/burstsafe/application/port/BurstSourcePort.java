package ca.gc.cra.burstsafe.application.port;

import ca.gc.cra.burstsafe.domain.burst.BurstRecord;
import java.util.List;

/**
 * <strong>What:</strong> Input port supplying fully materialized bursts to a merge run.
 * <p><strong>Why:</strong> The merge engine performs no network or filesystem I/O of its own; retrieval, decoding and
 * structural validation of burst products belong to the loader behind this port.</p>
 * <p><strong>Thread-safety:</strong> Called once per run from the orchestrating thread.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface BurstSourcePort {
  /**
   * Loads the bursts of one product request.
   *
   * @return bursts in any order; never {@code null}
   * @throws Exception if the bursts cannot be retrieved or decoded
   */
  List<BurstRecord> load() throws Exception;
}
