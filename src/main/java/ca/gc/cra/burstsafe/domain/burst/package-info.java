/**
 * Burst identity, timing, footprint and the materialized {@link ca.gc.cra.burstsafe.domain.burst.BurstRecord}
 * handed to the merge engine.
 */
package ca.gc.cra.burstsafe.domain.burst;
