/**
 * <strong>Purpose:</strong> Ports defining the load -> merge -> write contracts of a merge run.
 * <p><strong>Pipeline role:</strong> Application boundary; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Metrics implementations must be thread-safe; source and sink are called from the
 * orchestrating thread only.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.burstsafe.application.port;
