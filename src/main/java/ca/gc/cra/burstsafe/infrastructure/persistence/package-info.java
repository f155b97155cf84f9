/**
 * Product sink adapters.
 */
package ca.gc.cra.burstsafe.infrastructure.persistence;
