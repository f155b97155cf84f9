/**
 * Executor construction for parallel group assembly.
 *
 * @since 0.1.0
 */
package ca.gc.cra.burstsafe.infrastructure.exec;
