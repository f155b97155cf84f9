/**
 * Use cases orchestrating a merge run from source port to sink port.
 */
package ca.gc.cra.burstsafe.application.pipeline;
