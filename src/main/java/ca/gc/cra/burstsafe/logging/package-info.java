/**
 * Runtime logging controls for Logback.
 */
package ca.gc.cra.burstsafe.logging;
