/**
 * Canonical JSON renderings of merged annotations and the manifest.
 * <p>Output is byte-stable for equal inputs; checksums and determinism checks rely on it.</p>
 */
package ca.gc.cra.burstsafe.application.render;
