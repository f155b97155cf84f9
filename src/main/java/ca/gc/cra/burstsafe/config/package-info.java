/**
 * Merge configuration and composition root wiring.
 * <p><strong>Role:</strong> Bootstrap layer resolving YAML, overrides and defaults into a {@link
 * ca.gc.cra.burstsafe.config.MergeConfig} and selecting adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 */
package ca.gc.cra.burstsafe.config;
