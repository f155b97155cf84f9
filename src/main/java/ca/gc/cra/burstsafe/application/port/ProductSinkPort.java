package ca.gc.cra.burstsafe.application.port;

import ca.gc.cra.burstsafe.application.merge.MergeResult;

/**
 * <strong>What:</strong> Output port receiving the assembled product.
 * <p><strong>Why:</strong> Packaging into the vendor directory layout, compression or upload are writer concerns kept
 * outside the merge engine.</p>
 * <p><strong>Thread-safety:</strong> Called once per run from the orchestrating thread.</p>
 *
 * @since 0.1.0
 */
public interface ProductSinkPort extends AutoCloseable {
  /**
   * Writes a merge result.
   *
   * @param result manifest, merged annotations and rasters; never {@code null}
   * @throws Exception if the product cannot be written
   */
  void write(MergeResult result) throws Exception;

  /**
   * Releases sink resources.
   *
   * @throws Exception if shutdown fails
   */
  @Override
  default void close() throws Exception {}
}
