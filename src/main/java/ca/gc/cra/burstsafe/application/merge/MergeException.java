package ca.gc.cra.burstsafe.application.merge;

/**
 * Base type for input-caused failures of a merge run.
 *
 * @since 0.1.0
 */
public class MergeException extends Exception {
  /**
   * Creates a merge exception with a message.
   *
   * @param message human-readable detail
   */
  public MergeException(String message) {
    super(message);
  }

  /**
   * Creates a merge exception with a message and cause.
   *
   * @param message human-readable detail
   * @param cause underlying failure
   */
  public MergeException(String message, Throwable cause) {
    super(message, cause);
  }
}
