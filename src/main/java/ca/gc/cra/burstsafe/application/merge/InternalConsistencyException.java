package ca.gc.cra.burstsafe.application.merge;

/**
 * Raised when two independently computed results of the engine disagree, for example the stitched raster line count
 * and the merged annotation line count. Always fatal to the run.
 *
 * @since 0.1.0
 */
public final class InternalConsistencyException extends IllegalStateException {
  private final String check;
  private final String expected;
  private final String actual;

  /**
   * @param check name of the failed cross-check
   * @param expected expected value
   * @param actual observed value
   */
  public InternalConsistencyException(String check, Object expected, Object actual) {
    super(check + ": expected " + expected + " but was " + actual);
    this.check = check;
    this.expected = String.valueOf(expected);
    this.actual = String.valueOf(actual);
  }

  public String check() {
    return check;
  }

  public String expected() {
    return expected;
  }

  public String actual() {
    return actual;
  }
}
