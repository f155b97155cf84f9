package ca.gc.cra.burstsafe.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by configuration parsing.
 * <p><strong>Why:</strong> Guards against invalid merge parameters (worker counts, tolerances, thresholds) before a run
 * allocates pools or rasters.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a floating point value is finite and within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is NaN, infinite or outside {@code [min, max]}
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (!Double.isFinite(value) || value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer option.
   *
   * @param name option name for diagnostics
   * @param raw option text
   * @return parsed value
   * @throws IllegalArgumentException when {@code raw} is not an integer
   */
  public static long parseLong(String name, String raw) {
    try {
      return Long.parseLong(Strings.requireNonBlank(name, raw));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was " + raw + ")", ex);
    }
  }

  /**
   * Parses a decimal floating point option.
   *
   * @param name option name for diagnostics
   * @param raw option text
   * @return parsed value
   * @throws IllegalArgumentException when {@code raw} is not a number
   */
  public static double parseDouble(String name, String raw) {
    try {
      return Double.parseDouble(Strings.requireNonBlank(name, raw));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was " + raw + ")", ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
