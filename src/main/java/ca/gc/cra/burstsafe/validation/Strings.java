package ca.gc.cra.burstsafe.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings read from configuration files and overrides.
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Parses a strict boolean option ({@code true} or {@code false}, any case).
   *
   * @param name option name for diagnostics
   * @param value option text
   * @return parsed value
   * @throws IllegalArgumentException when the text is neither {@code true} nor {@code false}
   */
  public static boolean parseBoolean(String name, String value) {
    String normalized = requireNonBlank(name, value).toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(message(name, "must be true or false (was " + value + ")"));
    };
  }

  /**
   * Splits a comma-separated list, trimming items and dropping empty ones.
   *
   * @param value list text; {@code null} yields an empty list
   * @return items in order
   */
  public static List<String> splitCsv(String value) {
    List<String> items = new ArrayList<>();
    if (value == null) {
      return items;
    }
    for (String token : value.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        items.add(trimmed);
      }
    }
    return items;
  }

  private static boolean containsControl(String value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String detail) {
    return (name == null || name.isBlank() ? "value" : name) + " " + detail;
  }
}
