package ca.gc.cra.burstsafe.domain.annotation;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Formats and parses annotation timestamps ({@code 2023-04-22T18:46:39.515927}, UTC, no zone suffix).
 *
 * @since 0.1.0
 */
public final class AnnotationTimes {
  private static final DateTimeFormatter FORMAT =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS").withZone(ZoneOffset.UTC);

  private AnnotationTimes() {
    // Utility
  }

  /**
   * Formats an instant with microsecond precision.
   *
   * @param time instant to format
   * @return annotation timestamp text
   */
  public static String format(Instant time) {
    return FORMAT.format(Objects.requireNonNull(time, "time"));
  }

  /**
   * Parses an annotation timestamp as UTC.
   *
   * @param text timestamp text without zone suffix
   * @return parsed instant
   * @throws IllegalArgumentException when the text is not a valid timestamp
   */
  public static Instant parse(String text) {
    Objects.requireNonNull(text, "text");
    try {
      return LocalDateTime.parse(text.trim()).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("Invalid annotation timestamp: " + text, ex);
    }
  }
}
