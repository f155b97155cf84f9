package ca.gc.cra.burstsafe.application.merge;

import ca.gc.cra.burstsafe.domain.annotation.DocumentType;
import ca.gc.cra.burstsafe.domain.burst.BurstId;
import java.util.Objects;

/**
 * Raised when an input annotation document lacks a mandatory field or carries a field of the wrong shape.
 *
 * @since 0.1.0
 */
public final class SchemaException extends MergeException {
  /** Field name reported when the whole document is missing. */
  public static final String WHOLE_DOCUMENT = "*";

  private final DocumentType documentType;
  private final String field;
  private final BurstId burst;

  /**
   * Creates a schema failure.
   *
   * @param documentType document kind
   * @param field field path, or {@link #WHOLE_DOCUMENT}
   * @param burst burst whose document is malformed
   * @param detail human-readable explanation
   */
  public SchemaException(DocumentType documentType, String field, BurstId burst, String detail) {
    super(documentType + " field " + field + " of " + burst + ": " + detail);
    this.documentType = Objects.requireNonNull(documentType, "documentType");
    this.field = Objects.requireNonNull(field, "field");
    this.burst = Objects.requireNonNull(burst, "burst");
  }

  public DocumentType documentType() {
    return documentType;
  }

  public String field() {
    return field;
  }

  public BurstId burst() {
    return burst;
  }
}
