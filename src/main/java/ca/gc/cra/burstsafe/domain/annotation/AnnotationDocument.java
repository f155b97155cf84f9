package ca.gc.cra.burstsafe.domain.annotation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One annotation document of a burst, flattened to an ordered map of field path to value.
 * <p><strong>Why:</strong> The merge engine dispatches on field paths through a static schema table, so it never has to
 * inspect a document tree at runtime.</p>
 * <p><strong>Role:</strong> Domain value produced by the external loader and consumed by the annotation assembler.</p>
 * <p><strong>Thread-safety:</strong> Immutable; field order is preserved from construction.</p>
 *
 * @param type document kind
 * @param fields ordered map of slash-separated field path (e.g. {@code swathTiming/burstList}) to value
 * @since 0.1.0
 */
public record AnnotationDocument(DocumentType type, Map<String, FieldValue> fields) {

  /**
   * Validates list ordering: every list must be strictly ascending by coordinate, so no coordinate repeats.
   *
   * @throws IllegalArgumentException when a list field is unordered or mixes time and line coordinates
   */
  public AnnotationDocument {
    Objects.requireNonNull(type, "type");
    Map<String, FieldValue> copy = new LinkedHashMap<>(Objects.requireNonNull(fields, "fields"));
    for (Map.Entry<String, FieldValue> field : copy.entrySet()) {
      if (field.getKey() == null || field.getKey().isBlank()) {
        throw new IllegalArgumentException(type + " document contains a blank field path");
      }
      Objects.requireNonNull(field.getValue(), field.getKey());
      if (field.getValue() instanceof FieldValue.Entries list) {
        requireAscending(type, field.getKey(), list.entries());
      }
    }
    fields = Collections.unmodifiableMap(copy);
  }

  /**
   * Looks up a field by path.
   *
   * @param path slash-separated field path
   * @return field value when present
   */
  public Optional<FieldValue> field(String path) {
    return Optional.ofNullable(fields.get(path));
  }

  /**
   * Looks up a scalar field by path.
   *
   * @param path slash-separated field path
   * @return scalar text when the field is present and scalar
   */
  public Optional<String> scalar(String path) {
    return field(path)
        .filter(FieldValue.Scalar.class::isInstance)
        .map(value -> ((FieldValue.Scalar) value).text());
  }

  /**
   * @param type document kind
   * @return builder collecting fields in insertion order
   */
  public static Builder builder(DocumentType type) {
    return new Builder(type);
  }

  private static void requireAscending(DocumentType type, String path, List<ListEntry> entries) {
    ListEntry previous = null;
    for (ListEntry entry : entries) {
      if (previous != null) {
        if (previous.azimuthTime().isPresent() != entry.azimuthTime().isPresent()) {
          throw new IllegalArgumentException(
              type + " list " + path + " mixes time-indexed and line-indexed entries");
        }
        if (compareCoordinates(previous, entry) >= 0) {
          throw new IllegalArgumentException(
              type + " list " + path + " is not strictly ascending by coordinate");
        }
      }
      previous = entry;
    }
  }

  /**
   * Orders entries by (time, pixel) when time-indexed, else by (line, pixel).
   */
  static int compareCoordinates(ListEntry left, ListEntry right) {
    int primary;
    if (left.azimuthTime().isPresent() && right.azimuthTime().isPresent()) {
      primary = left.azimuthTime().get().compareTo(right.azimuthTime().get());
    } else {
      primary = Integer.compare(left.line().orElse(-1), right.line().orElse(-1));
    }
    if (primary != 0) {
      return primary;
    }
    return Integer.compare(left.pixel().orElse(-1), right.pixel().orElse(-1));
  }

  /**
   * Mutable builder for {@link AnnotationDocument}; not thread-safe.
   */
  public static final class Builder {
    private final DocumentType type;
    private final Map<String, FieldValue> fields = new LinkedHashMap<>();

    private Builder(DocumentType type) {
      this.type = Objects.requireNonNull(type, "type");
    }

    public Builder scalar(String path, String text) {
      fields.put(path, FieldValue.scalar(text));
      return this;
    }

    public Builder time(String path, Instant time) {
      fields.put(path, FieldValue.scalar(AnnotationTimes.format(time)));
      return this;
    }

    public Builder entries(String path, List<ListEntry> entries) {
      fields.put(path, FieldValue.entries(entries));
      return this;
    }

    public AnnotationDocument build() {
      return new AnnotationDocument(type, fields);
    }
  }
}
