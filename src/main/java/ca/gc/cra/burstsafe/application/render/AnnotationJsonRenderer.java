package ca.gc.cra.burstsafe.application.render;

import ca.gc.cra.burstsafe.domain.annotation.AnnotationTimes;
import ca.gc.cra.burstsafe.domain.annotation.FieldValue;
import ca.gc.cra.burstsafe.domain.annotation.ListEntry;
import ca.gc.cra.burstsafe.domain.product.MergedAnnotation;
import ca.gc.cra.burstsafe.domain.product.MergedField;
import ca.gc.cra.burstsafe.domain.product.MergedValue;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Canonical JSON rendering of a {@link MergedAnnotation}.
 * <p><strong>Why:</strong> Writers serialize merged documents from this form, the manifest checksums it, and
 * determinism checks compare it byte for byte.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; {@link JsonFactory} is shareable and generators are per call.</p>
 *
 * @implNote Fields keep schema order. Lists render as {@code {"count": n, "entries": [...]}}; the unresolved
 *     sentinel renders as {@code {"unresolved": true}}.
 * @since 0.1.0
 */
public final class AnnotationJsonRenderer {
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * @param annotation merged document
   * @return UTF-8 JSON bytes
   */
  public byte[] render(MergedAnnotation annotation) {
    Objects.requireNonNull(annotation, "annotation");
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("swath", annotation.key().swath().label());
      gen.writeStringField("polarization", annotation.key().polarization().label());
      gen.writeStringField("documentType", annotation.type().label());
      gen.writeNumberField("imageNumber", annotation.imageNumber());
      gen.writeBooleanField("metadataOnly", annotation.metadataOnly());
      gen.writeObjectFieldStart("fields");
      for (Map.Entry<String, MergedField> field : annotation.fields().entrySet()) {
        gen.writeFieldName(field.getKey());
        writeField(gen, field.getValue());
      }
      gen.writeEndObject();
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render " + annotation.type() + " " + annotation.key().label(), ex);
    }
    return out.toByteArray();
  }

  private static void writeField(JsonGenerator gen, MergedField field) throws IOException {
    if (field instanceof MergedField.Copied copied) {
      if (copied.value() instanceof FieldValue.Scalar scalar) {
        gen.writeString(scalar.text());
      } else {
        writeEntries(gen, ((FieldValue.Entries) copied.value()).entries());
      }
    } else if (field instanceof MergedField.Concatenated concatenated) {
      writeEntries(gen, concatenated.entries());
    } else {
      MergedValue value = ((MergedField.Recomputed) field).value();
      if (value instanceof MergedValue.Resolved resolved) {
        gen.writeString(resolved.value());
      } else {
        gen.writeStartObject();
        gen.writeBooleanField("unresolved", true);
        gen.writeEndObject();
      }
    }
  }

  static void writeEntries(JsonGenerator gen, List<ListEntry> entries) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("count", entries.size());
    gen.writeArrayFieldStart("entries");
    for (ListEntry entry : entries) {
      gen.writeStartObject();
      if (entry.azimuthTime().isPresent()) {
        gen.writeStringField("azimuthTime", AnnotationTimes.format(entry.azimuthTime().get()));
      }
      if (entry.line().isPresent()) {
        gen.writeNumberField("line", entry.line().getAsInt());
      }
      if (entry.pixel().isPresent()) {
        gen.writeNumberField("pixel", entry.pixel().getAsInt());
      }
      gen.writeObjectFieldStart("values");
      for (Map.Entry<String, String> value : entry.values().entrySet()) {
        gen.writeStringField(value.getKey(), value.getValue());
      }
      gen.writeEndObject();
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }
}
