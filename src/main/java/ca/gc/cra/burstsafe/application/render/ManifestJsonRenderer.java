package ca.gc.cra.burstsafe.application.render;

import ca.gc.cra.burstsafe.domain.annotation.AnnotationTimes;
import ca.gc.cra.burstsafe.domain.burst.Envelope;
import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import ca.gc.cra.burstsafe.domain.burst.Polarization;
import ca.gc.cra.burstsafe.domain.burst.Swath;
import ca.gc.cra.burstsafe.domain.product.Manifest;
import ca.gc.cra.burstsafe.domain.product.ManifestComponent;
import ca.gc.cra.burstsafe.domain.product.ProductIdentity;
import ca.gc.cra.burstsafe.domain.product.ProductSummary;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical JSON rendering of a {@link Manifest}; thread-safe.
 *
 * @since 0.1.0
 */
public final class ManifestJsonRenderer {
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * @param manifest product manifest
   * @return UTF-8 JSON bytes
   */
  public byte[] render(Manifest manifest) {
    Objects.requireNonNull(manifest, "manifest");
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      writeIdentity(gen, manifest.identity());
      writeSummary(gen, manifest.summary());
      gen.writeArrayFieldStart("components");
      for (ManifestComponent component : manifest.components()) {
        gen.writeStartObject();
        gen.writeStringField("id", component.id());
        gen.writeStringField("role", component.role().name());
        gen.writeStringField("swath", component.key().swath().label());
        gen.writeStringField("polarization", component.key().polarization().label());
        gen.writeNumberField("imageNumber", component.imageNumber());
        gen.writeStringField("checksum", component.checksum());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      writeFootprint(gen, manifest.footprint());
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render manifest " + manifest.identity().uniqueId(), ex);
    }
    return out.toByteArray();
  }

  private static void writeIdentity(JsonGenerator gen, ProductIdentity identity) throws IOException {
    gen.writeObjectFieldStart("identity");
    gen.writeStringField("uniqueId", identity.uniqueId());
    gen.writeStringField("contentDigest", identity.contentDigest());
    gen.writeObjectFieldStart("rasterChecksums");
    for (Map.Entry<GroupKey, String> checksum : identity.rasterChecksums().entrySet()) {
      gen.writeStringField(checksum.getKey().label(), checksum.getValue());
    }
    gen.writeEndObject();
    gen.writeEndObject();
  }

  private static void writeSummary(JsonGenerator gen, ProductSummary summary) throws IOException {
    gen.writeObjectFieldStart("summary");
    gen.writeStringField("mode", summary.mode().name());
    gen.writeNumberField("absoluteOrbit", summary.absoluteOrbit());
    gen.writeStringField("start", AnnotationTimes.format(summary.start()));
    gen.writeStringField("stop", AnnotationTimes.format(summary.stop()));
    gen.writeArrayFieldStart("polarizations");
    for (Polarization polarization : summary.polarizations()) {
      gen.writeString(polarization.name());
    }
    gen.writeEndArray();
    gen.writeArrayFieldStart("swaths");
    for (Swath swath : summary.swaths()) {
      gen.writeString(swath.name());
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private static void writeFootprint(JsonGenerator gen, Envelope footprint) throws IOException {
    gen.writeObjectFieldStart("footprint");
    gen.writeNumberField("minLongitude", footprint.minLongitude());
    gen.writeNumberField("minLatitude", footprint.minLatitude());
    gen.writeNumberField("maxLongitude", footprint.maxLongitude());
    gen.writeNumberField("maxLatitude", footprint.maxLatitude());
    gen.writeEndObject();
  }
}
