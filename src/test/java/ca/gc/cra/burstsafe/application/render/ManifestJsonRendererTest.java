package ca.gc.cra.burstsafe.application.render;

import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.burstsafe.domain.burst.AcquisitionMode;
import ca.gc.cra.burstsafe.domain.burst.Envelope;
import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import ca.gc.cra.burstsafe.domain.burst.Polarization;
import ca.gc.cra.burstsafe.domain.burst.Swath;
import ca.gc.cra.burstsafe.domain.product.ComponentRole;
import ca.gc.cra.burstsafe.domain.product.Manifest;
import ca.gc.cra.burstsafe.domain.product.ManifestComponent;
import ca.gc.cra.burstsafe.domain.product.ProductIdentity;
import ca.gc.cra.burstsafe.domain.product.ProductSummary;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ManifestJsonRendererTest {

  @Test
  void rendersIdentitySummaryComponentsAndFootprint() {
    GroupKey key = new GroupKey(Swath.IW1, Polarization.VV);
    Manifest manifest = new Manifest(
        new ProductIdentity("1A2B", "ab".repeat(32), Map.of(key, "cd".repeat(16))),
        new ProductSummary(AcquisitionMode.IW, 50000,
            Instant.parse("2024-03-01T10:00:00Z"), Instant.parse("2024-03-01T10:00:01.6Z"),
            List.of(Polarization.VV), List.of(Swath.IW1)),
        List.of(new ManifestComponent("measurement-iw1-vv-001", ComponentRole.MEASUREMENT, key, 1, "cd".repeat(16))),
        new Envelope(11, 45, 12, 46));

    String json = new String(new ManifestJsonRenderer().render(manifest), StandardCharsets.UTF_8);

    assertTrue(json.startsWith("{\"identity\":{\"uniqueId\":\"1A2B\""), json);
    assertTrue(json.contains("\"rasterChecksums\":{\"iw1-vv\":\"" + "cd".repeat(16) + "\"}"), json);
    assertTrue(json.contains("\"summary\":{\"mode\":\"IW\",\"absoluteOrbit\":50000,"
        + "\"start\":\"2024-03-01T10:00:00.000000\",\"stop\":\"2024-03-01T10:00:01.600000\","
        + "\"polarizations\":[\"VV\"],\"swaths\":[\"IW1\"]}"), json);
    assertTrue(json.contains("{\"id\":\"measurement-iw1-vv-001\",\"role\":\"MEASUREMENT\",\"swath\":\"iw1\","
        + "\"polarization\":\"vv\",\"imageNumber\":1,\"checksum\":\"" + "cd".repeat(16) + "\"}"), json);
    assertTrue(json.endsWith("\"footprint\":{\"minLongitude\":11.0,\"minLatitude\":45.0,"
        + "\"maxLongitude\":12.0,\"maxLatitude\":46.0}}"), json);
  }
}
