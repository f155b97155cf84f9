package ca.gc.cra.burstsafe.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.burstsafe.application.merge.MergeResult;
import ca.gc.cra.burstsafe.application.pipeline.BurstMergeUseCase;
import ca.gc.cra.burstsafe.application.port.MetricsPort;
import ca.gc.cra.burstsafe.application.render.AnnotationJsonRenderer;
import ca.gc.cra.burstsafe.application.render.ManifestJsonRenderer;
import ca.gc.cra.burstsafe.config.MergeConfig;
import ca.gc.cra.burstsafe.domain.burst.Polarization;
import ca.gc.cra.burstsafe.testutil.BurstFixtures;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectoryProductSinkAdapterTest {

  @TempDir Path tempDir;

  @Test
  void writesManifestAnnotationsAndMeasurement() throws Exception {
    MergeResult result = merge();
    Path product = tempDir.resolve("product");

    try (DirectoryProductSinkAdapter sink =
        new DirectoryProductSinkAdapter(product, new AnnotationJsonRenderer(), new ManifestJsonRenderer())) {
      sink.write(result);
    }

    String manifest = Files.readString(product.resolve("manifest.json"), StandardCharsets.UTF_8);
    assertTrue(manifest.contains("measurement-iw1-vv-001"), manifest);
    assertEquals(List.of(
            "calibration-iw1-vv-001.json",
            "noise-iw1-vv-001.json",
            "product-iw1-vv-001.json",
            "rfi-iw1-vv-001.json"),
        list(product.resolve("annotation")));

    Path measurement = product.resolve("measurement").resolve("measurement-iw1-vv-001.cf32");
    byte[] bytes = Files.readAllBytes(measurement);
    assertEquals(17 * 4 * 2 * Float.BYTES, bytes.length);
    ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    assertEquals(1001f, buffer.getFloat(0));
    assertEquals(0f, buffer.getFloat(Float.BYTES));
  }

  private static MergeResult merge() throws Exception {
    MergeConfig config = MergeConfig.fromMap(Map.of("metricsExporter", "none"));
    BurstMergeUseCase useCase = new BurstMergeUseCase(config, List::of, result -> {}, MetricsPort.NO_OP);
    return useCase.merge(BurstFixtures.twoBurstGroup(Polarization.VV));
  }

  private static List<String> list(Path directory) throws Exception {
    try (Stream<Path> files = Files.list(directory)) {
      return files.map(path -> path.getFileName().toString()).sorted().collect(Collectors.toList());
    }
  }
}
