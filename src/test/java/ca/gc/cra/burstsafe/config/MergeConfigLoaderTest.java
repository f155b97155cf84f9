package ca.gc.cra.burstsafe.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MergeConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void resolvesYamlAndOverrides() throws IOException {
    Path yaml = tempDir.resolve("burstsafe.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
        merge:
          includeAllAnnotations: true
          groupParallelism: 2
        """);

    MergeConfig config = MergeConfigLoader.load(yaml, Map.of("groupParallelism", "6"));

    assertTrue(config.includeAllAnnotations());
    assertEquals(6, config.groupParallelism());
    assertEquals("none", config.metricsExporter());
  }

  @Test
  void missingFileFallsBackToDefaults() throws IOException {
    MergeConfig config = MergeConfigLoader.load(tempDir.resolve("absent.yaml"), Map.of());

    assertEquals(MergeConfig.defaults(), config);
  }

  @Test
  void nullPathUsesOverridesOnly() throws IOException {
    MergeConfig config = MergeConfigLoader.load(null, Map.of("minBurstsPerGroup", "4"));

    assertEquals(4, config.minBurstsPerGroup());
  }
}
