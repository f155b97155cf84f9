package ca.gc.cra.burstsafe.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads the {@link MergeConfig} of a run from an optional YAML file and overrides.
 * <p><strong>Role:</strong> Configuration helper used by the composition root.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class MergeConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(MergeConfigLoader.class);

  private MergeConfigLoader() {}

  /**
   * Resolves the effective merge configuration.
   *
   * @param yamlPath YAML file with {@code common} and {@code merge} sections; may be {@code null} or absent
   * @param overrides key/value overrides taking precedence over YAML; may be empty
   * @return validated configuration
   * @throws IOException if the YAML file exists but cannot be read
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static MergeConfig load(Path yamlPath, Map<String, String> overrides) throws IOException {
    Objects.requireNonNull(overrides, "overrides");
    Optional<Map<String, String>> yaml = yamlPath == null
        ? Optional.empty()
        : YamlConfigLoader.load(yamlPath, DefaultsForMode.MERGE);
    if (yamlPath != null && yaml.isEmpty()) {
      log.warn("Configuration file {} not found; using defaults and overrides", yamlPath);
    }
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        DefaultsForMode.MERGE,
        yaml,
        overrides,
        DefaultsForMode.asFlatMap(DefaultsForMode.MERGE),
        log::warn);
    MergeConfig config = MergeConfig.fromMap(effective);
    log.debug("Effective merge configuration: {}", config);
    return config;
  }
}
