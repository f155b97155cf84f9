package ca.gc.cra.burstsafe.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and overrides while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence overrides > YAML > defaults.
   *
   * @param mode active configuration section
   * @param yaml optional YAML-derived settings for the section
   * @param overrides key/value overrides, typically from the command line (may be empty)
   * @param defaults embedded defaults for the section
   * @param warn consumer invoked when an override replaces a YAML key or a key is unknown
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> overrides,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> overridesCopy = overrides == null ? Map.of() : overrides;
    Consumer<String> sink = warn == null ? message -> {} : warn;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    for (Map.Entry<String, String> entry : yamlCopy.entrySet()) {
      if (!defaultsCopy.isEmpty() && !defaultsCopy.containsKey(entry.getKey())) {
        sink.accept("Unknown " + mode + " configuration key in YAML: " + entry.getKey());
      }
      merged.put(entry.getKey(), entry.getValue());
    }
    for (Map.Entry<String, String> entry : overridesCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (yamlCopy.containsKey(key)) {
        sink.accept("Override replaces YAML value for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    String exporter = trim(effective.get("metricsExporter"));
    if (!exporter.isEmpty() && !Set.of("otlp", "none").contains(exporter.toLowerCase(Locale.ROOT))) {
      throw new IllegalArgumentException("metricsExporter must be otlp or none (was " + exporter + ")");
    }
    String endpoint = trim(effective.get("otelEndpoint"));
    if (!endpoint.isEmpty() && "none".equalsIgnoreCase(exporter)) {
      throw new IllegalArgumentException("otelEndpoint requires metricsExporter=otlp");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
