package ca.gc.cra.burstsafe.config;

import ca.gc.cra.burstsafe.domain.annotation.DocumentType;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Supplies flattened default configuration maps per configuration section.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  /** Section holding merge-run options. */
  public static final String MERGE = "merge";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode configuration section; only {@code merge} is supported
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case MERGE -> buildMergeDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    MergeConfig defaults = MergeConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", defaults.metricsExporter());
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", Boolean.toString(defaults.verbose()));
    return Map.copyOf(map);
  }

  private static Map<String, String> buildMergeDefaults() {
    MergeConfig defaults = MergeConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("includeAllAnnotations", Boolean.toString(defaults.includeAllAnnotations()));
    map.put("minBurstsPerGroup", Integer.toString(defaults.minBurstsPerGroup()));
    map.put("documentTypes", defaults.documentTypes().stream()
        .map(DocumentType::name)
        .collect(Collectors.joining(",")));
    map.put("footprintToleranceDegrees", Double.toString(defaults.footprintToleranceDegrees()));
    map.put("contiguityToleranceMillis", Long.toString(defaults.contiguityTolerance().toMillis()));
    map.put("groupParallelism", Integer.toString(defaults.groupParallelism()));
    map.put("creationTime", "");
    return map;
  }
}
