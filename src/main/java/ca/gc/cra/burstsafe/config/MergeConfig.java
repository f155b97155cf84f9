package ca.gc.cra.burstsafe.config;

import ca.gc.cra.burstsafe.domain.annotation.DocumentType;
import ca.gc.cra.burstsafe.validation.Numbers;
import ca.gc.cra.burstsafe.validation.Strings;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Options of a merge run.
 * <p><strong>Why:</strong> Consolidates YAML settings, overrides and defaults so runs stay reproducible across
 * environments.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by the merge use case and the composition root.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Describe which document types to merge and whether neighbour-swath metadata is included.</li>
 *   <li>Bound the eligibility tolerances, the minimum group size and the worker count.</li>
 *   <li>Carry the metrics exporter and logging verbosity.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param includeAllAnnotations build metadata-only annotations for every swath of the mode lacking bursts
 * @param minBurstsPerGroup groups with fewer members are rejected rather than merged; at least 1
 * @param documentTypes document types to merge; never empty
 * @param footprintToleranceDegrees per-edge tolerance of the cross-polarization footprint check
 * @param contiguityTolerance slack added to the burst repeat interval by the contiguity check
 * @param groupParallelism number of groups assembled concurrently; 1 runs on the calling thread
 * @param creationTime fixed creation time recorded in the rasters; empty uses the latest burst stop time
 * @param metricsExporter {@code otlp} or {@code none}
 * @param otelEndpoint OTLP endpoint; blank uses the OpenTelemetry environment
 * @param otelResourceAttributes extra {@code key=value} resource attributes; may be blank
 * @param verbose raise logging to DEBUG
 * @since 0.1.0
 */
public record MergeConfig(
    boolean includeAllAnnotations,
    int minBurstsPerGroup,
    Set<DocumentType> documentTypes,
    double footprintToleranceDegrees,
    Duration contiguityTolerance,
    int groupParallelism,
    Optional<Instant> creationTime,
    String metricsExporter,
    String otelEndpoint,
    String otelResourceAttributes,
    boolean verbose) {

  static final int MAX_PARALLELISM = 64;
  static final int MAX_MIN_BURSTS = 10_000;

  public MergeConfig {
    Numbers.requireRange("minBurstsPerGroup", minBurstsPerGroup, 1, MAX_MIN_BURSTS);
    Objects.requireNonNull(documentTypes, "documentTypes");
    if (documentTypes.isEmpty()) {
      throw new IllegalArgumentException("documentTypes must not be empty");
    }
    documentTypes = Collections.unmodifiableSet(EnumSet.copyOf(documentTypes));
    Numbers.requireRange("footprintToleranceDegrees", footprintToleranceDegrees, 0d, 10d);
    Objects.requireNonNull(contiguityTolerance, "contiguityTolerance");
    Numbers.requireRange("contiguityToleranceMillis", contiguityTolerance.toMillis(), 0, 60_000);
    Numbers.requireRange("groupParallelism", groupParallelism, 1, MAX_PARALLELISM);
    creationTime = Objects.requireNonNullElse(creationTime, Optional.empty());
    metricsExporter = Strings.requireNonBlank("metricsExporter", metricsExporter);
    otelEndpoint = Objects.requireNonNullElse(otelEndpoint, "").trim();
    otelResourceAttributes = Objects.requireNonNullElse(otelResourceAttributes, "").trim();
  }

  /**
   * Returns the baseline configuration.
   *
   * @return defaults: every document type, no include-all, one burst minimum, sequential, OTLP metrics
   */
  public static MergeConfig defaults() {
    return new MergeConfig(
        false,
        1,
        EnumSet.allOf(DocumentType.class),
        0.01d,
        Duration.ofMillis(100),
        1,
        Optional.empty(),
        "otlp",
        "",
        "",
        false);
  }

  /**
   * Creates a configuration from flat key/value pairs; missing keys keep their defaults.
   *
   * @param options keys such as {@code minBurstsPerGroup}, {@code documentTypes}, {@code creationTime}
   * @return populated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static MergeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    MergeConfig defaults = defaults();

    boolean includeAll = bool(options, "includeAllAnnotations", defaults.includeAllAnnotations());
    int minBursts = (int) Numbers.requireRange(
        "minBurstsPerGroup", integer(options, "minBurstsPerGroup", defaults.minBurstsPerGroup()), 1, MAX_MIN_BURSTS);
    Set<DocumentType> types = defaults.documentTypes();
    String typesRaw = options.get("documentTypes");
    if (typesRaw != null && !typesRaw.isBlank()) {
      EnumSet<DocumentType> parsed = EnumSet.noneOf(DocumentType.class);
      for (String label : Strings.splitCsv(typesRaw)) {
        parsed.add(DocumentType.fromString(label));
      }
      types = parsed;
    }
    double footprintTolerance = defaults.footprintToleranceDegrees();
    String toleranceRaw = options.get("footprintToleranceDegrees");
    if (toleranceRaw != null && !toleranceRaw.isBlank()) {
      footprintTolerance = Numbers.parseDouble("footprintToleranceDegrees", toleranceRaw);
    }
    Duration contiguity = Duration.ofMillis(
        integer(options, "contiguityToleranceMillis", defaults.contiguityTolerance().toMillis()));
    int parallelism = (int) Numbers.requireRange(
        "groupParallelism", integer(options, "groupParallelism", defaults.groupParallelism()), 1, MAX_PARALLELISM);
    Optional<Instant> creationTime = parseInstant(options.get("creationTime"));
    String exporter = firstNonBlank(options.get("metricsExporter"), defaults.metricsExporter());
    boolean verbose = bool(options, "verbose", defaults.verbose());

    return new MergeConfig(
        includeAll,
        minBursts,
        types,
        footprintTolerance,
        contiguity,
        parallelism,
        creationTime,
        exporter,
        options.getOrDefault("otelEndpoint", ""),
        options.getOrDefault("otelResourceAttributes", ""),
        verbose);
  }

  private static boolean bool(Map<String, String> options, String key, boolean defaultValue) {
    String raw = options.get(key);
    return raw == null || raw.isBlank() ? defaultValue : Strings.parseBoolean(key, raw);
  }

  private static long integer(Map<String, String> options, String key, long defaultValue) {
    String raw = options.get(key);
    return raw == null || raw.isBlank() ? defaultValue : Numbers.parseLong(key, raw);
  }

  private static Optional<Instant> parseInstant(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Instant.parse(raw.trim()));
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("creationTime must be an ISO-8601 instant (was " + raw + ")", ex);
    }
  }

  private static String firstNonBlank(String value, String defaultValue) {
    return value == null || value.isBlank() ? defaultValue : value.trim();
  }
}
