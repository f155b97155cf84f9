package ca.gc.cra.burstsafe.application.merge.strategy;

import static ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas.AZIMUTH_PIXEL_SPACING;
import static ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas.FIRST_LINE_TIME;
import static ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas.IMAGE_NUMBER;
import static ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas.LAST_LINE_TIME;
import static ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas.LINES_PER_BURST;
import static ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas.MEAN_IM;
import static ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas.MEAN_RE;
import static ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas.NUMBER_OF_LINES;
import static ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas.NUMBER_OF_SAMPLES;
import static ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas.PLATFORM_HEADING;
import static ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas.PRODUCT_COMPOSITION;
import static ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas.SAMPLES_PER_BURST;
import static ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas.SLICE_NUMBER;
import static ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas.START_TIME;
import static ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas.STD_DEV_IM;
import static ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas.STD_DEV_RE;
import static ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas.STOP_TIME;

import ca.gc.cra.burstsafe.domain.annotation.AnnotationTimes;
import ca.gc.cra.burstsafe.domain.product.MergedValue;
import ca.gc.cra.burstsafe.domain.raster.RasterStatistics;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * <strong>What:</strong> Registry of recomputation rules for Merge-category fields.
 * <p><strong>Why:</strong> A field with no entry here must resolve to the unresolved sentinel; the registry is the single
 * place deciding which derived values the engine knows how to compute.</p>
 * <p><strong>Thread-safety:</strong> Immutable after class initialization; rules are pure functions.</p>
 *
 * @since 0.1.0
 */
public final class MergeRules {
  private static final Map<String, MergeRule> RULES = buildRules();

  private MergeRules() {}

  /**
   * Looks up the rule of a field.
   *
   * @param path field path
   * @return rule when one is registered
   */
  public static Optional<MergeRule> forField(String path) {
    return Optional.ofNullable(RULES.get(path));
  }

  private static Map<String, MergeRule> buildRules() {
    Map<String, MergeRule> rules = new LinkedHashMap<>();
    rules.put(START_TIME, (context, values) -> time(context.layout().start()));
    rules.put(STOP_TIME, (context, values) -> time(context.layout().stop()));
    rules.put(FIRST_LINE_TIME, (context, values) -> time(context.layout().start()));
    rules.put(LAST_LINE_TIME, (context, values) -> time(context.layout().stop()));
    rules.put(IMAGE_NUMBER,
        (context, values) -> MergedValue.resolved(String.format(Locale.ROOT, "%03d", context.imageNumber())));
    rules.put(PLATFORM_HEADING, (context, values) -> mean(values, "%.14e"));
    rules.put(AZIMUTH_PIXEL_SPACING, (context, values) -> mean(values, "%.6e"));
    rules.put(PRODUCT_COMPOSITION, (context, values) -> MergedValue.resolved("Assembled"));
    rules.put(SLICE_NUMBER, (context, values) -> MergedValue.resolved("0"));
    rules.put(NUMBER_OF_LINES,
        (context, values) -> MergedValue.resolved(Integer.toString(context.layout().totalLines())));
    rules.put(NUMBER_OF_SAMPLES, (context, values) -> max(values));
    rules.put(LINES_PER_BURST, (context, values) -> max(values));
    rules.put(SAMPLES_PER_BURST, (context, values) -> max(values));
    rules.put(MEAN_RE, statistic(RasterStatistics::meanReal));
    rules.put(MEAN_IM, statistic(RasterStatistics::meanImaginary));
    rules.put(STD_DEV_RE, statistic(RasterStatistics::stdDevReal));
    rules.put(STD_DEV_IM, statistic(RasterStatistics::stdDevImaginary));
    return Map.copyOf(rules);
  }

  private static MergedValue time(Instant instant) {
    return MergedValue.resolved(AnnotationTimes.format(instant));
  }

  private static MergedValue mean(List<String> values, String format) {
    if (values.isEmpty()) {
      return MergedValue.unresolved();
    }
    double sum = 0d;
    for (String value : values) {
      Optional<Double> parsed = parseDouble(value);
      if (parsed.isEmpty()) {
        return MergedValue.unresolved();
      }
      sum += parsed.get();
    }
    return MergedValue.resolved(String.format(Locale.ROOT, format, sum / values.size()));
  }

  private static MergedValue max(List<String> values) {
    Long max = null;
    for (String value : values) {
      try {
        long parsed = Long.parseLong(value.trim());
        max = max == null ? parsed : Math.max(max, parsed);
      } catch (NumberFormatException ex) {
        return MergedValue.unresolved();
      }
    }
    return max == null ? MergedValue.unresolved() : MergedValue.resolved(Long.toString(max));
  }

  private static MergeRule statistic(ToDoubleFunction<RasterStatistics> component) {
    return (context, values) -> context.statistics()
        .map(statistics -> MergedValue.resolved(
            String.format(Locale.ROOT, "%.6e", component.applyAsDouble(statistics))))
        .orElse(MergedValue.unresolved());
  }

  private static Optional<Double> parseDouble(String value) {
    try {
      double parsed = Double.parseDouble(value.trim());
      return Double.isFinite(parsed) ? Optional.of(parsed) : Optional.empty();
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
  }
}
