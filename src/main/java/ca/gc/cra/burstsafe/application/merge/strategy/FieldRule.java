package ca.gc.cra.burstsafe.application.merge.strategy;

import java.time.Duration;
import java.util.Objects;

/**
 * Schema entry describing how one annotation field is merged.
 *
 * @param path slash-separated field path
 * @param strategy merge strategy
 * @param required whether every member document must carry the field
 * @param windowBuffer margin around the group time window kept by concatenation
 * @param lineBounded whether concatenated entries must also fall on {@code [0, totalLines]}
 * @param burstAligned whether the field describes the raster lines of the group; such fields are emptied (lists) or
 *     dropped (scalars) in metadata-only documents
 * @param scope which entries a concatenated list keeps
 * @since 0.1.0
 */
public record FieldRule(
    String path,
    MergeStrategy strategy,
    boolean required,
    Duration windowBuffer,
    boolean lineBounded,
    boolean burstAligned,
    ListScope scope) {

  /** Default concatenation margin. */
  public static final Duration DEFAULT_BUFFER = Duration.ofSeconds(3);

  public FieldRule {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(strategy, "strategy");
    windowBuffer = Objects.requireNonNullElse(windowBuffer, DEFAULT_BUFFER);
    if (windowBuffer.isNegative()) {
      throw new IllegalArgumentException("windowBuffer must not be negative");
    }
    scope = Objects.requireNonNullElse(scope, ListScope.WINDOWED);
    if (scope != ListScope.WINDOWED && strategy != MergeStrategy.CONCATENATE) {
      throw new IllegalArgumentException("List scope " + scope + " requires a concatenated field: " + path);
    }
  }

  public static FieldRule include(String path) {
    return new FieldRule(path, MergeStrategy.INCLUDE, false, DEFAULT_BUFFER, false, false, ListScope.WINDOWED);
  }

  public static FieldRule concatenate(String path) {
    return concatenate(path, DEFAULT_BUFFER);
  }

  public static FieldRule concatenate(String path, Duration windowBuffer) {
    return new FieldRule(path, MergeStrategy.CONCATENATE, false, windowBuffer, false, false, ListScope.WINDOWED);
  }

  /**
   * Concatenates every distinct entry of the members, earliest member winning, without time filtering.
   */
  public static FieldRule concatenateUnique(String path) {
    return new FieldRule(path, MergeStrategy.CONCATENATE, false, DEFAULT_BUFFER, false, false, ListScope.UNIQUE);
  }

  /**
   * Appends the entries of every member in member order, untouched.
   */
  public static FieldRule concatenateAll(String path) {
    return new FieldRule(path, MergeStrategy.CONCATENATE, false, DEFAULT_BUFFER, false, false, ListScope.ALL);
  }

  /**
   * Declares a list that a merged product always carries empty.
   */
  public static FieldRule emptied(String path) {
    return new FieldRule(path, MergeStrategy.CONCATENATE, false, DEFAULT_BUFFER, false, false, ListScope.EMPTIED);
  }

  public static FieldRule merge(String path) {
    return new FieldRule(path, MergeStrategy.MERGE, false, DEFAULT_BUFFER, false, false, ListScope.WINDOWED);
  }

  public FieldRule asRequired() {
    return new FieldRule(path, strategy, true, windowBuffer, lineBounded, burstAligned, scope);
  }

  public FieldRule withLineBounds() {
    return new FieldRule(path, strategy, required, windowBuffer, true, burstAligned, scope);
  }

  public FieldRule asBurstAligned() {
    return new FieldRule(path, strategy, required, windowBuffer, lineBounded, true, scope);
  }

  /**
   * Entries a concatenated list keeps.
   */
  public enum ListScope {
    /** Earliest-wins entries inside the group time window, re-indexed onto the group axis. */
    WINDOWED,
    /** Earliest-wins entries of every member, with no time window. */
    UNIQUE,
    /** Every entry of every member in member order, coordinates untouched. */
    ALL,
    /** No entries. */
    EMPTIED
  }
}
