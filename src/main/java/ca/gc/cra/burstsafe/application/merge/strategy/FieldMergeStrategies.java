package ca.gc.cra.burstsafe.application.merge.strategy;

import ca.gc.cra.burstsafe.domain.annotation.FieldValue;
import ca.gc.cra.burstsafe.domain.annotation.ListEntry;
import ca.gc.cra.burstsafe.domain.burst.BurstTiming;
import ca.gc.cra.burstsafe.domain.product.MergedValue;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> The Include, Concatenate and Merge field strategies.
 * <p><strong>Why:</strong> Each merged field is produced by exactly one of these pure functions, selected through
 * {@link AnnotationSchemas}; keeping them free of document walking makes each one testable on its own.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Include: earliest member's value verbatim.</li>
 *   <li>Concatenate: earliest-wins concatenation of list entries re-indexed onto the group line axis, restricted to
 *       the group time window.</li>
 *   <li>Merge: field-specific recomputation, or the unresolved sentinel when no rule exists.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use by group workers.</p>
 *
 * @since 0.1.0
 */
public final class FieldMergeStrategies {

  private FieldMergeStrategies() {}

  /**
   * Returns the value of the earliest member. A field the earliest member lacks is absent from the result even when
   * later members carry it.
   *
   * @param path field path
   * @param members members in group order
   * @return earliest member's value, or empty when it does not carry the field
   */
  public static Optional<FieldValue> include(String path, List<MemberView> members) {
    Objects.requireNonNull(path, "path");
    if (members.isEmpty()) {
      return Optional.empty();
    }
    return members.get(0).document().field(path);
  }

  /**
   * Concatenates a list field across the group.
   *
   * <p>Member {@code i > 0} contributes only entries strictly later than every entry accepted from earlier members and,
   * for line-indexed entries, not inside its trimmed overlap. Lines are re-indexed to the group axis. Entries outside
   * {@code (start - buffer, stop + buffer)} are then dropped, as are entries off {@code [0, totalLines]} when the
   * rule is line bounded.</p>
   *
   * <p>{@link FieldRule.ListScope#UNIQUE} rules skip the time window, {@link FieldRule.ListScope#ALL} rules append every
   * member's entries unchanged and {@link FieldRule.ListScope#EMPTIED} rules always yield an empty list.</p>
   *
   * @param rule concatenation rule of the field
   * @param members members in group order
   * @param context group-wide inputs
   * @return merged entries, strictly ascending by coordinate
   */
  public static List<ListEntry> concatenate(FieldRule rule, List<MemberView> members, MergeContext context) {
    Objects.requireNonNull(rule, "rule");
    if (rule.scope() == FieldRule.ListScope.EMPTIED) {
      return List.of();
    }
    if (rule.scope() == FieldRule.ListScope.ALL) {
      List<ListEntry> all = new ArrayList<>();
      for (MemberView member : members) {
        member.document().field(rule.path())
            .filter(FieldValue.Entries.class::isInstance)
            .ifPresent(value -> all.addAll(((FieldValue.Entries) value).entries()));
      }
      return all;
    }
    boolean windowed = rule.scope() == FieldRule.ListScope.WINDOWED;
    Instant lower = context.layout().start().minus(rule.windowBuffer());
    Instant upper = context.layout().stop().plus(rule.windowBuffer());
    int totalLines = context.layout().totalLines();

    List<ListEntry> merged = new ArrayList<>();
    Instant cutoff = null;
    for (MemberView member : members) {
      Optional<FieldValue> value = member.document().field(rule.path());
      if (value.isEmpty() || !(value.get() instanceof FieldValue.Entries list)) {
        continue;
      }
      Instant latestAccepted = cutoff;
      for (ListEntry entry : list.entries()) {
        Instant time = effectiveTime(entry, member.burst().timing());
        if (cutoff != null && !time.isAfter(cutoff)) {
          continue;
        }
        ListEntry placed = entry;
        if (entry.line().isPresent()) {
          int localLine = entry.line().getAsInt();
          if (localLine < member.placement().overlapTrim()) {
            continue;
          }
          placed = entry.withLine(member.placement().toGroupLine(localLine));
        }
        if (latestAccepted == null || time.isAfter(latestAccepted)) {
          latestAccepted = time;
        }
        if (windowed && (!time.isAfter(lower) || !time.isBefore(upper))) {
          continue;
        }
        if (rule.lineBounded() && placed.line().isPresent()) {
          int line = placed.line().getAsInt();
          if (line < 0 || line > totalLines) {
            continue;
          }
        }
        merged.add(placed);
      }
      cutoff = latestAccepted;
    }
    return merged;
  }

  /**
   * Recomputes a Merge-category field.
   *
   * @param path field path
   * @param memberValues the field's text in every member carrying it, in group order
   * @param context group-wide inputs
   * @return recomputed value, or the unresolved sentinel when no rule is registered or the rule cannot compute one
   */
  public static MergedValue merge(String path, List<String> memberValues, MergeContext context) {
    return MergeRules.forField(path)
        .map(rule -> rule.apply(context, List.copyOf(memberValues)))
        .orElse(MergedValue.unresolved());
  }

  /**
   * Time coordinate of an entry: its azimuth time, or the time of its line within the owning burst.
   */
  static Instant effectiveTime(ListEntry entry, BurstTiming timing) {
    if (entry.azimuthTime().isPresent()) {
      return entry.azimuthTime().get();
    }
    return timing.lineTime(entry.line().getAsInt());
  }
}
