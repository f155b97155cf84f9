package ca.gc.cra.burstsafe.application.merge;

import ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas;
import ca.gc.cra.burstsafe.application.merge.strategy.FieldMergeStrategies;
import ca.gc.cra.burstsafe.application.merge.strategy.FieldRule;
import ca.gc.cra.burstsafe.application.merge.strategy.MemberView;
import ca.gc.cra.burstsafe.application.merge.strategy.MergeContext;
import ca.gc.cra.burstsafe.application.merge.strategy.MergeStrategy;
import ca.gc.cra.burstsafe.domain.annotation.AnnotationDocument;
import ca.gc.cra.burstsafe.domain.annotation.DocumentType;
import ca.gc.cra.burstsafe.domain.annotation.FieldValue;
import ca.gc.cra.burstsafe.domain.burst.BurstRecord;
import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import ca.gc.cra.burstsafe.domain.product.BurstGroup;
import ca.gc.cra.burstsafe.domain.product.GroupLayout;
import ca.gc.cra.burstsafe.domain.product.MergedAnnotation;
import ca.gc.cra.burstsafe.domain.product.MergedField;
import ca.gc.cra.burstsafe.domain.product.MergedValue;
import ca.gc.cra.burstsafe.domain.raster.RasterStatistics;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds one {@link MergedAnnotation} per document type for a burst group.
 * <p><strong>Why:</strong> Walks the static schema table of each document type and dispatches every field to its
 * strategy, so adding a field is a table edit rather than new control flow.</p>
 * <p><strong>Role:</strong> Application service invoked once per group by the merge use case.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject structurally malformed inputs with {@link SchemaException}.</li>
 *   <li>Collect an {@link UnresolvedFieldWarning} for every Merge field resolving to the sentinel.</li>
 *   <li>Build metadata-only documents for swaths without bursts when include-all-annotations is requested.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; one instance may serve all group workers.</p>
 * <p><strong>Observability:</strong> Logs skipped document types at debug level.</p>
 *
 * @since 0.1.0
 */
public final class AnnotationAssembler {
  private static final Logger log = LoggerFactory.getLogger(AnnotationAssembler.class);

  /**
   * Merged documents of one group with the warnings raised while building them.
   *
   * @param annotations merged documents in {@link DocumentType} order
   * @param warnings unresolved Merge fields
   */
  public record AssembledAnnotations(List<MergedAnnotation> annotations, List<UnresolvedFieldWarning> warnings) {
    public AssembledAnnotations {
      annotations = List.copyOf(annotations);
      warnings = List.copyOf(warnings);
    }
  }

  /**
   * Merges the annotation documents of a group.
   *
   * @param group time-ordered burst group
   * @param layout layout of the group
   * @param imageNumber image number shared with the group's measurement
   * @param statistics statistics of the assembled raster
   * @param types document types to produce
   * @return merged documents and warnings
   * @throws SchemaException when a document is missing from some members or lacks a required field
   */
  public AssembledAnnotations assemble(
      BurstGroup group,
      GroupLayout layout,
      int imageNumber,
      Optional<RasterStatistics> statistics,
      Set<DocumentType> types) throws SchemaException {
    Objects.requireNonNull(group, "group");
    Objects.requireNonNull(layout, "layout");
    List<MergedAnnotation> annotations = new ArrayList<>();
    List<UnresolvedFieldWarning> warnings = new ArrayList<>();
    for (DocumentType type : DocumentType.values()) {
      if (!types.contains(type)) {
        continue;
      }
      Optional<List<MemberView>> members = views(group, layout, type, member -> member.document(type));
      if (members.isEmpty()) {
        log.debug("No member of {} carries a {} document; skipping", group.key().label(), type.label());
        continue;
      }
      MergeContext context = new MergeContext(group.key(), type, imageNumber, layout, statistics, false);
      annotations.add(mergeDocument(context, members.get(), warnings));
    }
    return new AssembledAnnotations(annotations, warnings);
  }

  /**
   * Builds metadata-only documents for a swath with no bursts of its own, from the sibling metadata carried by the
   * members of a donor group of the same polarization.
   *
   * <p>Burst-aligned lists are emptied and burst-aligned scalars omitted, since no raster exists for the swath.</p>
   *
   * @param key swath and polarization of the documents to build
   * @param donor group whose members carry sibling metadata for {@code key.swath()}
   * @param donorLayout layout of the donor group, supplying the time window
   * @param imageNumber image number reserved for {@code key}
   * @param types document types to produce
   * @return merged documents and warnings; empty when the donor carries no sibling metadata
   * @throws SchemaException when sibling documents are missing from some members or lack a required field
   */
  public AssembledAnnotations assembleMetadataOnly(
      GroupKey key,
      BurstGroup donor,
      GroupLayout donorLayout,
      int imageNumber,
      Set<DocumentType> types) throws SchemaException {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(donor, "donor");
    if (key.polarization() != donor.key().polarization()) {
      throw new IllegalArgumentException("Donor " + donor.key().label() + " does not image " + key.label());
    }
    List<MergedAnnotation> annotations = new ArrayList<>();
    List<UnresolvedFieldWarning> warnings = new ArrayList<>();
    GroupLayout unaligned = unalignedLayout(donorLayout);
    for (DocumentType type : DocumentType.values()) {
      if (!types.contains(type)) {
        continue;
      }
      Optional<List<MemberView>> members =
          views(donor, unaligned, type, member -> member.siblingDocument(key.swath(), type));
      if (members.isEmpty()) {
        continue;
      }
      MergeContext context = new MergeContext(key, type, imageNumber, unaligned, Optional.empty(), true);
      annotations.add(mergeDocument(context, members.get(), warnings));
    }
    return new AssembledAnnotations(annotations, warnings);
  }

  private static Optional<List<MemberView>> views(
      BurstGroup group,
      GroupLayout layout,
      DocumentType type,
      Function<BurstRecord, Optional<AnnotationDocument>> lookup) throws SchemaException {
    List<MemberView> views = new ArrayList<>(group.size());
    BurstRecord missing = null;
    for (int i = 0; i < group.size(); i++) {
      BurstRecord member = group.members().get(i);
      Optional<AnnotationDocument> document = lookup.apply(member);
      if (document.isPresent()) {
        views.add(new MemberView(member, document.get(), layout.placement(i)));
      } else if (missing == null) {
        missing = member;
      }
    }
    if (views.isEmpty()) {
      return Optional.empty();
    }
    if (missing != null) {
      throw new SchemaException(type, SchemaException.WHOLE_DOCUMENT, missing.identity(),
          "document missing while other members of " + group.key().label() + " carry it");
    }
    return Optional.of(views);
  }

  private static MergedAnnotation mergeDocument(
      MergeContext context, List<MemberView> members, List<UnresolvedFieldWarning> warnings)
      throws SchemaException {
    Map<String, MergedField> fields = new LinkedHashMap<>();
    for (FieldRule rule : AnnotationSchemas.forType(context.type())) {
      if (rule.scope() == FieldRule.ListScope.EMPTIED) {
        fields.put(rule.path(), new MergedField.Concatenated(List.of()));
        continue;
      }
      List<FieldValue> values = collect(context.type(), rule, members);
      if (values.isEmpty()) {
        continue;
      }
      switch (rule.strategy()) {
        case INCLUDE -> FieldMergeStrategies.include(rule.path(), members)
            .ifPresent(value -> fields.put(rule.path(), new MergedField.Copied(value)));
        case CONCATENATE -> {
          if (context.metadataOnly() && rule.burstAligned()) {
            fields.put(rule.path(), new MergedField.Concatenated(List.of()));
          } else {
            fields.put(rule.path(), new MergedField.Concatenated(
                FieldMergeStrategies.concatenate(rule, members, context)));
          }
        }
        case MERGE -> {
          if (context.metadataOnly() && rule.burstAligned()) {
            continue;
          }
          List<String> texts = new ArrayList<>(values.size());
          for (FieldValue value : values) {
            texts.add(((FieldValue.Scalar) value).text());
          }
          MergedValue merged = FieldMergeStrategies.merge(rule.path(), texts, context);
          if (!merged.isResolved()) {
            warnings.add(new UnresolvedFieldWarning(context.type(), rule.path(), context.key()));
          }
          fields.put(rule.path(), new MergedField.Recomputed(merged));
        }
      }
    }
    return new MergedAnnotation(context.key(), context.type(), context.imageNumber(), context.metadataOnly(), fields);
  }

  /**
   * Gathers the field from every member in order, checking presence and shape.
   */
  private static List<FieldValue> collect(DocumentType type, FieldRule rule, List<MemberView> members)
      throws SchemaException {
    List<FieldValue> values = new ArrayList<>(members.size());
    for (MemberView member : members) {
      Optional<FieldValue> value = member.document().field(rule.path());
      if (value.isEmpty()) {
        if (rule.required()) {
          throw new SchemaException(type, rule.path(), member.burst().identity(), "required field is missing");
        }
        continue;
      }
      boolean list = value.get() instanceof FieldValue.Entries;
      boolean expectsList = rule.strategy() == MergeStrategy.CONCATENATE;
      if (rule.strategy() != MergeStrategy.INCLUDE && list != expectsList) {
        throw new SchemaException(type, rule.path(), member.burst().identity(),
            expectsList ? "expected a list field" : "expected a scalar field");
      }
      values.add(value.get());
    }
    return values;
  }

  private static GroupLayout unalignedLayout(GroupLayout layout) {
    List<GroupLayout.MemberPlacement> placements = new ArrayList<>(layout.placements().size());
    for (GroupLayout.MemberPlacement placement : layout.placements()) {
      placements.add(new GroupLayout.MemberPlacement(placement.burst(), 0, 0, placement.usableLines()));
    }
    return new GroupLayout(placements, layout.totalLines(), layout.maxSamples(), layout.start(), layout.stop());
  }
}
