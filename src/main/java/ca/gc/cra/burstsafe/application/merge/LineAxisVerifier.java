package ca.gc.cra.burstsafe.application.merge;

import ca.gc.cra.burstsafe.application.merge.strategy.AnnotationSchemas;
import ca.gc.cra.burstsafe.application.merge.strategy.FieldRule;
import ca.gc.cra.burstsafe.domain.annotation.DocumentType;
import ca.gc.cra.burstsafe.domain.annotation.ListEntry;
import ca.gc.cra.burstsafe.domain.burst.BurstRecord;
import ca.gc.cra.burstsafe.domain.product.AssembledRaster;
import ca.gc.cra.burstsafe.domain.product.BurstGroup;
import ca.gc.cra.burstsafe.domain.product.GroupLayout;
import ca.gc.cra.burstsafe.domain.product.MergedAnnotation;
import ca.gc.cra.burstsafe.domain.product.MergedField;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Cross-checks the stitched raster of a group against its members and against the line axis
 * the concatenated annotation lists were re-indexed onto.
 * <p><strong>Why:</strong> Stitching and concatenation place burst lines independently; a disagreement is an engine
 * defect and must abort the run rather than produce a product whose annotations point at the wrong lines.</p>
 * <p><strong>Checks:</strong>
 * <ul>
 *   <li>Raster lines equal the member raster lines minus the overlap of every adjacent pair.</li>
 *   <li>The stitcher's per-member line offsets follow the same arithmetic.</li>
 *   <li>The merged burst list holds one entry per member and {@code numberOfLines} matches the raster.</li>
 *   <li>Line-indexed concatenated entries never decrease, and line-bounded ones stay on {@code [0, lines]}.</li>
 * </ul>
 * <p>Annotation checks apply to whichever document types were merged; the raster checks always run.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class LineAxisVerifier {

  private LineAxisVerifier() {}

  /**
   * Verifies one merged group.
   *
   * @param group time-ordered members
   * @param raster stitched raster of the group
   * @param annotations merged documents of the group
   * @throws InternalConsistencyException when any check fails
   */
  public static void verify(BurstGroup group, AssembledRaster raster, List<MergedAnnotation> annotations) {
    Objects.requireNonNull(group, "group");
    Objects.requireNonNull(raster, "raster");
    Objects.requireNonNull(annotations, "annotations");
    checkRaster(group, raster);
    for (MergedAnnotation annotation : annotations) {
      if (annotation.metadataOnly()) {
        continue;
      }
      if (annotation.type() == DocumentType.PRODUCT) {
        checkProduct(group, raster, annotation);
      }
      checkLineAxis(raster, annotation);
    }
  }

  private static void checkRaster(BurstGroup group, AssembledRaster raster) {
    List<BurstRecord> members = group.members();
    List<Integer> offsets = raster.burstLineOffsets();
    if (offsets.size() != members.size()) {
      throw new InternalConsistencyException("raster.burstLineOffsets", members.size(), offsets.size());
    }
    int expectedOffset = 0;
    int usable = 0;
    for (int i = 0; i < members.size(); i++) {
      BurstRecord member = members.get(i);
      expectedOffset += usable;
      int trim = i == 0 ? 0 : GroupLayout.overlapLines(members.get(i - 1), member);
      usable = member.raster().lines() - trim;
      if (offsets.get(i) != expectedOffset) {
        throw new InternalConsistencyException(
            "raster.burstLineOffsets[" + i + "]", expectedOffset, offsets.get(i));
      }
    }
    int expectedLines = expectedOffset + usable;
    if (raster.lines() != expectedLines) {
      throw new InternalConsistencyException("raster.lines", expectedLines, raster.lines());
    }
  }

  private static void checkProduct(BurstGroup group, AssembledRaster raster, MergedAnnotation product) {
    Optional<MergedField> bursts = product.field(AnnotationSchemas.BURST_LIST);
    if (bursts.isPresent() && bursts.get() instanceof MergedField.Concatenated list
        && list.entries().size() != group.size()) {
      throw new InternalConsistencyException("annotation.burstList", group.size(), list.entries().size());
    }
    String declared = product.text(AnnotationSchemas.NUMBER_OF_LINES)
        .orElseThrow(() -> new InternalConsistencyException(
            "annotation.numberOfLines", raster.lines(), "unresolved"));
    if (!declared.equals(Integer.toString(raster.lines()))) {
      throw new InternalConsistencyException("annotation.numberOfLines", raster.lines(), declared);
    }
  }

  private static void checkLineAxis(AssembledRaster raster, MergedAnnotation annotation) {
    for (FieldRule rule : AnnotationSchemas.forType(annotation.type())) {
      if (rule.scope() != FieldRule.ListScope.WINDOWED && rule.scope() != FieldRule.ListScope.UNIQUE) {
        continue;
      }
      Optional<MergedField> field = annotation.field(rule.path());
      if (field.isEmpty() || !(field.get() instanceof MergedField.Concatenated list)) {
        continue;
      }
      int previousLine = Integer.MIN_VALUE;
      for (ListEntry entry : list.entries()) {
        if (entry.line().isEmpty()) {
          continue;
        }
        int line = entry.line().getAsInt();
        if (line < previousLine) {
          throw new InternalConsistencyException(
              "annotation." + rule.path() + ".order", ">= " + previousLine, line);
        }
        if (rule.lineBounded() && (line < 0 || line > raster.lines())) {
          throw new InternalConsistencyException(
              "annotation." + rule.path() + ".bounds", "[0, " + raster.lines() + "]", line);
        }
        previousLine = line;
      }
    }
  }
}
