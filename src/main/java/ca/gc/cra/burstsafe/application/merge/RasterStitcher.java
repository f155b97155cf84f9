package ca.gc.cra.burstsafe.application.merge;

import ca.gc.cra.burstsafe.domain.burst.BurstRecord;
import ca.gc.cra.burstsafe.domain.product.AssembledRaster;
import ca.gc.cra.burstsafe.domain.product.BurstGroup;
import ca.gc.cra.burstsafe.domain.product.GroupLayout;
import ca.gc.cra.burstsafe.domain.raster.BurstRaster;
import ca.gc.cra.burstsafe.domain.raster.ComplexRaster;
import ca.gc.cra.burstsafe.domain.raster.RasterStatistics;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Stitches the raster tiles of a burst group into one continuous raster.
 * <p><strong>Why:</strong> Consecutive bursts overlap in azimuth; the stitcher writes each member's rows after its
 * overlap trim at its layout offset so every group line comes from exactly one burst.</p>
 * <p><strong>Role:</strong> Application service invoked once per group.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Zero samples outside each line's validity bounds and lines with no valid sample.</li>
 *   <li>Accumulate statistics over valid samples only.</li>
 *   <li>Cross-check the written line count against the layout.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use on distinct groups.</p>
 * <p><strong>Performance:</strong> One output buffer of {@code totalLines * maxSamples} complex samples; narrower
 * members leave the trailing samples of their rows at zero.</p>
 *
 * @since 0.1.0
 */
public final class RasterStitcher {

  /**
   * Stitches a group.
   *
   * @param group time-ordered burst group
   * @param layout layout computed for {@code group}
   * @param creationTime fixed timestamp recorded with the raster
   * @return assembled raster with statistics over its valid samples
   * @throws InternalConsistencyException when the written line count differs from the layout total
   */
  public AssembledRaster stitch(BurstGroup group, GroupLayout layout, Instant creationTime) {
    Objects.requireNonNull(group, "group");
    Objects.requireNonNull(layout, "layout");
    int width = layout.maxSamples();
    float[] output = new float[Math.multiplyExact(2, Math.multiplyExact(layout.totalLines(), width))];
    RasterStatistics.Accumulator statistics = new RasterStatistics.Accumulator();
    List<Integer> offsets = new ArrayList<>(group.size());
    float[] row = new float[2 * width];
    int written = 0;

    for (int i = 0; i < group.size(); i++) {
      BurstRecord member = group.members().get(i);
      GroupLayout.MemberPlacement placement = layout.placement(i);
      BurstRaster tile = member.raster();
      ComplexRaster samples = tile.samples();
      offsets.add(placement.lineOffset());
      for (int local = placement.overlapTrim(); local < tile.lines(); local++) {
        int groupLine = placement.toGroupLine(local);
        if (groupLine >= layout.totalLines()) {
          throw new InternalConsistencyException("stitch.lineOffset", layout.totalLines() - 1, groupLine);
        }
        written++;
        if (!tile.isLineValid(local)) {
          continue;
        }
        samples.copyLine(local, row, 0);
        int first = tile.firstValidSample(local);
        int last = tile.lastValidSample(local);
        int base = 2 * groupLine * width;
        for (int s = first; s <= last; s++) {
          float re = row[2 * s];
          float im = row[2 * s + 1];
          output[base + 2 * s] = re;
          output[base + 2 * s + 1] = im;
          statistics.add(re, im);
        }
      }
    }

    if (written != layout.totalLines()) {
      throw new InternalConsistencyException("stitch.lines", layout.totalLines(), written);
    }
    return new AssembledRaster(
        group.key(),
        ComplexRaster.of(layout.totalLines(), width, output),
        statistics.result(),
        offsets,
        creationTime);
  }
}
