package ca.gc.cra.burstsafe.domain.raster;

import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Raster tile of one burst together with its per-line validity bounds.
 * <p><strong>Why:</strong> TOPS bursts carry invalid samples at their range and azimuth edges; the stitcher zeroes them
 * and the statistics exclude them.</p>
 * <p><strong>Thread-safety:</strong> Immutable; bound arrays are copied on construction and on access.</p>
 *
 * @since 0.1.0
 */
public final class BurstRaster {
  /** Bound value marking a line with no valid sample. */
  public static final int INVALID_LINE = -1;

  private final ComplexRaster samples;
  private final int[] firstValidSample;
  private final int[] lastValidSample;

  /**
   * Creates a burst raster.
   *
   * @param samples complex samples of the burst
   * @param firstValidSample per-line index of the first valid sample, or {@link #INVALID_LINE}
   * @param lastValidSample per-line index of the last valid sample (inclusive), or {@link #INVALID_LINE}
   * @throws IllegalArgumentException when bounds do not cover every line or fall outside the line
   */
  public BurstRaster(ComplexRaster samples, int[] firstValidSample, int[] lastValidSample) {
    this.samples = Objects.requireNonNull(samples, "samples");
    this.firstValidSample = Objects.requireNonNull(firstValidSample, "firstValidSample").clone();
    this.lastValidSample = Objects.requireNonNull(lastValidSample, "lastValidSample").clone();
    if (this.firstValidSample.length != samples.lines() || this.lastValidSample.length != samples.lines()) {
      throw new IllegalArgumentException("Validity bounds must have one entry per line (" + samples.lines() + ")");
    }
    for (int line = 0; line < samples.lines(); line++) {
      int first = this.firstValidSample[line];
      int last = this.lastValidSample[line];
      if (first == INVALID_LINE || last == INVALID_LINE) {
        continue;
      }
      if (first < 0 || last >= samples.samples() || first > last) {
        throw new IllegalArgumentException(
            "Invalid validity bounds [" + first + ", " + last + "] on line " + line);
      }
    }
  }

  /**
   * Creates a burst raster whose samples are all valid.
   *
   * @param samples complex samples
   * @return fully valid burst raster
   */
  public static BurstRaster fullyValid(ComplexRaster samples) {
    int[] first = new int[samples.lines()];
    int[] last = new int[samples.lines()];
    Arrays.fill(last, samples.samples() - 1);
    return new BurstRaster(samples, first, last);
  }

  public ComplexRaster samples() {
    return samples;
  }

  public int lines() {
    return samples.lines();
  }

  public int width() {
    return samples.samples();
  }

  /**
   * @param line line index
   * @return {@code true} when the line has at least one valid sample
   */
  public boolean isLineValid(int line) {
    return firstValidSample[line] != INVALID_LINE && lastValidSample[line] != INVALID_LINE;
  }

  public int firstValidSample(int line) {
    return firstValidSample[line];
  }

  public int lastValidSample(int line) {
    return lastValidSample[line];
  }
}
