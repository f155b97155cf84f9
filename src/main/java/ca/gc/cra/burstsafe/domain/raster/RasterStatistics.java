package ca.gc.cra.burstsafe.domain.raster;

import java.util.Optional;

/**
 * Mean and standard deviation of the real and imaginary parts of the valid samples of an assembled raster.
 *
 * @param meanReal mean of real parts
 * @param meanImaginary mean of imaginary parts
 * @param stdDevReal population standard deviation of real parts
 * @param stdDevImaginary population standard deviation of imaginary parts
 * @param validSamples number of samples the statistics cover; positive
 * @since 0.1.0
 */
public record RasterStatistics(
    double meanReal,
    double meanImaginary,
    double stdDevReal,
    double stdDevImaginary,
    long validSamples) {

  public RasterStatistics {
    if (validSamples <= 0) {
      throw new IllegalArgumentException("Statistics require at least one valid sample");
    }
  }

  /**
   * Running accumulator for raster statistics; not thread-safe, one per raster.
   */
  public static final class Accumulator {
    private double sumRe;
    private double sumIm;
    private double sumSqRe;
    private double sumSqIm;
    private long count;

    /**
     * Adds one valid sample.
     *
     * @param re real part
     * @param im imaginary part
     */
    public void add(float re, float im) {
      sumRe += re;
      sumIm += im;
      sumSqRe += (double) re * re;
      sumSqIm += (double) im * im;
      count++;
    }

    public long count() {
      return count;
    }

    /**
     * @return statistics, or empty when no valid sample was added
     */
    public Optional<RasterStatistics> result() {
      if (count == 0) {
        return Optional.empty();
      }
      double meanRe = sumRe / count;
      double meanIm = sumIm / count;
      double varRe = Math.max(0d, sumSqRe / count - meanRe * meanRe);
      double varIm = Math.max(0d, sumSqIm / count - meanIm * meanIm);
      return Optional.of(new RasterStatistics(meanRe, meanIm, Math.sqrt(varRe), Math.sqrt(varIm), count));
    }
  }
}
