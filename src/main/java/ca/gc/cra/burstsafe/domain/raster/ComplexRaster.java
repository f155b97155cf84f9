package ca.gc.cra.burstsafe.domain.raster;

import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Two-dimensional array of single-precision complex samples (CFloat32), row-major.
 * <p><strong>Why:</strong> Bursts and assembled swaths share one in-memory layout so stitching is a row copy.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the backing array is copied on construction and never exposed.</p>
 * <p><strong>Performance:</strong> Interleaved {@code re, im} floats; {@code lines * samples * 8} bytes.</p>
 *
 * @since 0.1.0
 */
public final class ComplexRaster {
  private final int lines;
  private final int samples;
  private final float[] data;

  private ComplexRaster(int lines, int samples, float[] data) {
    if (lines <= 0 || samples <= 0) {
      throw new IllegalArgumentException("Raster dimensions must be positive (" + lines + "x" + samples + ")");
    }
    if (data.length != 2L * lines * samples) {
      throw new IllegalArgumentException(
          "Expected " + (2L * lines * samples) + " floats for " + lines + "x" + samples + " raster (was " + data.length + ")");
    }
    this.lines = lines;
    this.samples = samples;
    this.data = data;
  }

  /**
   * Creates a raster from interleaved real/imaginary values.
   *
   * @param lines number of azimuth lines; positive
   * @param samples number of range samples per line; positive
   * @param interleaved {@code 2 * lines * samples} floats, {@code re, im} per sample; copied
   * @return raster
   */
  public static ComplexRaster of(int lines, int samples, float[] interleaved) {
    return new ComplexRaster(lines, samples, Objects.requireNonNull(interleaved, "interleaved").clone());
  }

  /**
   * Creates an all-zero raster.
   *
   * @param lines number of lines
   * @param samples samples per line
   * @return zero raster
   */
  public static ComplexRaster zeros(int lines, int samples) {
    return new ComplexRaster(lines, samples, new float[Math.multiplyExact(2, Math.multiplyExact(lines, samples))]);
  }

  public int lines() {
    return lines;
  }

  public int samples() {
    return samples;
  }

  public float real(int line, int sample) {
    return data[index(line, sample)];
  }

  public float imaginary(int line, int sample) {
    return data[index(line, sample) + 1];
  }

  /**
   * Copies one line of interleaved values into {@code target}.
   *
   * @param line line index
   * @param target destination array
   * @param targetOffset first float written in {@code target}
   */
  public void copyLine(int line, float[] target, int targetOffset) {
    System.arraycopy(data, index(line, 0), target, targetOffset, 2 * samples);
  }

  /**
   * @return a copy of the interleaved sample buffer
   */
  public float[] toInterleaved() {
    return data.clone();
  }

  private int index(int line, int sample) {
    Objects.checkIndex(line, lines);
    Objects.checkIndex(sample, samples);
    return 2 * (line * samples + sample);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ComplexRaster raster)) {
      return false;
    }
    return lines == raster.lines && samples == raster.samples && Arrays.equals(data, raster.data);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * lines + samples) + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "ComplexRaster[" + lines + "x" + samples + "]";
  }
}
