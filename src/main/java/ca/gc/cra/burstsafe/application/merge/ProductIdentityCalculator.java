package ca.gc.cra.burstsafe.application.merge;

import ca.gc.cra.burstsafe.domain.burst.GroupKey;
import ca.gc.cra.burstsafe.domain.product.AssembledRaster;
import ca.gc.cra.burstsafe.domain.product.ProductIdentity;
import ca.gc.cra.burstsafe.domain.raster.ComplexRaster;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Derives the product identity from the assembled rasters.
 * <p><strong>Why:</strong> The identity slot of the product name must be reproducible: the same input bursts and
 * creation time always yield the same id, whatever the input order or worker count.</p>
 * <p><strong>Thread-safety:</strong> Stateless; digests are created per call.</p>
 * <p><strong>Performance:</strong> Streams each raster one line at a time through the digest.</p>
 *
 * @implNote Canonical raster bytes are little-endian: line count, sample count, creation epoch second and nanosecond,
 *     then interleaved {@code re, im} floats row by row.
 * @since 0.1.0
 */
public final class ProductIdentityCalculator {
  private static final HexFormat HEX = HexFormat.of();

  /**
   * @param rasters assembled rasters of every merged group
   * @return identity with per-raster MD5 checksums, SHA-256 content digest and CRC-16 unique id
   */
  public ProductIdentity compute(List<AssembledRaster> rasters) {
    List<AssembledRaster> ordered = new ArrayList<>(rasters);
    ordered.sort(Comparator.comparing(AssembledRaster::key));
    Map<GroupKey, String> checksums = new TreeMap<>();
    MessageDigest content = digest("SHA-256");
    for (AssembledRaster raster : ordered) {
      byte[] md5 = rasterChecksum(raster);
      checksums.put(raster.key(), HEX.formatHex(md5));
      content.update(raster.key().label().getBytes(StandardCharsets.UTF_8));
      content.update(md5);
    }
    byte[] contentDigest = content.digest();
    String uniqueId = String.format(Locale.ROOT, "%04X", Crc16.ccittFalse(contentDigest));
    return new ProductIdentity(uniqueId, HEX.formatHex(contentDigest), checksums);
  }

  static byte[] rasterChecksum(AssembledRaster assembled) {
    MessageDigest md5 = digest("MD5");
    ComplexRaster raster = assembled.raster();
    Instant creationTime = assembled.creationTime();
    ByteBuffer header = ByteBuffer.allocate(Integer.BYTES * 3 + Long.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    header.putInt(raster.lines())
        .putInt(raster.samples())
        .putLong(creationTime.getEpochSecond())
        .putInt(creationTime.getNano());
    md5.update(header.array());

    float[] line = new float[2 * raster.samples()];
    ByteBuffer bytes = ByteBuffer.allocate(Float.BYTES * line.length).order(ByteOrder.LITTLE_ENDIAN);
    for (int l = 0; l < raster.lines(); l++) {
      raster.copyLine(l, line, 0);
      bytes.clear();
      bytes.asFloatBuffer().put(line);
      md5.update(bytes.array());
    }
    return md5.digest();
  }

  private static MessageDigest digest(String algorithm) {
    try {
      return MessageDigest.getInstance(algorithm);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException(algorithm + " digest unavailable", ex);
    }
  }
}
