package ca.gc.cra.burstsafe.application.merge;

import java.util.Objects;

/**
 * CRC-16/CCITT-FALSE (polynomial {@code 0x1021}, initial value {@code 0xFFFF}, no reflection, no final XOR).
 *
 * @since 0.1.0
 */
public final class Crc16 {
  private static final int POLYNOMIAL = 0x1021;
  private static final int INITIAL = 0xFFFF;

  private Crc16() {}

  /**
   * @param data bytes to checksum
   * @return checksum in the low 16 bits
   */
  public static int ccittFalse(byte[] data) {
    Objects.requireNonNull(data, "data");
    int crc = INITIAL;
    for (byte b : data) {
      crc ^= (b & 0xFF) << 8;
      for (int bit = 0; bit < 8; bit++) {
        crc = (crc & 0x8000) != 0 ? (crc << 1) ^ POLYNOMIAL : crc << 1;
        crc &= 0xFFFF;
      }
    }
    return crc;
  }
}
