/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.util;

import java.util.Objects;

/** Hex encoding helpers for identity bytes. */
public final class Hex {
  private static final char[] DIGITS = "0123456789abcdef".toCharArray();

  private Hex() {}

  /**
   * Encodes bytes as lower-case hex.
   *
   * @param bytes input
   * @return hex string, two characters per byte
   */
  public static String encode(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes");
    char[] out = new char[bytes.length * 2];
    for (int i = 0; i < bytes.length; i++) {
      int v = bytes[i] & 0xff;
      out[i * 2] = DIGITS[v >>> 4];
      out[i * 2 + 1] = DIGITS[v & 0x0f];
    }
    return new String(out);
  }

  /**
   * Decodes a hex string (either case).
   *
   * @param hex even-length hex string
   * @return decoded bytes
   * @throws IllegalArgumentException on odd length or a non-hex character
   */
  public static byte[] decode(String hex) {
    Objects.requireNonNull(hex, "hex");
    if ((hex.length() & 1) != 0) {
      throw new IllegalArgumentException("hex string must have even length");
    }
    byte[] out = new byte[hex.length() / 2];
    for (int i = 0; i < out.length; i++) {
      int hi = Character.digit(hex.charAt(i * 2), 16);
      int lo = Character.digit(hex.charAt(i * 2 + 1), 16);
      if (hi < 0 || lo < 0) {
        throw new IllegalArgumentException("invalid hex character at offset " + (i * 2));
      }
      out[i] = (byte) ((hi << 4) | lo);
    }
    return out;
  }
}
