/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.api;

import dev.trustnet.util.Hex;
import java.util.Arrays;

/**
 * Participant identity: exactly {@value #LENGTH} opaque bytes.
 *
 * <p>Identities are totally ordered by unsigned lexicographic byte comparison, which is the order
 * used to assign the low/high roles of a trust line.
 */
public final class AccountId implements Comparable<AccountId> {
  /** Required identity length in bytes. */
  public static final int LENGTH = 32;

  private final byte[] bytes;

  private AccountId(byte[] bytes) {
    this.bytes = bytes;
  }

  /**
   * Wraps a copy of the given bytes.
   *
   * @param bytes identity bytes
   * @return identity
   * @throws TrustLineException with {@link ErrorCode#INVALID_ACCOUNT} if the shape is wrong
   */
  public static AccountId of(byte[] bytes) {
    if (bytes == null || bytes.length != LENGTH) {
      throw new TrustLineException(
          ErrorCode.INVALID_ACCOUNT, "account id must be " + LENGTH + " bytes");
    }
    return new AccountId(bytes.clone());
  }

  /**
   * Parses the 64-character hex form.
   *
   * @param hex hex string, case-insensitive
   * @return identity
   * @throws TrustLineException with {@link ErrorCode#INVALID_ACCOUNT} if not valid hex of the
   *     right length
   */
  public static AccountId fromHex(String hex) {
    if (hex == null) {
      throw new TrustLineException(ErrorCode.INVALID_ACCOUNT, "account id required");
    }
    String trimmed = hex.trim();
    if (trimmed.length() != LENGTH * 2) {
      throw new TrustLineException(
          ErrorCode.INVALID_ACCOUNT, "account id must be " + (LENGTH * 2) + " hex characters");
    }
    try {
      return new AccountId(Hex.decode(trimmed));
    } catch (IllegalArgumentException e) {
      throw new TrustLineException(ErrorCode.INVALID_ACCOUNT, e.getMessage(), e);
    }
  }

  /**
   * Returns a copy of the identity bytes.
   *
   * @return 32-byte array
   */
  public byte[] toBytes() {
    return bytes.clone();
  }

  /**
   * Lower-case hex form.
   *
   * @return 64 hex characters
   */
  public String toHex() {
    return Hex.encode(bytes);
  }

  @Override
  public int compareTo(AccountId other) {
    return Arrays.compareUnsigned(bytes, other.bytes);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof AccountId other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  /** Short form for logs: the first eight hex characters. */
  @Override
  public String toString() {
    return toHex().substring(0, 8);
  }
}
