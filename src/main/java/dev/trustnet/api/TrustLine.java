/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.api;

import java.util.Objects;

/**
 * Snapshot of one bilateral credit line.
 *
 * <p>{@code balance > 0} means {@code pair.hi()} is net obligated to {@code pair.lo()}. The
 * balance satisfies {@code -limitHi <= balance <= limitLo} on every line that is not {@link
 * #frozen()}. Freezing pins both limits to zero but keeps the balance, so a frozen line may sit
 * outside its bounds; it accepts no payments and only a settlement can move its balance, always
 * towards zero. Instances are immutable; the {@code with*} methods return modified copies.
 *
 * @param pair canonical address of the line
 * @param id creation sequence number (audit only, never used for addressing)
 * @param assetId fungible unit the line is denominated in
 * @param limitLo maximum positive balance (credit extended by {@code lo} to {@code hi})
 * @param limitHi maximum magnitude of a negative balance (credit extended by {@code hi})
 * @param balance signed net position
 * @param qualityIn inbound rate scaled by {@link #QUALITY_SCALE}
 * @param qualityOut outbound rate scaled by {@link #QUALITY_SCALE}
 * @param allowRippling whether the line may carry multi-hop payments
 * @param createdAtS creation time, epoch seconds
 * @param updatedAtS last mutation time, epoch seconds
 */
public record TrustLine(
    CanonicalPair pair,
    long id,
    long assetId,
    long limitLo,
    long limitHi,
    long balance,
    long qualityIn,
    long qualityOut,
    boolean allowRippling,
    long createdAtS,
    long updatedAtS) {

  /** Fixed-point scale of quality factors; also the parity value. */
  public static final long QUALITY_SCALE = 1_000_000L;

  public TrustLine {
    Objects.requireNonNull(pair, "pair");
  }

  /**
   * A freshly opened line: zero balance, parity qualities.
   *
   * @param pair canonical pair
   * @param id creation sequence number
   * @param assetId denominated asset
   * @param limitLo low-side limit
   * @param limitHi high-side limit
   * @param allowRippling rippling flag
   * @param nowS creation time, epoch seconds
   * @return new line snapshot
   */
  public static TrustLine open(
      CanonicalPair pair,
      long id,
      long assetId,
      long limitLo,
      long limitHi,
      boolean allowRippling,
      long nowS) {
    return new TrustLine(
        pair,
        id,
        assetId,
        limitLo,
        limitHi,
        0L,
        QUALITY_SCALE,
        QUALITY_SCALE,
        allowRippling,
        nowS,
        nowS);
  }

  /**
   * Whether the administrator froze this line. Only {@code freeze} can pin both limits to zero.
   *
   * @return {@code true} once frozen
   */
  public boolean frozen() {
    return limitLo == 0L && limitHi == 0L;
  }

  /**
   * Whether {@code balance} is within {@code [-limitHi, limitLo]}.
   *
   * @param balance candidate balance
   * @return {@code true} if admissible under the current limits
   */
  public boolean admits(long balance) {
    return balance <= limitLo && balance >= -limitHi;
  }

  public TrustLine withBalance(long newBalance, long nowS) {
    return new TrustLine(
        pair, id, assetId, limitLo, limitHi, newBalance, qualityIn, qualityOut, allowRippling,
        createdAtS, nowS);
  }

  public TrustLine withLimits(long newLimitLo, long newLimitHi, long nowS) {
    return new TrustLine(
        pair, id, assetId, newLimitLo, newLimitHi, balance, qualityIn, qualityOut, allowRippling,
        createdAtS, nowS);
  }

  public TrustLine withQuality(long newQualityIn, long newQualityOut, long nowS) {
    return new TrustLine(
        pair, id, assetId, limitLo, limitHi, balance, newQualityIn, newQualityOut, allowRippling,
        createdAtS, nowS);
  }

  public TrustLine withRippling(boolean flag, long nowS) {
    return new TrustLine(
        pair, id, assetId, limitLo, limitHi, balance, qualityIn, qualityOut, flag, createdAtS,
        nowS);
  }
}
