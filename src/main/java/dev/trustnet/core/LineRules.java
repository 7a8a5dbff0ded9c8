/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import dev.trustnet.api.ErrorCode;
import dev.trustnet.api.RequestContext;
import dev.trustnet.api.TrustLine;
import dev.trustnet.api.TrustLineException;

/** Preconditions of the settings mutations: creation, quality, rippling flag and limits. */
final class LineRules {
  private LineRules() {}

  static void checkOpening(long assetId, long limitLo, long limitHi) {
    if (assetId < 0) {
      throw new TrustLineException(ErrorCode.INVALID_LIMIT, "asset id must be >= 0");
    }
    checkLimits(limitLo, limitHi);
  }

  static void checkQuality(long qualityIn, long qualityOut) {
    if (!inQualityRange(qualityIn) || !inQualityRange(qualityOut)) {
      throw new TrustLineException(
          ErrorCode.INVALID_QUALITY, "quality must be in (0, " + TrustLine.QUALITY_SCALE + "]");
    }
  }

  static TrustLine setRippling(TrustLine line, boolean allowRippling, long nowS) {
    if (allowRippling && line.frozen()) {
      throw new TrustLineException(ErrorCode.TRUST_LINE_FROZEN, "trust line is frozen");
    }
    return line.withRippling(allowRippling, nowS);
  }

  /**
   * Applies a jointly signed limit change.
   *
   * <p>Both parties must sign, the line must not be frozen, and neither limit may drop below the
   * exposure the balance currently carries on its side.
   */
  static TrustLine updateLimits(
      RequestContext ctx, TrustLine line, long newLimitLo, long newLimitHi, long nowS) {
    if (!ctx.signedBy(line.pair().lo()) || !ctx.signedBy(line.pair().hi())) {
      throw new TrustLineException(
          ErrorCode.MISSING_COSIGNATURE, "limit changes require both parties' signatures");
    }
    checkLimits(newLimitLo, newLimitHi);
    if (line.frozen()) {
      throw new TrustLineException(ErrorCode.TRUST_LINE_FROZEN, "trust line is frozen");
    }
    long balance = line.balance();
    if (balance >= 0 && newLimitLo < balance) {
      throw new TrustLineException(
          ErrorCode.LIMIT_BELOW_EXPOSURE, "limitLo " + newLimitLo + " below balance " + balance);
    }
    if (balance < 0 && newLimitHi < -balance) {
      throw new TrustLineException(
          ErrorCode.LIMIT_BELOW_EXPOSURE, "limitHi " + newLimitHi + " below balance " + balance);
    }
    return line.withLimits(newLimitLo, newLimitHi, nowS);
  }

  private static void checkLimits(long limitLo, long limitHi) {
    if (limitLo <= 0 || limitHi <= 0) {
      throw new TrustLineException(ErrorCode.INVALID_LIMIT, "limits must be > 0");
    }
  }

  private static boolean inQualityRange(long quality) {
    return quality > 0 && quality <= TrustLine.QUALITY_SCALE;
  }
}
