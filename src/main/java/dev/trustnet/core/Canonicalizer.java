/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import dev.trustnet.api.AccountId;
import dev.trustnet.api.CanonicalPair;
import dev.trustnet.api.ErrorCode;
import dev.trustnet.api.TrustLineException;

/**
 * Assigns the low/high roles of an unordered participant pair.
 *
 * <p>Every component resolves a pair through here before touching the store, so one record
 * addresses the relationship regardless of call direction.
 */
public final class Canonicalizer {
  private Canonicalizer() {}

  /**
   * Orders two distinct identities.
   *
   * @param p one participant
   * @param q other participant
   * @return pair with {@code lo < hi}; {@code canonicalize(p, q).equals(canonicalize(q, p))}
   * @throws TrustLineException {@link ErrorCode#INVALID_ACCOUNT} for a missing identity, {@link
   *     ErrorCode#SELF_TRUST_LINE} when {@code p.equals(q)}
   */
  public static CanonicalPair canonicalize(AccountId p, AccountId q) {
    if (p == null || q == null) {
      throw new TrustLineException(ErrorCode.INVALID_ACCOUNT, "both participants required");
    }
    int cmp = p.compareTo(q);
    if (cmp == 0) {
      throw new TrustLineException(ErrorCode.SELF_TRUST_LINE, "participants must differ");
    }
    return cmp < 0 ? new CanonicalPair(p, q) : new CanonicalPair(q, p);
  }

  /**
   * Sign applied to an amount paid by {@code sender} on {@code pair}.
   *
   * @param pair canonical pair
   * @param sender paying party
   * @return {@code +1} when the sender is {@code lo}, {@code -1} when it is {@code hi}
   * @throws IllegalArgumentException if the sender is not a party
   */
  public static int direction(CanonicalPair pair, AccountId sender) {
    if (pair.lo().equals(sender)) {
      return 1;
    }
    if (pair.hi().equals(sender)) {
      return -1;
    }
    throw new IllegalArgumentException("sender is not a party of " + pair);
  }
}
