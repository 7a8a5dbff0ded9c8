/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.api;

import java.util.Objects;

/**
 * Order-independent address of a trust line.
 *
 * <p>{@code lo} always sorts strictly before {@code hi}; construct instances through {@code
 * Canonicalizer} rather than by hand when the role of each participant is not known.
 *
 * @param lo participant that sorts first
 * @param hi participant that sorts second
 */
public record CanonicalPair(AccountId lo, AccountId hi) implements Comparable<CanonicalPair> {
  public CanonicalPair {
    Objects.requireNonNull(lo, "lo");
    Objects.requireNonNull(hi, "hi");
    if (lo.compareTo(hi) >= 0) {
      throw new IllegalArgumentException("lo must sort strictly before hi");
    }
  }

  /**
   * Whether {@code account} is one of the two parties.
   *
   * @param account identity to test
   * @return {@code true} if it is {@code lo} or {@code hi}
   */
  public boolean contains(AccountId account) {
    return lo.equals(account) || hi.equals(account);
  }

  /**
   * The party opposite {@code account}.
   *
   * @param account one of the two parties
   * @return the other party
   * @throws IllegalArgumentException if {@code account} is not a party
   */
  public AccountId other(AccountId account) {
    if (lo.equals(account)) {
      return hi;
    }
    if (hi.equals(account)) {
      return lo;
    }
    throw new IllegalArgumentException("not a party of " + this);
  }

  @Override
  public int compareTo(CanonicalPair o) {
    int cmp = lo.compareTo(o.lo);
    return cmp != 0 ? cmp : hi.compareTo(o.hi);
  }

  @Override
  public String toString() {
    return lo + "/" + hi;
  }
}
